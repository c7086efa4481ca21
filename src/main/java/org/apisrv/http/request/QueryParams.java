package org.apisrv.http.request;

import io.netty.handler.codec.http.QueryStringDecoder;
import org.apisrv.exception.BadRequestException;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes {@code application/x-www-form-urlencoded} data, as found in query strings and
 * form bodies. Keys seen once map to a {@code String}, repeated keys to a
 * {@code List<String>} in order of appearance. A malformed escape is a
 * {@link BadRequestException}.
 */
public final class QueryParams {

    private static final int MAX_PARAMS = 1024;

    private QueryParams() {
    }

    public static Map<String, Object> parse(String encoded) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (encoded == null || encoded.isEmpty()) {
            return params;
        }
        QueryStringDecoder decoder = new QueryStringDecoder(encoded, StandardCharsets.UTF_8, false, MAX_PARAMS, true);
        Map<String, List<String>> decoded;
        try {
            decoded = decoder.parameters();
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Unable to parse query parameters.", e);
        }
        for (Map.Entry<String, List<String>> entry : decoded.entrySet()) {
            List<String> values = entry.getValue();
            params.put(entry.getKey(), values.size() == 1 ? values.get(0) : List.copyOf(values));
        }
        return params;
    }

}
