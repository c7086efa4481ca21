package org.apisrv.http.request;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import lombok.RequiredArgsConstructor;
import org.apisrv.common.HttpMethod;
import org.apisrv.exception.BadRequestException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decides where a request's parameters may come from and decodes them.
 * GET and DELETE carry parameters in the query string only, POST and PUT in a JSON or
 * form-encoded body only.
 */
@RequiredArgsConstructor
public class ContentNegotiator {

    static final String FORM_URLENCODED = "application/x-www-form-urlencoded";
    static final String LEGACY_FORM_URLENCODED = "application/www-form-urlencoded";
    static final String JSON = "application/json";

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * Rejects query strings on methods whose parameters travel in the body.
     */
    public void checkQueryPlacement(HttpMethod method, String rawUrl) {
        if (method.carriesBody() && rawUrl.indexOf('?') >= 0) {
            throw new BadRequestException("URL for POST or PUT must not contain query parameters.");
        }
    }

    public Map<String, Object> urlParams(HttpMethod method, String rawUrl) {
        checkQueryPlacement(method, rawUrl);
        int query = rawUrl.indexOf('?');
        return query >= 0 ? QueryParams.parse(rawUrl.substring(query + 1)) : new LinkedHashMap<>();
    }

    /**
     * Decodes the body of a POST or PUT request; for GET and DELETE only checks that the
     * body is empty and returns {@code null}.
     */
    public Map<String, Object> bodyParams(HttpMethod method, HttpHeaders headers, byte[] body) {
        ContentType contentType = contentType(headers);
        if (!method.carriesBody()) {
            if (body.length > 0) {
                throw new BadRequestException("Empty body required for " + method + " requests.");
            }
            return null;
        }
        String mediaType = contentType != null ? contentType.mediaType() : "";
        switch (mediaType) {
            case FORM_URLENCODED:
            case LEGACY_FORM_URLENCODED:
                return QueryParams.parse(new String(body, StandardCharsets.UTF_8));
            case JSON:
                String charset = contentType.parameter("charset");
                if (charset != null && !charset.equals("utf-8")) {
                    throw new BadRequestException("Bad charset for JSON content type.");
                }
                return parseJsonObject(body);
            default:
                throw new BadRequestException("POST or PUT body must be in JSON or www-form-urlencoded format.");
        }
    }

    private ContentType contentType(HttpHeaders headers) {
        String header = headers.get(HttpHeaderNames.CONTENT_TYPE);
        if (header == null || header.isBlank()) {
            return null;
        }
        return ContentType.parse(header)
                .orElseThrow(() -> new BadRequestException("Unable to parse content-type."));
    }

    private Map<String, Object> parseJsonObject(byte[] body) {
        JsonNode root;
        try {
            root = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).readTree(body);
        } catch (IOException e) {
            throw new BadRequestException("Unable to parse JSON query parameters.", e);
        }
        if (root == null || !root.isObject()) {
            throw new BadRequestException("Unable to parse JSON query parameters.");
        }
        return objectMapper.convertValue(root, OBJECT_TYPE);
    }

}
