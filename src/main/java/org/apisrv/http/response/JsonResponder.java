package org.apisrv.http.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apisrv.common.HttpStatusMessages;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializes success payloads and framework error bodies to JSON.
 */
@Slf4j
public class JsonResponder {

    public static final String JSON_CONTENT_TYPE = "application/json; charset=utf-8";

    private static final Map<String, String> NO_CACHE_HEADERS = Map.of(
            "Cache-Control", "no-store, no-cache, must-revalidate, post-check=0, pre-check=0",
            "Expires", "Wed, 01 Jan 2020 12:00:00 GMT",
            "Pragma", "no-cache"
    );

    @Getter
    private final ObjectMapper objectMapper;
    private final boolean prettyPrint;

    public JsonResponder(ObjectMapper objectMapper, boolean prettyPrint) {
        this.objectMapper = objectMapper;
        this.prettyPrint = prettyPrint;
    }

    public boolean success(ResponseSink sink, Object data, int status, boolean excludeNoCacheHeaders) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", JSON_CONTENT_TYPE);
        if (!excludeNoCacheHeaders) {
            headers.putAll(NO_CACHE_HEADERS);
        }
        byte[] body;
        try {
            if (prettyPrint) {
                String json = objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(data);
                body = (json + "\n").getBytes(StandardCharsets.UTF_8);
            } else {
                body = objectMapper.writeValueAsBytes(data);
            }
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Response data is not serializable: " + e.getMessage(), e);
        }
        return sink.send(status, headers, body);
    }

    /**
     * Writes {@code {"code":..,"message":..}} with the canonical phrase for {@code code}.
     */
    public boolean error(ResponseSink sink, int code, String detail) {
        ErrorResponse error = new ErrorResponse(code, HttpStatusMessages.describe(code, detail));
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(error);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize error response", e);
        }
        log.debug("Responding {} ({})", code, detail);
        return sink.send(code, Map.of("Content-Type", JSON_CONTENT_TYPE), body);
    }

}
