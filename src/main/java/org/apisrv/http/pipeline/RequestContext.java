package org.apisrv.http.pipeline;

import io.netty.handler.codec.http.HttpHeaders;
import lombok.Getter;
import lombok.Setter;
import org.apisrv.http.response.JsonResponder;
import org.apisrv.http.response.ResponseSink;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * State of one request as it moves through the pipeline. Parameter maps stay
 * {@code null} until their stage has run.
 */
@Getter
public class RequestContext {

    private final String method;
    private final String rawUrl;
    private final String url;
    private final HttpHeaders headers;
    private final byte[] body;
    private final ResponseSink sink;
    @Getter(lombok.AccessLevel.NONE)
    private final JsonResponder responder;

    @Setter
    private Map<String, Object> bodyParams;
    @Setter
    private Map<String, Object> urlParams;
    @Setter
    private Map<String, Object> pathParams;
    @Setter
    private Map<String, Object> params;

    private final Map<String, ParamSource> paramSources = new HashMap<>();
    private final Map<String, ParamCollision> paramCollisions = new LinkedHashMap<>();

    public RequestContext(String method, String rawUrl, HttpHeaders headers, byte[] body, ResponseSink sink,
                          JsonResponder responder) {
        this.method = method;
        this.rawUrl = rawUrl;
        int query = rawUrl.indexOf('?');
        this.url = query >= 0 ? rawUrl.substring(0, query) : rawUrl;
        this.headers = headers;
        this.body = body;
        this.sink = sink;
        this.responder = responder;
    }

    public boolean hasQueryString() {
        return rawUrl.indexOf('?') >= 0;
    }

    public String getQueryString() {
        int query = rawUrl.indexOf('?');
        return query >= 0 ? rawUrl.substring(query + 1) : "";
    }

    public void jsonResponse(Object data) {
        jsonResponse(data, 200, false);
    }

    public void jsonResponse(Object data, int status) {
        jsonResponse(data, status, false);
    }

    /**
     * Writes {@code data} as JSON. Unless excluded, the response carries headers that
     * forbid caching.
     */
    public void jsonResponse(Object data, int status, boolean excludeNoCacheHeaders) {
        responder.success(sink, data, status, excludeNoCacheHeaders);
    }

    public void errorResponse(int status, String detail) {
        responder.error(sink, status, detail);
    }

}
