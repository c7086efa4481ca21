package org.apisrv.http.request;

import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpRequest;
import org.apisrv.http.response.ResponseSink;

/**
 * A request whose body has been read in full, or an upgrade request that skipped body reading.
 */
public record ReceivedRequest(HttpRequest head, byte[] body, ResponseSink sink, boolean upgrade) {

    public String method() {
        return head.method().name();
    }

    public String uri() {
        return head.uri();
    }

    public HttpHeaders headers() {
        return head.headers();
    }

}
