package org.apisrv.http.response;

import java.util.Map;

/**
 * Where a request's single response goes. Implementations accept the first response and
 * ignore every later one.
 */
public interface ResponseSink {

    /**
     * Writes a complete response.
     *
     * @return {@code false} if a response was already written for this request
     */
    boolean send(int status, Map<String, String> headers, byte[] body);

    boolean isCommitted();

    /**
     * Tears down the underlying connection without reading anything further from it.
     */
    void abort();

}
