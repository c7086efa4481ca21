package org.apisrv.http.pipeline;

/**
 * Wraps whatever a resolved handler threw, so that it is answered with 500 regardless of
 * its type.
 */
class HandlerFailureException extends RuntimeException {

    HandlerFailureException(Throwable cause) {
        super(cause.getMessage(), cause);
    }

}
