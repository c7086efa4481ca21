package org.apisrv.exception;

public class RequestTimeoutException extends HttpException {

    public RequestTimeoutException(String detail) {
        super(408, detail);
    }

}
