package org.apisrv.exception;

public class PayloadTooLargeException extends HttpException {

    public PayloadTooLargeException(String detail) {
        super(413, detail);
    }

}
