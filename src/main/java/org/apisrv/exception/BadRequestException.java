package org.apisrv.exception;

public class BadRequestException extends HttpException {

    public BadRequestException(String detail) {
        super(400, detail);
    }

    public BadRequestException(String detail, Throwable cause) {
        super(400, detail, cause);
    }

}
