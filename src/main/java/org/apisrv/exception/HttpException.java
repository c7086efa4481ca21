package org.apisrv.exception;

import lombok.Getter;

/**
 * A request failure that maps to exactly one framework error response.
 */
@Getter
public class HttpException extends RuntimeException {

    private final int status;
    private final String detail;

    public HttpException(int status, String detail) {
        super(detail);
        this.status = status;
        this.detail = detail;
    }

    public HttpException(int status, String detail, Throwable cause) {
        super(detail, cause);
        this.status = status;
        this.detail = detail;
    }

}
