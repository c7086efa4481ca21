package org.apisrv.exception;

public class InvalidValidatorResultException extends HttpException {

    public InvalidValidatorResultException(String detail) {
        super(500, detail);
    }

}
