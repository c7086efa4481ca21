package org.apisrv.exception;

public class MethodNotAllowedException extends HttpException {

    public MethodNotAllowedException(String detail) {
        super(405, detail);
    }

}
