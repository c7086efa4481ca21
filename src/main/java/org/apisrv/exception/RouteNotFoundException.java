package org.apisrv.exception;

public class RouteNotFoundException extends HttpException {

    public RouteNotFoundException(String detail) {
        super(404, detail);
    }

}
