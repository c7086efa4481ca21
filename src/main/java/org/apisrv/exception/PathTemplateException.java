package org.apisrv.exception;

public class PathTemplateException extends IllegalArgumentException {

    public PathTemplateException(String message) {
        super(message);
    }

}
