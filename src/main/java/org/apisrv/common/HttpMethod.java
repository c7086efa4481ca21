package org.apisrv.common;

import java.util.Locale;

public enum HttpMethod {

    GET,
    POST,
    PUT,
    DELETE;

    /**
     * Resolves a verb case-insensitively.
     *
     * @throws IllegalArgumentException if the verb is not one of GET, POST, PUT or DELETE
     */
    public static HttpMethod parse(String method) {
        if (method == null) {
            throw new IllegalArgumentException("Bad request handler method: null");
        }
        HttpMethod resolved = find(method);
        if (resolved == null) {
            throw new IllegalArgumentException("Unsupported request handler method: " + method);
        }
        return resolved;
    }

    public static HttpMethod find(String method) {
        String upper = method.toUpperCase(Locale.ROOT);
        for (HttpMethod candidate : values()) {
            if (candidate.name().equals(upper)) {
                return candidate;
            }
        }
        return null;
    }

    public boolean carriesBody() {
        return this == POST || this == PUT;
    }

}
