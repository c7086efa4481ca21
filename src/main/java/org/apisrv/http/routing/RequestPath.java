package org.apisrv.http.routing;

import org.apisrv.exception.BadRequestException;

import java.util.List;

/**
 * A request path split into raw (still percent-encoded) segments.
 */
public record RequestPath(List<String> segments, boolean hasTrailingSlash) {

    public static RequestPath parse(String path) {
        if (path == null || !path.startsWith("/")) {
            throw new BadRequestException("Bad request path: " + path);
        }
        if (path.equals("/")) {
            return new RequestPath(List.of(), false);
        }
        boolean hasTrailingSlash = path.endsWith("/");
        String trimmed = hasTrailingSlash ? path.substring(0, path.length() - 1) : path;
        if (trimmed.equals("/") || trimmed.isEmpty()) {
            return new RequestPath(List.of(), true);
        }
        return new RequestPath(List.of(trimmed.substring(1).split("/", -1)), hasTrailingSlash);
    }

    public int size() {
        return segments.size();
    }

}
