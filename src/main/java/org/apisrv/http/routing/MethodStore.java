package org.apisrv.http.routing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the routes registered for one method, split into capture-free
 * ({@code exact}) and capture-bearing ({@code dynamic}) templates keyed by the literal
 * template string. Mutations return a new snapshot; iteration order is registration order.
 */
record MethodStore(Map<String, RouteDefinition> exact, Map<String, RouteDefinition> dynamic) {

    static final MethodStore EMPTY = new MethodStore(Map.of(), Map.of());

    MethodStore with(RouteDefinition route) {
        String key = route.originalPath();
        if (route.template().isExact()) {
            return new MethodStore(put(exact, key, route), dynamic);
        }
        return new MethodStore(exact, put(dynamic, key, route));
    }

    MethodStore without(String path) {
        if (!contains(path)) {
            return this;
        }
        return new MethodStore(remove(exact, path), remove(dynamic, path));
    }

    boolean contains(String path) {
        return exact.containsKey(path) || dynamic.containsKey(path);
    }

    boolean isEmpty() {
        return exact.isEmpty() && dynamic.isEmpty();
    }

    Optional<RouteMatch> find(String path) {
        RouteDefinition route = exact.get(path);
        if (route != null) {
            return Optional.of(new RouteMatch(route, Map.of()));
        }
        if (path.length() > 1 && path.endsWith("/")) {
            route = exact.get(path.substring(0, path.length() - 1));
            if (route != null && !route.template().isHasTrailingSlash()) {
                return Optional.of(new RouteMatch(route, Map.of()));
            }
        }
        if (dynamic.isEmpty()) {
            return Optional.empty();
        }
        RequestPath requestPath = RequestPath.parse(path);
        for (RouteDefinition candidate : dynamic.values()) {
            Optional<Map<String, Object>> params = PathMatcher.match(candidate.template(), requestPath);
            if (params.isPresent()) {
                return Optional.of(new RouteMatch(candidate, params.get()));
            }
        }
        return Optional.empty();
    }

    private static Map<String, RouteDefinition> put(Map<String, RouteDefinition> source, String key,
                                                    RouteDefinition route) {
        Map<String, RouteDefinition> copy = new LinkedHashMap<>(source);
        copy.put(key, route);
        return Collections.unmodifiableMap(copy);
    }

    private static Map<String, RouteDefinition> remove(Map<String, RouteDefinition> source, String key) {
        if (!source.containsKey(key)) {
            return source;
        }
        Map<String, RouteDefinition> copy = new LinkedHashMap<>(source);
        copy.remove(key);
        return Collections.unmodifiableMap(copy);
    }

}
