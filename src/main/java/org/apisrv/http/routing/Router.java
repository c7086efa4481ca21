package org.apisrv.http.routing;

import lombok.extern.slf4j.Slf4j;
import org.apisrv.common.HttpMethod;
import org.apisrv.http.pipeline.RequestHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registry of request handlers, one {@link MethodStore} per method.
 * <p>
 * Safe for concurrent use: each method's store is replaced as a whole on every
 * {@code add} or {@code delete}, so a lookup sees either the old or the new snapshot.
 */
@Slf4j
public class Router {

    public static final String ANY_METHOD = "*";

    private final Map<HttpMethod, MethodStore> stores = new ConcurrentHashMap<>();

    public RouteDefinition add(String method, String template, RequestHandler handler) {
        return add(method, template, handler, null);
    }

    /**
     * Registers a handler, replacing any handler already registered for the same method
     * and literal template.
     *
     * @throws IllegalArgumentException for an unsupported method, a missing handler or a bad template
     */
    public RouteDefinition add(String method, String template, RequestHandler handler, HandlerOptions options) {
        HttpMethod httpMethod = HttpMethod.parse(method);
        if (handler == null) {
            throw new IllegalArgumentException("Bad request handler callback for " + httpMethod + " " + template);
        }
        PathTemplate compiled = PathTemplateCompiler.compile(template);
        RouteDefinition route = new RouteDefinition(httpMethod, compiled, handler,
                options != null ? options : HandlerOptions.NONE);
        stores.compute(httpMethod, (key, store) -> (store != null ? store : MethodStore.EMPTY).with(route));
        log.debug("Registered {} {} ({})", httpMethod, template, compiled.isExact() ? "exact" : "dynamic");
        return route;
    }

    /**
     * Removes the handler registered for the literal template {@code path}. The method
     * {@value #ANY_METHOD} removes it from every method.
     *
     * @return whether anything was removed
     */
    public boolean delete(String method, String path) {
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("Bad request handler path: " + path);
        }
        if (ANY_METHOD.equals(method)) {
            boolean removed = false;
            for (HttpMethod httpMethod : HttpMethod.values()) {
                removed = deleteFrom(httpMethod, path) || removed;
            }
            return removed;
        }
        return deleteFrom(HttpMethod.parse(method), path);
    }

    private boolean deleteFrom(HttpMethod method, String path) {
        AtomicBoolean removed = new AtomicBoolean();
        stores.computeIfPresent(method, (key, store) -> {
            MethodStore updated = store.without(path);
            removed.set(updated != store);
            return updated.isEmpty() ? null : updated;
        });
        if (removed.get()) {
            log.debug("Removed {} {}", method, path);
        }
        return removed.get();
    }

    /**
     * Finds the handler for {@code path}: exact templates first, then dynamic templates in
     * registration order.
     */
    public Optional<RouteMatch> findRoute(HttpMethod method, String path) {
        MethodStore store = stores.get(method);
        if (store == null) {
            return Optional.empty();
        }
        return store.find(path);
    }

    public boolean hasOtherMethodMatch(HttpMethod method, String path) {
        for (Map.Entry<HttpMethod, MethodStore> entry : stores.entrySet()) {
            if (entry.getKey() != method && entry.getValue().find(path).isPresent()) {
                return true;
            }
        }
        return false;
    }

    public List<RouteDefinition> getRoutes() {
        List<RouteDefinition> routes = new ArrayList<>();
        for (HttpMethod method : HttpMethod.values()) {
            MethodStore store = stores.get(method);
            if (store != null) {
                routes.addAll(store.exact().values());
                routes.addAll(store.dynamic().values());
            }
        }
        return routes;
    }

}
