package org.apisrv.http.pipeline;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Handles a request once routing, authentication and parameter validation have passed.
 * The handler writes its response through the context.
 */
@FunctionalInterface
public interface RequestHandler {

    CompletionStage<?> handle(RequestContext context) throws Exception;

    /**
     * Adapts a handler that finishes its work before returning.
     */
    static RequestHandler sync(Blocking handler) {
        return context -> {
            handler.handle(context);
            return CompletableFuture.completedFuture(null);
        };
    }

    @FunctionalInterface
    interface Blocking {

        void handle(RequestContext context) throws Exception;

    }

}
