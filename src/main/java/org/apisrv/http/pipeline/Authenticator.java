package org.apisrv.http.pipeline;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Gate run before any parameter is parsed. A denying authenticator writes its own
 * response through the context.
 */
@FunctionalInterface
public interface Authenticator {

    Authenticator ALLOW_ALL = context -> CompletableFuture.completedFuture(true);

    CompletionStage<Boolean> authenticate(RequestContext context) throws Exception;

    static Authenticator sync(Blocking authenticator) {
        return context -> CompletableFuture.completedFuture(authenticator.authenticate(context));
    }

    @FunctionalInterface
    interface Blocking {

        boolean authenticate(RequestContext context) throws Exception;

    }

}
