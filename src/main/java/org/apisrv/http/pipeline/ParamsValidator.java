package org.apisrv.http.pipeline;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Validates and optionally transforms one parameter object.
 * <p>
 * Throwing, or completing exceptionally, rejects the request with 400 and the error's
 * message. Completing with {@code null} is a server-side defect and yields 500.
 */
@FunctionalInterface
public interface ParamsValidator {

    CompletionStage<Map<String, Object>> validate(Map<String, Object> params) throws Exception;

    static ParamsValidator sync(Blocking validator) {
        return params -> CompletableFuture.completedFuture(validator.validate(params));
    }

    @FunctionalInterface
    interface Blocking {

        Map<String, Object> validate(Map<String, Object> params) throws Exception;

    }

}
