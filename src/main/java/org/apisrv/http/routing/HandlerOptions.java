package org.apisrv.http.routing;

import lombok.Builder;
import lombok.Getter;
import org.apisrv.http.pipeline.ParamsValidator;

/**
 * Per-route validators and switches. Every validator is optional.
 */
@Getter
@Builder
public class HandlerOptions {

    public static final HandlerOptions NONE = HandlerOptions.builder().build();

    private final ParamsValidator pathParamsValidator;
    private final ParamsValidator urlParamsValidator;
    private final ParamsValidator bodyParamsValidator;
    private final ParamsValidator paramsValidator;
    private final boolean ignoreUrlParams;

}
