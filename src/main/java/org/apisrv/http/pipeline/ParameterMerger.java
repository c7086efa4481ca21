package org.apisrv.http.pipeline;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merges body, query and path parameters in that order; later sources win.
 */
@Slf4j
public final class ParameterMerger {

    private ParameterMerger() {
    }

    public static void merge(RequestContext context) {
        Map<String, Object> merged = new LinkedHashMap<>();
        assign(context, merged, context.getBodyParams(), ParamSource.BODY);
        assign(context, merged, context.getUrlParams(), ParamSource.QUERY);
        assign(context, merged, context.getPathParams(), ParamSource.PATH);
        context.setParams(merged);
    }

    private static void assign(RequestContext context, Map<String, Object> target, Map<String, Object> source,
                               ParamSource sourceType) {
        if (source == null) {
            return;
        }
        Map<String, ParamSource> sources = context.getParamSources();
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            String key = entry.getKey();
            ParamSource previous = sources.get(key);
            if (target.containsKey(key) && previous != null && previous != sourceType) {
                ParamCollision collision = new ParamCollision(key, sourceType, previous);
                context.getParamCollisions().put(key, collision);
                log.warn(collision.describe());
            }
            target.put(key, entry.getValue());
            sources.put(key, sourceType);
        }
    }

}
