package org.apisrv.http.routing;

import org.apisrv.common.HttpMethod;
import org.apisrv.http.pipeline.RequestHandler;

public record RouteDefinition(HttpMethod method, PathTemplate template, RequestHandler handler,
                              HandlerOptions options) {

    public String originalPath() {
        return template.getTemplate();
    }

}
