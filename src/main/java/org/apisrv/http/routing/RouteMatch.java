package org.apisrv.http.routing;

import java.util.Map;

public record RouteMatch(RouteDefinition route, Map<String, Object> pathParams) {
}
