package org.apisrv.http.pipeline;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ParamSource {

    BODY("request body"),
    QUERY("query string"),
    PATH("path template");

    private final String label;

}
