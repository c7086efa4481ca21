package org.apisrv.http.pipeline;

/**
 * Records that {@code key} from {@code source} replaced the value taken from {@code overridden}.
 */
public record ParamCollision(String key, ParamSource source, ParamSource overridden) {

    public String describe() {
        return "Parameter \"" + key + "\" from " + source.getLabel() + " overrides value from "
                + overridden.getLabel() + ".";
    }

}
