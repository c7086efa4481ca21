package org.apisrv.http.routing;

/**
 * One compiled component of a {@link PathTemplate}.
 */
public interface Segment {

    int DEFAULT_SPLAT_MIN = 1;
    int DEFAULT_SPLAT_MAX = 32;

    /**
     * Minimum number of request segments this component consumes.
     */
    int minItems();

    default boolean isCapture() {
        return false;
    }

    record Literal(String value) implements Segment {

        @Override
        public int minItems() {
            return 1;
        }

    }

    record Param(String name) implements Segment {

        @Override
        public int minItems() {
            return 1;
        }

        @Override
        public boolean isCapture() {
            return true;
        }

    }

    record Splat(String name, int minItems, int maxItems) implements Segment {

        public Splat {
            if (minItems < 1 || maxItems < minItems) {
                throw new IllegalArgumentException(
                        "Bad splat bounds for " + name + ": " + minItems + ".." + maxItems);
            }
        }

        @Override
        public boolean isCapture() {
            return true;
        }

    }

}
