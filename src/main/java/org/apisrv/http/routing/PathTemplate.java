package org.apisrv.http.routing;

import lombok.Getter;

import java.util.List;

/**
 * A compiled route template. Instances are produced by {@link PathTemplateCompiler} and
 * never change afterwards.
 */
@Getter
public final class PathTemplate {

    private final String template;
    private final List<Segment> segments;
    private final boolean exact;
    private final boolean hasSplat;
    private final boolean hasTrailingSlash;
    @Getter(lombok.AccessLevel.NONE)
    private final int[] minSegmentsFrom;

    PathTemplate(String template, List<Segment> segments, boolean hasTrailingSlash) {
        this.template = template;
        this.segments = List.copyOf(segments);
        this.hasTrailingSlash = hasTrailingSlash;
        this.exact = this.segments.stream().noneMatch(Segment::isCapture);
        this.hasSplat = this.segments.stream().anyMatch(Segment.Splat.class::isInstance);
        this.minSegmentsFrom = new int[this.segments.size() + 1];
        for (int i = this.segments.size() - 1; i >= 0; i--) {
            minSegmentsFrom[i] = minSegmentsFrom[i + 1] + this.segments.get(i).minItems();
        }
    }

    /**
     * Minimum number of request segments needed to satisfy segments {@code [index..end)}.
     */
    public int minSegmentsFrom(int index) {
        return minSegmentsFrom[index];
    }

    public int minSegments() {
        return minSegmentsFrom[0];
    }

    @Override
    public String toString() {
        return template;
    }

}
