package org.apisrv.http.routing;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Matches a {@link PathTemplate} against a {@link RequestPath}.
 * <p>
 * Splat segments are resolved by iterative backtracking over an explicit stack of
 * capture choices. Each splat tries its lengths in ascending order and the first length
 * that lets the rest of the template match wins. Exhausted (segment, offset) states are
 * remembered so that no state is explored twice.
 * <p>
 * Bound values are percent-decoded: {@code String} for single-segment captures and
 * {@code List<String>} for splats. A segment that cannot be decoded never matches.
 */
public final class PathMatcher {

    private PathMatcher() {
    }

    public static Optional<Map<String, Object>> match(PathTemplate template, RequestPath path) {
        if (template.isHasTrailingSlash() && !path.hasTrailingSlash()) {
            return Optional.empty();
        }
        if (path.size() < template.minSegments()) {
            return Optional.empty();
        }
        if (!template.isHasSplat() && path.size() != template.getSegments().size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(new Attempt(template, path.segments()).run());
    }

    private static final class Attempt {

        private static final int UNKNOWN = 0;
        private static final int DECODED = 1;
        private static final int UNDECODABLE = 2;

        private final PathTemplate template;
        private final List<Segment> segments;
        private final List<String> raw;
        private final String[] decoded;
        private final int[] decodeState;
        private final boolean[] deadEnds;
        // {segment index, request offset, chosen length, max length}
        private final Deque<int[]> choices = new ArrayDeque<>();

        Attempt(PathTemplate template, List<String> raw) {
            this.template = template;
            this.segments = template.getSegments();
            this.raw = raw;
            this.decoded = new String[raw.size()];
            this.decodeState = new int[raw.size()];
            this.deadEnds = new boolean[(segments.size() + 1) * (raw.size() + 1)];
        }

        Map<String, Object> run() {
            int available = raw.size();
            int t = 0;
            int r = 0;
            while (true) {
                boolean advanced = false;
                if (t == segments.size()) {
                    if (r == available) {
                        return bindings();
                    }
                } else {
                    Segment segment = segments.get(t);
                    if (segment instanceof Segment.Literal literal) {
                        advanced = r < available && literal.value().equals(raw.get(r));
                    } else if (segment instanceof Segment.Param) {
                        advanced = r < available && decodedAt(r) != null;
                    } else {
                        Segment.Splat splat = (Segment.Splat) segment;
                        int maxLen = Math.min(splat.maxItems(), available - r - template.minSegmentsFrom(t + 1));
                        if (!isDeadEnd(t, r) && maxLen >= splat.minItems() && decodesAll(r, splat.minItems())) {
                            choices.push(new int[]{t, r, splat.minItems(), maxLen});
                            t++;
                            r += splat.minItems();
                            continue;
                        }
                        markDeadEnd(t, r);
                    }
                    if (advanced) {
                        t++;
                        r++;
                        continue;
                    }
                }
                int[] resumed = backtrack();
                if (resumed == null) {
                    return null;
                }
                t = resumed[0] + 1;
                r = resumed[1] + resumed[2];
            }
        }

        private int[] backtrack() {
            while (!choices.isEmpty()) {
                int[] choice = choices.peek();
                int next = choice[2] + 1;
                if (next <= choice[3] && decodedAt(choice[1] + next - 1) != null) {
                    choice[2] = next;
                    return choice;
                }
                choices.pop();
                markDeadEnd(choice[0], choice[1]);
            }
            return null;
        }

        private Map<String, Object> bindings() {
            Map<String, Object> bound = new LinkedHashMap<>();
            Iterator<int[]> splats = choices.descendingIterator();
            int r = 0;
            for (Segment segment : segments) {
                if (segment instanceof Segment.Param param) {
                    bound.put(param.name(), decodedAt(r));
                    r++;
                } else if (segment instanceof Segment.Splat splat) {
                    int length = splats.next()[2];
                    List<String> values = new ArrayList<>(length);
                    for (int i = r; i < r + length; i++) {
                        values.add(decodedAt(i));
                    }
                    bound.put(splat.name(), List.copyOf(values));
                    r += length;
                } else {
                    r++;
                }
            }
            return bound;
        }

        private boolean decodesAll(int from, int count) {
            for (int i = from; i < from + count; i++) {
                if (decodedAt(i) == null) {
                    return false;
                }
            }
            return true;
        }

        private String decodedAt(int index) {
            if (decodeState[index] == UNKNOWN) {
                decoded[index] = PathSegmentDecoder.decode(raw.get(index));
                decodeState[index] = decoded[index] != null ? DECODED : UNDECODABLE;
            }
            return decoded[index];
        }

        private boolean isDeadEnd(int t, int r) {
            return deadEnds[t * (raw.size() + 1) + r];
        }

        private void markDeadEnd(int t, int r) {
            deadEnds[t * (raw.size() + 1) + r] = true;
        }

    }

}
