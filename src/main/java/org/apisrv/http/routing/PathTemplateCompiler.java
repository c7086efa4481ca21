package org.apisrv.http.routing;

import org.apisrv.exception.PathTemplateException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns template strings such as {@code /users/{id}/files/[path:1:8]} into
 * {@link PathTemplate}s.
 */
public final class PathTemplateCompiler {

    private static final String IDENTIFIER = "[A-Za-z_][A-Za-z0-9_]*";
    private static final Pattern PARAM = Pattern.compile("^\\{(" + IDENTIFIER + ")}$");
    private static final Pattern SPLAT = Pattern.compile("^\\[(" + IDENTIFIER + ")(?::(\\d+)(?::(\\d+))?)?]$");

    private PathTemplateCompiler() {
    }

    public static PathTemplate compile(String template) {
        if (template == null || !template.startsWith("/")) {
            throw new PathTemplateException("Bad request handler path: " + template);
        }
        if (template.equals("/")) {
            return new PathTemplate(template, List.of(), false);
        }
        boolean hasTrailingSlash = template.endsWith("/");
        String trimmed = hasTrailingSlash ? template.substring(0, template.length() - 1) : template;

        List<Segment> segments = new ArrayList<>();
        for (String part : trimmed.substring(1).split("/", -1)) {
            segments.add(compileSegment(template, part));
        }
        return new PathTemplate(template, segments, hasTrailingSlash);
    }

    private static Segment compileSegment(String template, String part) {
        Matcher param = PARAM.matcher(part);
        if (param.matches()) {
            return new Segment.Param(param.group(1));
        }
        Matcher splat = SPLAT.matcher(part);
        if (splat.matches()) {
            int min = Segment.DEFAULT_SPLAT_MIN;
            int max = Segment.DEFAULT_SPLAT_MAX;
            if (splat.group(2) != null) {
                min = parseBound(template, splat.group(2));
                max = splat.group(3) != null ? parseBound(template, splat.group(3)) : min;
            }
            if (min < 1 || max < min) {
                throw new PathTemplateException(
                        "Bad splat bounds " + min + ".." + max + " in path template " + template);
            }
            return new Segment.Splat(splat.group(1), min, max);
        }
        if (part.startsWith("{") || part.endsWith("}") || part.startsWith("[") || part.endsWith("]")) {
            throw new PathTemplateException("Malformed capture '" + part + "' in path template " + template);
        }
        return new Segment.Literal(part);
    }

    private static int parseBound(String template, String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new PathTemplateException("Splat bound out of range in path template " + template);
        }
    }

}
