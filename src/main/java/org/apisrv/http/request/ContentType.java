package org.apisrv.http.request;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed {@code Content-Type} header. The media type, parameter names and parameter
 * values are lower-cased; quoted values are unquoted.
 */
public record ContentType(String mediaType, Map<String, String> parameters) {

    private static final Pattern PARAMETER =
            Pattern.compile("^([!#$%&'*+.^_`|~0-9A-Za-z-]+)=(\"(?:[^\"\\\\]|\\\\.)*\"|[^\\s;]+)$");

    public static Optional<ContentType> parse(String header) {
        String[] parts = header.split(";");
        String mediaType = null;
        Map<String, String> parameters = new HashMap<>();
        for (String rawPart : parts) {
            String part = rawPart.trim();
            if (part.isEmpty()) {
                continue;
            }
            if (mediaType == null) {
                mediaType = part.toLowerCase(Locale.ROOT);
                continue;
            }
            Matcher matcher = PARAMETER.matcher(part);
            if (!matcher.matches()) {
                return Optional.empty();
            }
            String value = matcher.group(2);
            if (value.startsWith("\"")) {
                value = value.substring(1, value.length() - 1);
            }
            parameters.put(matcher.group(1).toLowerCase(Locale.ROOT), value.toLowerCase(Locale.ROOT));
        }
        if (mediaType == null) {
            return Optional.empty();
        }
        return Optional.of(new ContentType(mediaType, Map.copyOf(parameters)));
    }

    public String parameter(String name) {
        return parameters.get(name);
    }

}
