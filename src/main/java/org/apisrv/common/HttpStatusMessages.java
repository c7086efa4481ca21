package org.apisrv.common;

import java.util.Map;

public final class HttpStatusMessages {

    private static final Map<Integer, String> MESSAGES = Map.ofEntries(
            Map.entry(400, "Bad Request"),
            Map.entry(401, "Unauthorized"),
            Map.entry(403, "Forbidden"),
            Map.entry(404, "Not Found"),
            Map.entry(405, "Method Not Allowed"),
            Map.entry(406, "Not Acceptable"),
            Map.entry(408, "Request Timeout"),
            Map.entry(409, "Conflict"),
            Map.entry(413, "Payload Too Large"),
            Map.entry(415, "Unsupported Media Type"),
            Map.entry(429, "Too Many Requests"),
            Map.entry(500, "Internal Server Error"),
            Map.entry(501, "Not Implemented"),
            Map.entry(503, "Service Unavailable")
    );

    private HttpStatusMessages() {
    }

    public static String canonical(int code) {
        return MESSAGES.getOrDefault(code, "Error");
    }

    /**
     * Builds the message of a framework error body. Only 400 responses carry a detail,
     * appended in parentheses with trailing periods removed.
     */
    public static String describe(int code, String detail) {
        String canonical = canonical(code);
        if (code != 400 || detail == null) {
            return canonical;
        }
        String trimmed = detail.trim().replaceAll("\\.+$", "");
        return trimmed.isEmpty() ? canonical : canonical + " (" + trimmed + ")";
    }

}
