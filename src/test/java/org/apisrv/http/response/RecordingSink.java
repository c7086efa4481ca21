package org.apisrv.http.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Captures responses in memory. Like a real sink it accepts only the first one, but it
 * counts every attempt.
 */
public class RecordingSink implements ResponseSink {

    public record Sent(int status, Map<String, String> headers, byte[] body) {

        public String text() {
            return new String(body, StandardCharsets.UTF_8);
        }

        public JsonNode json() {
            try {
                return new ObjectMapper().readTree(body);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

    }

    private final List<Sent> accepted = new CopyOnWriteArrayList<>();
    private final List<Integer> attempts = new CopyOnWriteArrayList<>();
    private final AtomicBoolean aborted = new AtomicBoolean();

    @Override
    public boolean send(int status, Map<String, String> headers, byte[] body) {
        attempts.add(status);
        if (!accepted.isEmpty()) {
            return false;
        }
        accepted.add(new Sent(status, Map.copyOf(headers), body));
        return true;
    }

    @Override
    public boolean isCommitted() {
        return !accepted.isEmpty();
    }

    @Override
    public void abort() {
        aborted.set(true);
    }

    public Sent only() {
        if (accepted.size() != 1) {
            throw new AssertionError("Expected one response but got " + accepted.size());
        }
        return accepted.get(0);
    }

    public List<Sent> accepted() {
        return accepted;
    }

    public List<Integer> attempts() {
        return attempts;
    }

    public boolean isAborted() {
        return aborted.get();
    }

}
