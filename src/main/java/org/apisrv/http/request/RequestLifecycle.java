package org.apisrv.http.request;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import lombok.extern.slf4j.Slf4j;
import org.apisrv.exception.BadRequestException;
import org.apisrv.exception.HttpException;
import org.apisrv.exception.PayloadTooLargeException;
import org.apisrv.exception.RequestTimeoutException;

import java.io.ByteArrayOutputStream;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * Accumulates one request body under a size limit and a read deadline.
 * <p>
 * The lifecycle starts in {@link State#READING} and moves to {@link State#COMPLETED}
 * exactly once, through whichever terminal event comes first: a guard violation, an
 * overflowing chunk, the deadline, a transport error or the end of the stream. Later
 * events are ignored and the deadline is canceled on completion. Event methods are
 * synchronized so that a deadline firing on another thread never interleaves with a chunk.
 */
@Slf4j
public class RequestLifecycle {

    public enum State {
        READING,
        COMPLETED
    }

    /**
     * Receives the single outcome of a lifecycle.
     */
    public interface Listener {

        void completed(byte[] body);

        /**
         * @param destroy whether the transport must be torn down without reading further
         */
        void failed(HttpException error, boolean destroy);

    }

    private static final Pattern NON_NEGATIVE_INTEGER = Pattern.compile("\\d+");

    private final long maxBodySize;
    private final Listener listener;
    private final AtomicReference<State> state = new AtomicReference<>(State.READING);

    private ByteArrayOutputStream body = new ByteArrayOutputStream();
    private long bodySize;
    private Long declaredLength;
    private volatile ScheduledFuture<?> timer;

    /**
     * @param maxBodySize largest accepted body in bytes, {@code 0} for no limit
     */
    public RequestLifecycle(long maxBodySize, Listener listener) {
        this.maxBodySize = maxBodySize;
        this.listener = listener;
    }

    /**
     * Checks the framing headers and, if they pass, arms the read deadline.
     */
    public synchronized void begin(HttpHeaders headers, ScheduledExecutorService scheduler, long timeoutMs) {
        String contentLength = headers.get(HttpHeaderNames.CONTENT_LENGTH);
        if (headers.contains(HttpHeaderNames.TRANSFER_ENCODING) && contentLength != null) {
            fail(new BadRequestException("Both Transfer-Encoding and Content-Length defined."), false);
            return;
        }
        if (contentLength != null) {
            String trimmed = contentLength.trim();
            if (!NON_NEGATIVE_INTEGER.matcher(trimmed).matches()) {
                fail(new BadRequestException("Bad Content-Length header."), false);
                return;
            }
            try {
                declaredLength = Long.parseLong(trimmed);
            } catch (NumberFormatException e) {
                fail(new BadRequestException("Bad Content-Length header."), false);
                return;
            }
            if (exceedsLimit(declaredLength)) {
                fail(new PayloadTooLargeException("Request body too large."), true);
                return;
            }
        }
        ScheduledFuture<?> armed = scheduler.schedule(this::onTimeout, timeoutMs, TimeUnit.MILLISECONDS);
        timer = armed;
        if (isCompleted()) {
            armed.cancel(false);
        }
    }

    public synchronized void onData(byte[] chunk) {
        if (isCompleted()) {
            return;
        }
        bodySize += chunk.length;
        if (declaredLength != null && bodySize > declaredLength) {
            fail(new BadRequestException("Request body longer than Content-Length."), true);
            return;
        }
        if (exceedsLimit(bodySize)) {
            fail(new PayloadTooLargeException("Request body too large."), true);
            return;
        }
        body.write(chunk, 0, chunk.length);
    }

    public synchronized void onEnd() {
        if (!finish()) {
            return;
        }
        byte[] assembled = body.toByteArray();
        body = null;
        if (declaredLength != null && assembled.length != declaredLength) {
            listener.failed(new BadRequestException("Request body length does not match Content-Length."), false);
            return;
        }
        listener.completed(assembled);
    }

    public synchronized void onError(Throwable cause) {
        if (finish()) {
            log.debug("Error while reading request body", cause);
            body = null;
            listener.failed(new BadRequestException("Error occured while reading the request data."), false);
        }
    }

    /**
     * Ends the lifecycle without an outcome, for a transport that went away.
     */
    public synchronized void cancel() {
        if (finish()) {
            body = null;
        }
    }

    synchronized void onTimeout() {
        if (finish()) {
            body = null;
            listener.failed(new RequestTimeoutException("Timeout occured while reading the request data."), false);
        }
    }

    public State getState() {
        return state.get();
    }

    public boolean isCompleted() {
        return state.get() == State.COMPLETED;
    }

    public long getBodySize() {
        return bodySize;
    }

    private void fail(HttpException error, boolean destroy) {
        if (finish()) {
            body = null;
            listener.failed(error, destroy);
        }
    }

    private boolean finish() {
        if (!state.compareAndSet(State.READING, State.COMPLETED)) {
            return false;
        }
        ScheduledFuture<?> armed = timer;
        if (armed != null) {
            armed.cancel(false);
        }
        return true;
    }

    private boolean exceedsLimit(long size) {
        return maxBodySize > 0 && size > maxBodySize;
    }

}
