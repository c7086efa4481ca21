package org.apisrv.server;

import lombok.Builder;
import lombok.Getter;
import org.apisrv.exception.ConfigurationException;
import org.apisrv.http.pipeline.Authenticator;
import org.apisrv.http.pipeline.RequestHandler;
import org.apisrv.http.pipeline.UpgradeHandler;

import java.util.Map;
import java.util.concurrent.ExecutorService;

@Getter
@Builder(toBuilder = true)
public class ServerOptions {

    public static final long DEFAULT_BODY_READ_TIMEOUT_MS = 2_000;
    public static final long DEFAULT_MAX_BODY_SIZE = 1024 * 1024;

    /**
     * Listening port; {@code 0} binds an ephemeral port.
     */
    private final int port;
    private final String address;
    private final String keyFile;
    private final String certFile;
    @Builder.Default
    private final long bodyReadTimeoutMs = DEFAULT_BODY_READ_TIMEOUT_MS;
    /**
     * Largest accepted request body in bytes; {@code 0} disables the limit.
     */
    @Builder.Default
    private final long maxBodySize = DEFAULT_MAX_BODY_SIZE;
    private final boolean prettyPrintJsonResponses;
    private final boolean debug;
    private final Authenticator authenticator;
    private final RequestHandler fallbackHandler;
    private final UpgradeHandler upgradeHandler;
    /**
     * Method → (path template → handler), registered when the server is constructed.
     */
    private final Map<String, Map<String, RequestHandler>> requestHandlers;
    /**
     * Runs request pipelines; the server creates and owns a cached pool when absent.
     */
    private final ExecutorService executor;

    public ServerOptions validate() {
        if (port < 0 || port > 65535) {
            throw new ConfigurationException("Bad port: " + port);
        }
        if (keyFile != null && certFile == null) {
            throw new ConfigurationException("Key defined without cert");
        }
        if (certFile != null && keyFile == null) {
            throw new ConfigurationException("Cert defined without key");
        }
        if (bodyReadTimeoutMs <= 0) {
            throw new ConfigurationException("Bad bodyReadTimeoutMs: " + bodyReadTimeoutMs);
        }
        if (maxBodySize < 0) {
            throw new ConfigurationException("Bad maxBodySize: " + maxBodySize);
        }
        return this;
    }

    public boolean isTls() {
        return keyFile != null && certFile != null;
    }

}
