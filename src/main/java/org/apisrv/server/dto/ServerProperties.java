package org.apisrv.server.dto;

import lombok.Builder;
import lombok.Data;
import org.apisrv.configuration.ConfigurationManager;
import org.apisrv.server.ServerOptions;

@Data
@Builder
public class ServerProperties {

    private int port;
    private String address;
    private String keyFile;
    private String certFile;
    private long bodyReadTimeoutMs;
    private long maxBodySize;
    private boolean prettyPrintJsonResponses;
    private boolean debug;

    public static ServerProperties initialize() {
        return from(ConfigurationManager.getINSTANCE());
    }

    public static ServerProperties from(ConfigurationManager config) {
        return ServerProperties.builder()
                .port(config.getIntProperty("apisrv.port", 8080))
                .address(config.getProperty("apisrv.address", null))
                .keyFile(config.getProperty("apisrv.tls.key", null))
                .certFile(config.getProperty("apisrv.tls.cert", null))
                .bodyReadTimeoutMs(config.getLongProperty("apisrv.body.read.timeout.ms",
                        ServerOptions.DEFAULT_BODY_READ_TIMEOUT_MS))
                .maxBodySize(config.getLongProperty("apisrv.body.max.size", ServerOptions.DEFAULT_MAX_BODY_SIZE))
                .prettyPrintJsonResponses(config.getBooleanProperty("apisrv.json.pretty", false))
                .debug(config.getBooleanProperty("apisrv.debug", false))
                .build();
    }

    public ServerOptions.ServerOptionsBuilder toOptions() {
        return ServerOptions.builder()
                .port(port)
                .address(address)
                .keyFile(keyFile)
                .certFile(certFile)
                .bodyReadTimeoutMs(bodyReadTimeoutMs)
                .maxBodySize(maxBodySize)
                .prettyPrintJsonResponses(prettyPrintJsonResponses)
                .debug(debug);
    }

}
