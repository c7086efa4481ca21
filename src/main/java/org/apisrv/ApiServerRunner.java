package org.apisrv;

import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.apisrv.configuration.ConfigurationManager;
import org.apisrv.server.ApiServer;
import org.apisrv.server.dto.ServerProperties;

@Slf4j
public class ApiServerRunner {

    @SneakyThrows
    public static void main(String[] args) {
        if (args.length > 0) {
            ConfigurationManager.overrideProperties(args[0]);
        }

        ServerProperties serverProperties = ServerProperties.initialize();
        ApiServer server = new ApiServer(serverProperties.toOptions().build());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> server.close().join()));

        server.start();
        log.info("Serving {} registered routes", server.getRouter().getRoutes().size());
        server.awaitClose();
    }

}
