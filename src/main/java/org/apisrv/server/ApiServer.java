package org.apisrv.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.stream.ChunkedWriteHandler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apisrv.exception.ConfigurationException;
import org.apisrv.http.pipeline.RequestHandler;
import org.apisrv.http.pipeline.RequestPipeline;
import org.apisrv.http.request.RequestBodyReader;
import org.apisrv.http.response.JsonResponder;
import org.apisrv.http.routing.DispatcherHandler;
import org.apisrv.http.routing.HandlerOptions;
import org.apisrv.http.routing.RouteDefinition;
import org.apisrv.http.routing.Router;

import javax.net.ssl.SSLException;
import java.io.File;
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * JSON API server: Netty transport in front of a {@link Router} and a {@link RequestPipeline}.
 */
@Slf4j
public class ApiServer {

    private final ServerOptions options;
    @Getter
    private final Router router;
    private final JsonResponder responder;
    private final RequestPipeline pipeline;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final SslContext sslContext;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public ApiServer(ServerOptions options) {
        this(options, new Router());
    }

    public ApiServer(ServerOptions options, Router router) {
        this.options = options.validate();
        this.router = router;
        this.responder = new JsonResponder(new ObjectMapper(), options.isPrettyPrintJsonResponses());
        this.ownsExecutor = options.getExecutor() == null;
        this.executor = ownsExecutor ? Executors.newCachedThreadPool() : options.getExecutor();
        this.sslContext = options.isTls() ? buildSslContext(options) : null;
        if (options.getAuthenticator() == null && options.isDebug()) {
            log.info("No authentication callback set.");
        }
        this.pipeline = RequestPipeline.builder()
                .router(router)
                .responder(responder)
                .authenticator(options.getAuthenticator())
                .fallbackHandler(options.getFallbackHandler())
                .upgradeHandler(options.getUpgradeHandler())
                .executor(executor)
                .debug(options.isDebug())
                .build();
        if (options.getRequestHandlers() != null) {
            for (Map.Entry<String, Map<String, RequestHandler>> byMethod : options.getRequestHandlers().entrySet()) {
                byMethod.getValue().forEach((path, handler) -> router.add(byMethod.getKey(), path, handler));
            }
        }
    }

    public RouteDefinition requestHandleAdd(String method, String path, RequestHandler handler) {
        return router.add(method, path, handler);
    }

    public RouteDefinition requestHandleAdd(String method, String path, RequestHandler handler,
                                            HandlerOptions handlerOptions) {
        return router.add(method, path, handler, handlerOptions);
    }

    public boolean requestHandleDelete(String method, String path) {
        return router.delete(method, path);
    }

    public synchronized ApiServer start() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("Server already started");
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline channelPipeline = ch.pipeline();
                        if (sslContext != null) {
                            channelPipeline.addLast("ssl", sslContext.newHandler(ch.alloc()));
                        }
                        channelPipeline.addLast("codec", new HttpServerCodec());
                        channelPipeline.addLast("bodyReader", newBodyReader());
                        channelPipeline.addLast("handler", new DispatcherHandler(pipeline));
                        channelPipeline.addLast("chunkedWriter", new ChunkedWriteHandler());
                    }
                });

        InetSocketAddress bindAddress = options.getAddress() != null
                ? new InetSocketAddress(options.getAddress(), options.getPort())
                : new InetSocketAddress(options.getPort());
        ChannelFuture future = bootstrap.bind(bindAddress).await();
        if (!future.isSuccess()) {
            String address = options.getAddress() != null ? " address: " + options.getAddress() : "";
            log.error("Unable to start HTTP server (port: {}{})", options.getPort(), address, future.cause());
            shutdownGroups();
            throw new IllegalStateException("Unable to start HTTP server on port " + options.getPort(), future.cause());
        }
        serverChannel = future.channel();
        log.info("{} server listening on {}", sslContext != null ? "HTTPS" : "HTTP", serverChannel.localAddress());
        return this;
    }

    RequestBodyReader newBodyReader() {
        return new RequestBodyReader(options.getBodyReadTimeoutMs(), options.getMaxBodySize(),
                pipeline.isUpgradeEnabled(), responder);
    }

    ExecutorService getExecutor() {
        return executor;
    }

    public int getPort() {
        if (serverChannel == null) {
            return options.getPort();
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    /**
     * Blocks until the server channel is closed.
     */
    public void awaitClose() throws InterruptedException {
        Channel channel;
        synchronized (this) {
            channel = serverChannel;
        }
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }

    public synchronized CompletableFuture<Void> close() {
        CompletableFuture<Void> closed = new CompletableFuture<>();
        if (serverChannel == null) {
            if (ownsExecutor) {
                executor.shutdown();
            }
            closed.complete(null);
            return closed;
        }
        serverChannel.close().addListener(future -> {
            shutdownGroups();
            if (future.isSuccess()) {
                log.info("Server on port {} closed", options.getPort());
                closed.complete(null);
            } else {
                closed.completeExceptionally(future.cause());
            }
        });
        serverChannel = null;
        return closed;
    }

    public CompletableFuture<Void> shutdown() {
        return close();
    }

    private void shutdownGroups() {
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
        if (ownsExecutor) {
            executor.shutdown();
        }
    }

    private static SslContext buildSslContext(ServerOptions options) {
        try {
            return SslContextBuilder.forServer(new File(options.getCertFile()), new File(options.getKeyFile())).build();
        } catch (SSLException | IllegalArgumentException e) {
            throw new ConfigurationException("Unable to load TLS key/cert: " + e.getMessage(), e);
        }
    }

}
