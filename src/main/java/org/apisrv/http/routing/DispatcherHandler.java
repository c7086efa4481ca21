package org.apisrv.http.routing;

import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.extern.slf4j.Slf4j;
import org.apisrv.http.pipeline.RequestPipeline;
import org.apisrv.http.request.ReceivedRequest;

/**
 * Hands fully read requests to the {@link RequestPipeline}. The pipeline runs off the
 * event loop, so slow handlers never stall other connections.
 */
@Slf4j
@ChannelHandler.Sharable
public class DispatcherHandler extends SimpleChannelInboundHandler<ReceivedRequest> {

    private final RequestPipeline pipeline;

    public DispatcherHandler(RequestPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ReceivedRequest request) {
        if (request.upgrade()) {
            pipeline.upgrade(request, ctx);
            return;
        }
        pipeline.process(request);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Unexpected error on channel {}: {}", ctx.channel().id(), cause.getMessage(), cause);
        ctx.close();
    }

}
