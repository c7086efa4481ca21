package org.apisrv.http.request;

import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.HttpContent;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.util.ReferenceCountUtil;
import lombok.extern.slf4j.Slf4j;
import org.apisrv.exception.HttpException;
import org.apisrv.http.response.JsonResponder;
import org.apisrv.http.response.NettyResponseSink;

/**
 * Binds a {@link RequestLifecycle} to the decoded HTTP messages of one connection and
 * fires a {@link ReceivedRequest} once the body is complete. Framework errors raised
 * while reading are answered here. One instance per channel.
 */
@Slf4j
public class RequestBodyReader extends ChannelInboundHandlerAdapter {

    private final long bodyReadTimeoutMs;
    private final long maxBodySize;
    private final boolean upgradeEnabled;
    private final JsonResponder responder;

    private RequestLifecycle lifecycle;
    private boolean upgraded;

    public RequestBodyReader(long bodyReadTimeoutMs, long maxBodySize, boolean upgradeEnabled,
                             JsonResponder responder) {
        this.bodyReadTimeoutMs = bodyReadTimeoutMs;
        this.maxBodySize = maxBodySize;
        this.upgradeEnabled = upgradeEnabled;
        this.responder = responder;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (upgraded) {
            ctx.fireChannelRead(msg);
            return;
        }
        try {
            if (msg instanceof HttpRequest request) {
                onRequest(ctx, request);
            }
            if (!upgraded && msg instanceof HttpContent content && lifecycle != null) {
                lifecycle.onData(ByteBufUtil.getBytes(content.content()));
                if (content instanceof LastHttpContent) {
                    lifecycle.onEnd();
                }
            }
        } finally {
            ReferenceCountUtil.release(msg);
        }
    }

    private void onRequest(ChannelHandlerContext ctx, HttpRequest request) {
        if (lifecycle != null) {
            log.debug("Ignoring pipelined request {} {} on channel {}", request.method(), request.uri(),
                    ctx.channel().id());
            return;
        }
        NettyResponseSink sink = new NettyResponseSink(ctx);
        lifecycle = new RequestLifecycle(maxBodySize, new RequestLifecycle.Listener() {
            @Override
            public void completed(byte[] body) {
                ctx.fireChannelRead(new ReceivedRequest(request, body, sink, false));
            }

            @Override
            public void failed(HttpException error, boolean destroy) {
                log.debug("Request {} {} failed while reading body: {}", request.method(), request.uri(),
                        error.getDetail());
                responder.error(sink, error.getStatus(), error.getDetail());
                if (destroy) {
                    sink.abort();
                }
            }
        });
        if (request.decoderResult().isFailure()) {
            lifecycle.cancel();
            responder.error(sink, 400, "Malformed request.");
            return;
        }
        if (upgradeEnabled && isUpgrade(request)) {
            lifecycle.cancel();
            upgraded = true;
            ctx.fireChannelRead(new ReceivedRequest(request, new byte[0], sink, true));
            return;
        }
        lifecycle.begin(request.headers(), ctx.executor(), bodyReadTimeoutMs);
    }

    private static boolean isUpgrade(HttpRequest request) {
        return request.headers().contains(HttpHeaderNames.UPGRADE)
                && request.headers().containsValue(HttpHeaderNames.CONNECTION, HttpHeaderValues.UPGRADE, true);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (lifecycle != null && !lifecycle.isCompleted()) {
            lifecycle.onError(cause);
            return;
        }
        log.warn("Unexpected error on channel {}: {}", ctx.channel().id(), cause.getMessage(), cause);
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (lifecycle != null) {
            lifecycle.cancel();
        }
        super.channelInactive(ctx);
    }

}
