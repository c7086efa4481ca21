package org.apisrv.http.response;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Writes one {@link FullHttpResponse} to the channel and closes it afterwards.
 */
@Slf4j
public class NettyResponseSink implements ResponseSink {

    private final ChannelHandlerContext ctx;
    private final AtomicBoolean committed = new AtomicBoolean();

    public NettyResponseSink(ChannelHandlerContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public boolean send(int status, Map<String, String> headers, byte[] body) {
        if (!committed.compareAndSet(false, true)) {
            log.debug("Dropping {} response on channel {}: already committed", status, ctx.channel().id());
            return false;
        }
        FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                HttpResponseStatus.valueOf(status),
                Unpooled.wrappedBuffer(body)
        );
        headers.forEach((name, value) -> response.headers().set(name, value));
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, body.length);
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        return true;
    }

    @Override
    public boolean isCommitted() {
        return committed.get();
    }

    @Override
    public void abort() {
        ctx.channel().config().setAutoRead(false);
        if (!committed.get()) {
            ctx.close();
        }
    }

}
