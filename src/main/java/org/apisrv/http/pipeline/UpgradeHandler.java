package org.apisrv.http.pipeline;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.HttpRequest;

import java.util.concurrent.CompletionStage;

/**
 * Takes over a connection that asked for a protocol upgrade, after authentication passed.
 * From then on the handler owns the channel.
 */
@FunctionalInterface
public interface UpgradeHandler {

    CompletionStage<Boolean> upgrade(RequestContext context, ChannelHandlerContext channel, HttpRequest request)
            throws Exception;

}
