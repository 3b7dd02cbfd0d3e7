package com.roomchat.gateway.ws;

import com.roomchat.common.error.ChatErrorCode;
import com.roomchat.gateway.session.SessionRegistry;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.util.AttributeKey;
import io.netty.util.concurrent.ScheduledFuture;

import java.util.concurrent.TimeUnit;

/**
 * 握手时未带 token 的连接，必须在固定窗口内发 auth 帧，否则回 error(auth_timeout) 后断开。
 */
public class WsAuthTimeoutHandler extends ChannelInboundHandlerAdapter {

    private static final AttributeKey<ScheduledFuture<?>> ATTR_AUTH_TIMEOUT =
            AttributeKey.valueOf("chat:ws:auth_timeout_future");

    private final SessionRegistry sessionRegistry;
    private final WsWriter wsWriter;
    private final long timeoutMs;

    public WsAuthTimeoutHandler(SessionRegistry sessionRegistry, WsWriter wsWriter, long timeoutMs) {
        this.sessionRegistry = sessionRegistry;
        this.wsWriter = wsWriter;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            scheduleIfNeeded(ctx);
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        cancel(ctx.channel());
        super.channelInactive(ctx);
    }

    private void scheduleIfNeeded(ChannelHandlerContext ctx) {
        Channel ch = ctx.channel();
        if (timeoutMs <= 0 || sessionRegistry.isAuthed(ch)) {
            return;
        }
        ScheduledFuture<?> existing = ch.attr(ATTR_AUTH_TIMEOUT).get();
        if (existing != null && !existing.isDone()) {
            return;
        }
        ScheduledFuture<?> f = ctx.executor().schedule(() -> onTimeout(ctx), timeoutMs, TimeUnit.MILLISECONDS);
        ch.attr(ATTR_AUTH_TIMEOUT).set(f);
    }

    private void onTimeout(ChannelHandlerContext ctx) {
        Channel ch = ctx.channel();
        if (!ch.isActive() || sessionRegistry.isAuthed(ch)) {
            return;
        }
        wsWriter.writeError(ctx, ChatErrorCode.AUTHENTICATION_FAILED, "auth_timeout", null, null)
                .addListener(ChannelFutureListener.CLOSE);
    }

    private void cancel(Channel ch) {
        ScheduledFuture<?> f = ch.attr(ATTR_AUTH_TIMEOUT).getAndSet(null);
        if (f != null) {
            f.cancel(false);
        }
    }
}
