package com.roomchat.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomchat.common.error.ChatErrorCode;
import com.roomchat.common.error.ChatException;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * WS 文本协议统一写出器：
 * - 统一序列化/错误回包
 * - 保证 ch.writeAndFlush 在对应 channel eventLoop 执行（同一 channel 的写出顺序即调用顺序）
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WsWriter {

    private final ObjectMapper objectMapper;

    public ChannelFuture write(ChannelHandlerContext ctx, WsEnvelope env) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx is null");
        }
        return write(ctx.channel(), env);
    }

    public ChannelFuture write(Channel ch, WsEnvelope env) {
        if (ch == null) {
            throw new IllegalArgumentException("channel is null");
        }
        if (!ch.isActive()) {
            return ch.newFailedFuture(new IllegalStateException("channel inactive"));
        }
        if (ch.eventLoop().inEventLoop()) {
            return doWrite(ch, env);
        }
        ChannelPromise promise = ch.newPromise();
        try {
            ch.eventLoop().execute(() -> doWrite(ch, env).addListener(f -> {
                if (f.isSuccess()) {
                    promise.setSuccess();
                } else {
                    promise.setFailure(f.cause());
                }
            }));
        } catch (Exception e) {
            promise.setFailure(e);
        }
        return promise;
    }

    public ChannelFuture writeError(ChannelHandlerContext ctx, ChatException e, String clientTempId, Long messageId) {
        return writeError(ctx.channel(), e.getCode(), e.getReason(), clientTempId, messageId);
    }

    public ChannelFuture writeError(ChannelHandlerContext ctx, ChatErrorCode code, String reason, String clientTempId, Long messageId) {
        return writeError(ctx.channel(), code, reason, clientTempId, messageId);
    }

    public ChannelFuture writeError(Channel ch, ChatErrorCode code, String reason, String clientTempId, Long messageId) {
        WsEnvelope err = new WsEnvelope();
        err.type = WsEventTypes.ERROR;
        err.code = code == null ? null : code.getCondition();
        err.reason = reason;
        err.clientTempId = clientTempId;
        err.messageId = messageId;
        err.ts = Instant.now().toEpochMilli();
        return write(ch, err);
    }

    private ChannelFuture doWrite(Channel ch, WsEnvelope env) {
        try {
            String json = objectMapper.writeValueAsString(env);
            return ch.writeAndFlush(new TextWebSocketFrame(json));
        } catch (Exception e) {
            log.warn("ws write failed: type={}, err={}", env == null ? null : env.type, e.toString());
            return ch.newFailedFuture(e);
        }
    }
}
