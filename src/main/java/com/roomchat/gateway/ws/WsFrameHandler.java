package com.roomchat.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomchat.common.error.ChatErrorCode;
import com.roomchat.gateway.session.SessionRegistry;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * 业务帧入口：JSON 文本帧解析 → 鉴权检查 → 按 type 分发。
 *
 * <p>每个连接一个实例。涉及 DB 的帧交给 {@link WsChannelSerialQueue}，同一连接内按到达顺序处理。</p>
 */
@Slf4j
public class WsFrameHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private final ObjectMapper objectMapper;
    private final SessionRegistry sessionRegistry;
    private final WsWriter wsWriter;
    private final WsConnectionService connectionService;
    private final WsAuthHandler authHandler;
    private final WsPingHandler pingHandler;
    private final WsPresenceHandler presenceHandler;
    private final WsMessageHandler messageHandler;
    private final WsConversationHandler conversationHandler;

    public WsFrameHandler(ObjectMapper objectMapper,
                          SessionRegistry sessionRegistry,
                          WsWriter wsWriter,
                          WsConnectionService connectionService,
                          WsAuthHandler authHandler,
                          WsPingHandler pingHandler,
                          WsPresenceHandler presenceHandler,
                          WsMessageHandler messageHandler,
                          WsConversationHandler conversationHandler) {
        this.objectMapper = objectMapper;
        this.sessionRegistry = sessionRegistry;
        this.wsWriter = wsWriter;
        this.connectionService = connectionService;
        this.authHandler = authHandler;
        this.pingHandler = pingHandler;
        this.presenceHandler = presenceHandler;
        this.messageHandler = messageHandler;
        this.conversationHandler = conversationHandler;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        String raw = frame.text();
        WsEnvelope msg;
        try {
            msg = objectMapper.readValue(raw, WsEnvelope.class);
        } catch (Exception e) {
            log.debug("bad ws frame: channel={}, err={}", SessionRegistry.connectionId(ctx.channel()), e.toString());
            wsWriter.writeError(ctx, ChatErrorCode.VALIDATION_FAILED, "bad_json", null, null);
            return;
        }
        if (msg.type == null || msg.type.isBlank()) {
            wsWriter.writeError(ctx, ChatErrorCode.VALIDATION_FAILED, "missing_type", msg.clientTempId, null);
            return;
        }

        // 除了 auth 以外，其他帧都要求：已鉴权且 accessToken 未过期。
        if (!WsEventTypes.AUTH.equals(msg.type)) {
            if (!sessionRegistry.isAuthed(ctx.channel())) {
                wsWriter.writeError(ctx, ChatErrorCode.AUTHENTICATION_FAILED, "unauthorized", msg.clientTempId, null);
                ctx.close();
                return;
            }
            if (isExpired(ctx)) {
                wsWriter.writeError(ctx, ChatErrorCode.AUTHENTICATION_FAILED, "token_expired", msg.clientTempId, null);
                ctx.close();
                return;
            }
            connectionService.touch(sessionRegistry.userId(ctx.channel()));
        }

        log.debug("ws frame: channel={}, type={}", SessionRegistry.connectionId(ctx.channel()), msg.type);
        switch (msg.type) {
            case WsEventTypes.AUTH -> authHandler.handleAuth(ctx, msg);
            case WsEventTypes.PING -> pingHandler.handleClientPing(ctx);
            case WsEventTypes.SEND_MESSAGE -> serial(ctx, msg, () -> messageHandler.handleSend(ctx, msg));
            case WsEventTypes.MESSAGE_DELIVERED -> serial(ctx, msg, () -> messageHandler.handleDelivered(ctx, msg));
            case WsEventTypes.MESSAGE_READ -> serial(ctx, msg, () -> messageHandler.handleRead(ctx, msg));
            case WsEventTypes.EDIT_MESSAGE -> serial(ctx, msg, () -> messageHandler.handleEdit(ctx, msg));
            case WsEventTypes.DELETE_MESSAGE -> serial(ctx, msg, () -> messageHandler.handleDelete(ctx, msg));
            case WsEventTypes.REACT_TO_MESSAGE -> serial(ctx, msg, () -> messageHandler.handleReact(ctx, msg));
            case WsEventTypes.REMOVE_REACTION -> serial(ctx, msg, () -> messageHandler.handleRemoveReaction(ctx, msg));
            case WsEventTypes.JOIN_CONVERSATION -> serial(ctx, msg, () -> conversationHandler.handleJoin(ctx, msg));
            case WsEventTypes.LEAVE_CONVERSATION -> serial(ctx, msg, () -> {
                conversationHandler.handleLeave(ctx, msg);
                return null;
            });
            case WsEventTypes.CREATE_CONVERSATION -> serial(ctx, msg, () -> conversationHandler.handleCreate(ctx, msg));
            case WsEventTypes.TYPING_START -> presenceHandler.handleTyping(ctx, msg, true);
            case WsEventTypes.TYPING_STOP -> presenceHandler.handleTyping(ctx, msg, false);
            case WsEventTypes.STATUS_CHANGE -> presenceHandler.handleStatusChange(ctx, msg);
            case WsEventTypes.SET_ACTIVITY -> presenceHandler.handleSetActivity(ctx, msg);
            case WsEventTypes.CLEAR_ACTIVITY -> presenceHandler.handleClearActivity(ctx);
            default -> wsWriter.writeError(ctx, ChatErrorCode.VALIDATION_FAILED, "unsupported_type", msg.clientTempId, null);
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            // 握手阶段已带 token：直接注册；否则等 auth 帧
            if (sessionRegistry.isAuthed(ctx.channel())) {
                connectionService.register(ctx.channel());
            }
        }
        if (evt instanceof IdleStateEvent e && e.state() == IdleState.READER_IDLE) {
            // 一段时间没有收到任何数据（包括对服务端 ping 的 pong）：视为僵尸连接
            log.debug("reader idle, closing: channel={}", SessionRegistry.connectionId(ctx.channel()));
            connectionService.disconnect(ctx.channel());
            ctx.close();
            return;
        }
        if (evt instanceof IdleStateEvent e && e.state() == IdleState.WRITER_IDLE) {
            pingHandler.onWriterIdle(ctx);
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        connectionService.disconnect(ctx.channel());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("ws channel error: channel={}, err={}", SessionRegistry.connectionId(ctx.channel()), cause.toString());
        connectionService.disconnect(ctx.channel());
        ctx.close();
    }

    private void serial(ChannelHandlerContext ctx, WsEnvelope msg, Supplier<? extends CompletionStage<?>> task) {
        Channel ch = ctx.channel();
        // 业务错误已经在各 handler 里回给客户端，这里只兜底记录
        WsChannelSerialQueue.enqueue(ch, task).whenComplete((v, e) -> {
            if (e != null) {
                log.debug("ws task completed exceptionally: channel={}, type={}, err={}", SessionRegistry.connectionId(ch), msg.type, e.toString());
            }
        });
    }

    private boolean isExpired(ChannelHandlerContext ctx) {
        Long expMs = sessionRegistry.getAccessExpMs(ctx.channel());
        return expMs != null && Instant.now().toEpochMilli() >= expMs;
    }
}
