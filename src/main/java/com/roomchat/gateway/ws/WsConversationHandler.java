package com.roomchat.gateway.ws;

import com.roomchat.common.error.ChatErrorCode;
import com.roomchat.common.error.ChatErrors;
import com.roomchat.common.error.ChatException;
import com.roomchat.domain.enums.ConversationType;
import com.roomchat.domain.service.ConversationService;
import com.roomchat.gateway.session.ConversationRoomRegistry;
import com.roomchat.gateway.session.SessionRegistry;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 会话房间订阅与创建会话。
 *
 * <p>join 时重新校验成员关系：客户端本地的会话列表可能已经过期。</p>
 */
@Slf4j
@Component
public class WsConversationHandler {

    private final SessionRegistry sessionRegistry;
    private final ConversationRoomRegistry roomRegistry;
    private final ConversationService conversationService;
    private final WsConnectionService connectionService;
    private final WsWriter wsWriter;
    private final Executor dbExecutor;

    public WsConversationHandler(SessionRegistry sessionRegistry,
                                 ConversationRoomRegistry roomRegistry,
                                 ConversationService conversationService,
                                 WsConnectionService connectionService,
                                 WsWriter wsWriter,
                                 @Qualifier("chatDbExecutor") Executor dbExecutor) {
        this.sessionRegistry = sessionRegistry;
        this.roomRegistry = roomRegistry;
        this.conversationService = conversationService;
        this.connectionService = connectionService;
        this.wsWriter = wsWriter;
        this.dbExecutor = dbExecutor;
    }

    public CompletionStage<?> handleJoin(ChannelHandlerContext ctx, WsEnvelope msg) {
        long userId = sessionRegistry.userId(ctx.channel());
        if (msg.conversationId == null) {
            wsWriter.writeError(ctx, ChatErrorCode.VALIDATION_FAILED, "missing_conversation_id", msg.clientTempId, null);
            return null;
        }
        long conversationId = msg.conversationId;
        Channel ch = ctx.channel();
        return db(() -> {
            conversationService.requireConversation(conversationId);
            conversationService.requireActiveParticipant(conversationId, userId);
            return Boolean.TRUE;
        }).whenComplete((ok, e) -> {
            if (e != null) {
                replyError(ctx, msg, e);
                return;
            }
            ctx.executor().execute(() -> {
                roomRegistry.join(conversationId, ch);
                WsEnvelope joined = WsEvents.base(WsEventTypes.CONVERSATION_JOINED);
                joined.conversationId = conversationId;
                wsWriter.write(ctx, joined);
            });
        });
    }

    public void handleLeave(ChannelHandlerContext ctx, WsEnvelope msg) {
        if (msg.conversationId == null) {
            wsWriter.writeError(ctx, ChatErrorCode.VALIDATION_FAILED, "missing_conversation_id", msg.clientTempId, null);
            return;
        }
        // 只退订广播，不改持久化的成员关系
        roomRegistry.leave(msg.conversationId, ctx.channel());
        WsEnvelope left = WsEvents.base(WsEventTypes.CONVERSATION_LEFT);
        left.conversationId = msg.conversationId;
        wsWriter.write(ctx, left);
    }

    public CompletionStage<?> handleCreate(ChannelHandlerContext ctx, WsEnvelope msg) {
        long userId = sessionRegistry.userId(ctx.channel());
        ConversationType type = msg.conversationType == null ? ConversationType.DIRECT : ConversationType.fromString(msg.conversationType);
        if (type == null) {
            wsWriter.writeError(ctx, ChatErrorCode.VALIDATION_FAILED, "invalid_conversation_type", msg.clientTempId, null);
            return null;
        }
        if (msg.participantIds == null || msg.participantIds.isEmpty()) {
            wsWriter.writeError(ctx, ChatErrorCode.VALIDATION_FAILED, "missing_participants", msg.clientTempId, null);
            return null;
        }
        return db(() -> conversationService.createConversation(userId, type, msg.participantIds, msg.title, msg.matchId, msg.listingId))
                .whenComplete((created, e) -> {
                    if (e != null) {
                        replyError(ctx, msg, e);
                        return;
                    }
                    connectionService.onConversationCreated(created);
                });
    }

    private <T> CompletableFuture<T> db(Supplier<T> call) {
        try {
            return CompletableFuture.supplyAsync(call, dbExecutor)
                    .orTimeout(MessageDeliveryPipeline.DB_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void replyError(ChannelHandlerContext ctx, WsEnvelope msg, Throwable error) {
        ChatException ce = ChatErrors.translate(error);
        if (ce.getCode() == ChatErrorCode.TRANSIENT) {
            log.error("ws {} failed: conversationId={}, cause={}", msg.type, msg.conversationId, String.valueOf(ChatErrors.unwrap(error)));
        }
        wsWriter.writeError(ctx, ce, msg.clientTempId, null);
    }
}
