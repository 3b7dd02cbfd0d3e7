package com.roomchat.gateway.ws;

import com.roomchat.common.error.ChatErrorCode;
import com.roomchat.common.error.ChatErrors;
import com.roomchat.common.error.ChatException;
import com.roomchat.domain.dto.DeliveryUpdate;
import com.roomchat.domain.dto.ReadReceipt;
import com.roomchat.domain.dto.SendMessageCommand;
import com.roomchat.domain.entity.MessageEntity;
import com.roomchat.domain.enums.MessageType;
import com.roomchat.domain.enums.ReactionType;
import com.roomchat.domain.service.ChatDeliveryService;
import com.roomchat.gateway.session.SessionRegistry;
import io.netty.channel.ChannelHandlerContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 消息相关入站帧：发送、delivered/read 回执、编辑、删除、reaction。
 *
 * <p>每个方法返回的 stage 交给 {@link WsChannelSerialQueue}，同一连接的帧按顺序处理。
 * 校验/权限错误只回给当前连接；状态没有真正推进时（重复 ACK）不广播。</p>
 */
@Slf4j
@Component
public class WsMessageHandler {

    private final SessionRegistry sessionRegistry;
    private final ChatDeliveryService deliveryService;
    private final MessageDeliveryPipeline pipeline;
    private final WsBroadcaster broadcaster;
    private final WsWriter wsWriter;
    private final Executor dbExecutor;

    public WsMessageHandler(SessionRegistry sessionRegistry,
                            ChatDeliveryService deliveryService,
                            MessageDeliveryPipeline pipeline,
                            WsBroadcaster broadcaster,
                            WsWriter wsWriter,
                            @Qualifier("chatDbExecutor") Executor dbExecutor) {
        this.sessionRegistry = sessionRegistry;
        this.deliveryService = deliveryService;
        this.pipeline = pipeline;
        this.broadcaster = broadcaster;
        this.wsWriter = wsWriter;
        this.dbExecutor = dbExecutor;
    }

    public CompletionStage<?> handleSend(ChannelHandlerContext ctx, WsEnvelope msg) {
        long userId = sessionRegistry.userId(ctx.channel());
        if (msg.conversationId == null) {
            wsWriter.writeError(ctx, ChatErrorCode.VALIDATION_FAILED, "missing_conversation_id", msg.clientTempId, null);
            return null;
        }
        MessageType type = msg.msgType == null ? MessageType.TEXT : MessageType.fromString(msg.msgType);
        if (type == null) {
            wsWriter.writeError(ctx, ChatErrorCode.VALIDATION_FAILED, "invalid_message_type", msg.clientTempId, null);
            return null;
        }
        SendMessageCommand draft = new SendMessageCommand(0L, userId, msg.conversationId, msg.content, type,
                msg.metadata, msg.replyToId, msg.clientTempId);
        // 失败已经在 pipeline 里回给发起连接
        return pipeline.submit(draft, ctx.channel()).handle((r, e) -> null);
    }

    public CompletionStage<?> handleDelivered(ChannelHandlerContext ctx, WsEnvelope msg) {
        long userId = sessionRegistry.userId(ctx.channel());
        Long messageId = requireMessageId(ctx, msg);
        if (messageId == null) {
            return null;
        }
        return db(() -> deliveryService.acknowledgeDelivered(messageId, userId))
                .whenComplete((update, e) -> {
                    if (e != null) {
                        replyError(ctx, msg, e);
                        return;
                    }
                    if (update.changed()) {
                        broadcaster.toRoom(update.message().getConversationId(), WsEvents.delivered(update.message()), null);
                    }
                });
    }

    /**
     * 带 messageId：单条已读；否则按 messageIds（为空表示全部未读）批量已读。
     */
    public CompletionStage<?> handleRead(ChannelHandlerContext ctx, WsEnvelope msg) {
        long userId = sessionRegistry.userId(ctx.channel());
        if (msg.messageId != null) {
            long messageId = msg.messageId;
            return db(() -> deliveryService.acknowledgeRead(messageId, userId))
                    .whenComplete((update, e) -> {
                        if (e != null) {
                            replyError(ctx, msg, e);
                            return;
                        }
                        if (update.changed()) {
                            publishSingleRead(update, userId);
                        }
                    });
        }
        if (msg.conversationId == null) {
            wsWriter.writeError(ctx, ChatErrorCode.VALIDATION_FAILED, "missing_message_id", msg.clientTempId, null);
            return null;
        }
        long conversationId = msg.conversationId;
        List<Long> ids = msg.messageIds;
        return db(() -> deliveryService.markConversationRead(conversationId, userId, ids))
                .whenComplete((receipt, e) -> {
                    if (e != null) {
                        replyError(ctx, msg, e);
                        return;
                    }
                    pipeline.publishReadReceipt(receipt);
                });
    }

    public CompletionStage<?> handleEdit(ChannelHandlerContext ctx, WsEnvelope msg) {
        long userId = sessionRegistry.userId(ctx.channel());
        Long messageId = requireMessageId(ctx, msg);
        if (messageId == null) {
            return null;
        }
        return db(() -> deliveryService.edit(messageId, userId, msg.content))
                .whenComplete((edited, e) -> {
                    if (e != null) {
                        replyError(ctx, msg, e);
                        return;
                    }
                    broadcaster.toRoom(edited.getConversationId(), WsEvents.edited(edited), null);
                });
    }

    public CompletionStage<?> handleDelete(ChannelHandlerContext ctx, WsEnvelope msg) {
        long userId = sessionRegistry.userId(ctx.channel());
        Long messageId = requireMessageId(ctx, msg);
        if (messageId == null) {
            return null;
        }
        boolean forEveryone = Boolean.TRUE.equals(msg.forEveryone);
        return db(() -> deliveryService.delete(messageId, userId, forEveryone))
                .whenComplete((deleted, e) -> {
                    if (e != null) {
                        replyError(ctx, msg, e);
                        return;
                    }
                    WsEnvelope out = WsEvents.deleted(deleted, forEveryone);
                    if (forEveryone) {
                        broadcaster.toRoom(deleted.getConversationId(), out, null);
                    } else {
                        // 仅自己可见
                        broadcaster.toUser(userId, out);
                    }
                });
    }

    public CompletionStage<?> handleReact(ChannelHandlerContext ctx, WsEnvelope msg) {
        long userId = sessionRegistry.userId(ctx.channel());
        Long messageId = requireMessageId(ctx, msg);
        if (messageId == null) {
            return null;
        }
        ReactionType reaction = ReactionType.fromString(msg.reaction);
        if (reaction == null) {
            wsWriter.writeError(ctx, ChatErrorCode.VALIDATION_FAILED, "invalid_reaction", msg.clientTempId, messageId);
            return null;
        }
        return db(() -> deliveryService.react(messageId, userId, reaction))
                .whenComplete((update, e) -> {
                    if (e != null) {
                        replyError(ctx, msg, e);
                        return;
                    }
                    broadcaster.toRoom(update.message().getConversationId(), WsEvents.reaction(update), null);
                });
    }

    public CompletionStage<?> handleRemoveReaction(ChannelHandlerContext ctx, WsEnvelope msg) {
        long userId = sessionRegistry.userId(ctx.channel());
        Long messageId = requireMessageId(ctx, msg);
        if (messageId == null) {
            return null;
        }
        return db(() -> deliveryService.removeReaction(messageId, userId))
                .whenComplete((update, e) -> {
                    if (e != null) {
                        replyError(ctx, msg, e);
                        return;
                    }
                    broadcaster.toRoom(update.message().getConversationId(), WsEvents.reaction(update), null);
                });
    }

    private void publishSingleRead(DeliveryUpdate update, long readerId) {
        MessageEntity m = update.message();
        pipeline.publishReadReceipt(new ReadReceipt(m.getConversationId(), readerId, List.of(m.getId()), m.getReadAt()));
    }

    private Long requireMessageId(ChannelHandlerContext ctx, WsEnvelope msg) {
        if (msg.messageId == null) {
            wsWriter.writeError(ctx, ChatErrorCode.VALIDATION_FAILED, "missing_message_id", msg.clientTempId, null);
        }
        return msg.messageId;
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
            log.error("ws {} failed: messageId={}, cause={}", msg.type, msg.messageId, String.valueOf(ChatErrors.unwrap(error)));
        }
        wsWriter.writeError(ctx, ce, msg.clientTempId, msg.messageId);
    }
}
