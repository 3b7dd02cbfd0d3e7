package com.roomchat.gateway.ws;

import cn.hutool.core.util.StrUtil;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.roomchat.common.error.ChatErrorCode;
import com.roomchat.common.error.ChatErrors;
import com.roomchat.common.error.ChatException;
import com.roomchat.domain.dto.DeliveryUpdate;
import com.roomchat.domain.dto.ReadReceipt;
import com.roomchat.domain.dto.SendMessageCommand;
import com.roomchat.domain.dto.SendResult;
import com.roomchat.domain.entity.MessageEntity;
import com.roomchat.domain.enums.MessageStatus;
import com.roomchat.domain.service.ChatDeliveryService;
import com.roomchat.gateway.presence.PresenceRegistry;
import com.roomchat.gateway.presence.TypingRegistry;
import com.roomchat.notify.NotificationService;
import io.netty.channel.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 发送链路：幂等抢占 → 落库(sent) → 会话投影 → 房间广播 → 接收方在线则推进 delivered → 站外通知。
 *
 * <p>落库到 delivered 这一段在 {@link ConversationSerialQueue} 里按会话串行；DB 调用在 chatDbExecutor 上执行，3 秒超时。</p>
 * <p>存储类失败（超时/拒绝/DataAccess）回 message_failed 并释放幂等 key；校验/权限类失败只回 error 给发起连接。</p>
 */
@Slf4j
@Component
public class MessageDeliveryPipeline {

    static final long DB_TIMEOUT_SECONDS = 3;
    static final long ABANDONED_SETTLE_SECONDS = 30;

    private final ChatDeliveryService deliveryService;
    private final ConversationSerialQueue conversationQueue;
    private final ClientTempIdIdempotency idempotency;
    private final WsBroadcaster broadcaster;
    private final WsWriter wsWriter;
    private final PresenceRegistry presenceRegistry;
    private final TypingRegistry typingRegistry;
    private final NotificationService notificationService;
    private final Executor dbExecutor;

    public MessageDeliveryPipeline(ChatDeliveryService deliveryService,
                                   ConversationSerialQueue conversationQueue,
                                   ClientTempIdIdempotency idempotency,
                                   WsBroadcaster broadcaster,
                                   WsWriter wsWriter,
                                   PresenceRegistry presenceRegistry,
                                   TypingRegistry typingRegistry,
                                   NotificationService notificationService,
                                   @Qualifier("chatDbExecutor") Executor dbExecutor) {
        this.deliveryService = deliveryService;
        this.conversationQueue = conversationQueue;
        this.idempotency = idempotency;
        this.broadcaster = broadcaster;
        this.wsWriter = wsWriter;
        this.presenceRegistry = presenceRegistry;
        this.typingRegistry = typingRegistry;
        this.notificationService = notificationService;
        this.dbExecutor = dbExecutor;
    }

    /**
     * @param draft  messageId 字段忽略，由这里预分配
     * @param origin 发起连接；REST 调用时为 null（不回 message_sent / error）
     */
    public CompletableFuture<SendResult> submit(SendMessageCommand draft, Channel origin) {
        long senderId = draft.senderId();
        long conversationId = draft.conversationId();
        String clientTempId = StrUtil.isBlank(draft.clientTempId()) ? null : draft.clientTempId().trim();
        String claimKey = clientTempId == null ? null : idempotency.key(senderId, clientTempId);

        long messageId = IdWorker.getId();
        Long claimed = idempotency.claim(claimKey, messageId);
        if (claimed != null) {
            log.debug("duplicate clientTempId: senderId={}, clientTempId={}, messageId={}", senderId, clientTempId, claimed);
            reply(origin, WsEvents.messageSentDuplicate(conversationId, claimed, clientTempId));
            MessageEntity existing = new MessageEntity();
            existing.setId(claimed);
            existing.setConversationId(conversationId);
            existing.setSenderId(senderId);
            existing.setClientTempId(clientTempId);
            return CompletableFuture.completedFuture(new SendResult(existing, null, null, true));
        }

        SendMessageCommand cmd = new SendMessageCommand(messageId, senderId, conversationId, draft.content(),
                draft.type(), draft.metadata(), draft.replyToId(), clientTempId);

        CompletableFuture<SendResult> out = new CompletableFuture<>();
        conversationQueue.enqueue(conversationId, () -> {
            CompletableFuture<SendResult> stored = CompletableFuture.supplyAsync(() -> deliveryService.send(cmd), dbExecutor);
            CompletableFuture<SendResult> sent = stored.copy()
                    .orTimeout(DB_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                    .thenCompose(result -> afterPersisted(result, origin, clientTempId));
            sent.whenComplete((result, err) -> {
                if (err != null) {
                    out.completeExceptionally(err);
                } else {
                    out.complete(result);
                }
            });
            // 超时只决定回给客户端的结果；会话闸门要等落库真正结束，迟到的插入不能越过后面的消息
            return sent.handle((result, err) -> err)
                    .thenCompose(err -> ChatErrors.unwrap(err) instanceof TimeoutException
                            ? settleAbandoned(stored, cmd)
                            : CompletableFuture.<Void>completedFuture(null));
        }).whenComplete((v, err) -> {
            if (err != null) {
                out.completeExceptionally(err);
            }
        });

        return out.whenComplete((result, err) -> {
            if (err != null) {
                onSendFailed(cmd, claimKey, origin, err);
            }
        });
    }

    /**
     * 服务端生成的系统消息，同样走会话串行队列，保证与普通消息的广播顺序一致。
     */
    public CompletableFuture<SendResult> submitSystem(long conversationId, String systemMessageType, String content) {
        return conversationQueue.enqueue(conversationId, () ->
                CompletableFuture.supplyAsync(() -> deliveryService.sendSystemMessage(conversationId, systemMessageType, content), dbExecutor)
                        .orTimeout(DB_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                        .thenApply(result -> {
                            broadcaster.toRoom(conversationId, WsEvents.newMessage(result.message()), null);
                            return result;
                        }));
    }

    /**
     * 已读回执广播到会话房间（发送方据此更新“已读”标记）。
     */
    public void publishReadReceipt(ReadReceipt receipt) {
        if (receipt == null || receipt.messageIds() == null || receipt.messageIds().isEmpty()) {
            return;
        }
        broadcaster.toRoom(receipt.conversationId(),
                WsEvents.read(receipt.conversationId(), receipt.messageIds(), receipt.readerId(), receipt.readAt()),
                null);
    }

    private CompletableFuture<SendResult> afterPersisted(SendResult result, Channel origin, String clientTempId) {
        MessageEntity message = result.message();
        long conversationId = message.getConversationId();
        if (result.duplicate()) {
            reply(origin, WsEvents.messageSent(message, clientTempId));
            if (message.getStatus() != MessageStatus.SENT) {
                return CompletableFuture.completedFuture(result);
            }
            // 重发撞上仍是 sent 的已有记录，它可能从未广播过：补发 new_message（客户端按 id 去重）并补跑 delivered
            try {
                broadcaster.toRoomExcept(conversationId, WsEvents.newMessage(message), origin);
            } catch (Exception e) {
                log.error("duplicate re-broadcast failed: conversationId={}, messageId={}", conversationId, message.getId(), e);
                return CompletableFuture.completedFuture(result);
            }
            return markDeliveredIfOnline(message, result);
        }
        long senderId = message.getSenderId();
        try {
            if (typingRegistry.stop(senderId, conversationId)) {
                broadcaster.toRoom(conversationId, WsEvents.typing(senderId, conversationId, false), senderId);
            }
            broadcaster.toRoomExcept(conversationId, WsEvents.newMessage(message), origin);
            reply(origin, WsEvents.messageSent(message, clientTempId));
            notificationService.onMessagePersisted(message, result.participants());
        } catch (Exception e) {
            // 消息已落库，这里的异常不能再把它标记为 failed
            log.error("post-persist fan-out failed: conversationId={}, messageId={}", conversationId, message.getId(), e);
            return CompletableFuture.completedFuture(result);
        }

        return markDeliveredIfOnline(message, result);
    }

    private CompletableFuture<SendResult> markDeliveredIfOnline(MessageEntity message, SendResult result) {
        long conversationId = message.getConversationId();
        Long receiverId = message.getReceiverId();
        if (receiverId == null || !presenceRegistry.isOnline(receiverId)) {
            return CompletableFuture.completedFuture(result);
        }
        CompletableFuture<DeliveryUpdate> delivered;
        try {
            delivered = CompletableFuture.supplyAsync(() -> deliveryService.markDeliveredOnline(message), dbExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("mark delivered rejected: messageId={}, err={}", message.getId(), e.toString());
            return CompletableFuture.completedFuture(result);
        }
        return delivered.orTimeout(DB_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .handle((update, e) -> {
                    if (e != null) {
                        // 保持 sent，等接收方客户端 ACK
                        log.warn("mark delivered failed: messageId={}, err={}", message.getId(), e.toString());
                    } else if (update.changed()) {
                        broadcaster.toRoom(conversationId, WsEvents.delivered(update.message()), null);
                    }
                    return result;
                });
    }

    /**
     * 已超时放弃等待的落库：等它真正结束（最多 {@link #ABANDONED_SETTLE_SECONDS} 秒），
     * 若最终写入成功则同样标记为 failed，与已经回给客户端的 message_failed 保持一致，并释放 client_temp_id。
     */
    private CompletableFuture<Void> settleAbandoned(CompletableFuture<SendResult> stored, SendMessageCommand cmd) {
        return stored.copy()
                .orTimeout(ABANDONED_SETTLE_SECONDS, TimeUnit.SECONDS)
                .handle((result, err) -> {
                    if (err != null) {
                        log.warn("abandoned insert did not settle: messageId={}, err={}", cmd.messageId(), String.valueOf(ChatErrors.unwrap(err)));
                        return null;
                    }
                    if (!result.duplicate()) {
                        try {
                            deliveryService.markFailed(cmd.messageId());
                            log.warn("late insert marked failed: conversationId={}, messageId={}", cmd.conversationId(), cmd.messageId());
                        } catch (Exception e) {
                            log.warn("mark late insert failed: messageId={}, err={}", cmd.messageId(), e.toString());
                        }
                    }
                    return null;
                });
    }

    private void onSendFailed(SendMessageCommand cmd, String claimKey, Channel origin, Throwable err) {
        ChatException ce = ChatErrors.translate(err);
        idempotency.release(claimKey);
        if (ce.getCode() != ChatErrorCode.TRANSIENT) {
            log.debug("send rejected: senderId={}, conversationId={}, reason={}", cmd.senderId(), cmd.conversationId(), ce.getReason());
            if (origin != null) {
                wsWriter.writeError(origin, ce.getCode(), ce.getReason(), cmd.clientTempId(), null);
            }
            return;
        }
        log.error("send message failed: senderId={}, conversationId={}, messageId={}, cause={}",
                cmd.senderId(), cmd.conversationId(), cmd.messageId(), String.valueOf(ChatErrors.unwrap(err)));
        try {
            CompletableFuture.runAsync(() -> deliveryService.markFailed(cmd.messageId()), dbExecutor)
                    .orTimeout(DB_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                    .whenComplete((v, e) -> {
                        if (e != null) {
                            log.warn("mark failed failed: messageId={}, err={}", cmd.messageId(), e.toString());
                        }
                    });
        } catch (Exception e) {
            log.warn("mark failed rejected: messageId={}, err={}", cmd.messageId(), e.toString());
        }
        reply(origin, WsEvents.messageFailed(cmd.conversationId(), cmd.messageId(), cmd.clientTempId(), ce.getReason()));
    }

    private void reply(Channel origin, WsEnvelope env) {
        if (origin != null && origin.isActive()) {
            wsWriter.write(origin, env);
        }
    }
}
