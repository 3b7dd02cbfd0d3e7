package com.roomchat.notify;

import cn.hutool.core.util.StrUtil;
import com.roomchat.domain.entity.ConversationParticipantEntity;
import com.roomchat.domain.entity.MessageEntity;
import com.roomchat.gateway.presence.PresenceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * 消息落库并广播之后，逐个接收方决定是否需要站外通知，并在通知线程池上投递。
 *
 * <p>这里的任何失败只记日志，不影响消息本身。</p>
 */
@Slf4j
@Service
public class NotificationService {

    private static final int PREVIEW_LENGTH = 100;

    private final PresenceRegistry presenceRegistry;
    private final NotificationDispatcher dispatcher;
    private final NotifyProperties props;
    private final Executor notifyExecutor;

    public NotificationService(PresenceRegistry presenceRegistry,
                               NotificationDispatcher dispatcher,
                               NotifyProperties props,
                               @Qualifier("chatNotifyExecutor") Executor notifyExecutor) {
        this.presenceRegistry = presenceRegistry;
        this.dispatcher = dispatcher;
        this.props = props;
        this.notifyExecutor = notifyExecutor;
    }

    /**
     * @return 实际提交投递的接收方数量
     */
    public int onMessagePersisted(MessageEntity message, List<ConversationParticipantEntity> participants) {
        if (!props.enabledEffective() || message == null || participants == null) {
            return 0;
        }
        long nowMs = System.currentTimeMillis();
        LocalDateTime now = LocalDateTime.now();
        int submitted = 0;
        for (ConversationParticipantEntity p : participants) {
            if (p == null || p.getUserId() == null || !p.isActiveFlag()
                    || Objects.equals(p.getUserId(), message.getSenderId())) {
                continue;
            }
            NotificationDecision decision = NotificationDecider.decide(
                    presenceRegistry.snapshot(p.getUserId()),
                    p.isMutedAt(now),
                    message.getConversationId(),
                    nowMs,
                    props.emailAfterAbsentMsEffective());
            if (!decision.isDispatch()) {
                log.debug("notification suppressed: recipientId={}, messageId={}, decision={}", p.getUserId(), message.getId(), decision);
                continue;
            }
            NotificationRequest request = new NotificationRequest(
                    p.getUserId(),
                    message.getConversationId(),
                    message.getId(),
                    message.getSenderId(),
                    message.getMsgType() == null ? null : message.getMsgType().getDesc(),
                    StrUtil.sub(message.getContent(), 0, PREVIEW_LENGTH),
                    decision);
            try {
                notifyExecutor.execute(() -> dispatchQuietly(request));
                submitted++;
            } catch (Exception e) {
                log.warn("notification dispatch rejected: recipientId={}, messageId={}, err={}", p.getUserId(), message.getId(), e.toString());
            }
        }
        return submitted;
    }

    private void dispatchQuietly(NotificationRequest request) {
        try {
            dispatcher.dispatch(request);
        } catch (Exception e) {
            log.warn("notification dispatch failed: recipientId={}, messageId={}, err={}", request.recipientId(), request.messageId(), e.toString());
        }
    }
}
