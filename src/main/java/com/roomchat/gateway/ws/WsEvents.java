package com.roomchat.gateway.ws;

import com.roomchat.domain.entity.ConversationEntity;
import com.roomchat.domain.entity.MessageEntity;
import com.roomchat.domain.dto.ReactionUpdate;
import com.roomchat.gateway.presence.PresenceStatus;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

/**
 * 出站事件的构造。
 */
public final class WsEvents {

    private WsEvents() {
    }

    public static WsEnvelope newMessage(MessageEntity message) {
        WsEnvelope env = base(WsEventTypes.NEW_MESSAGE);
        env.conversationId = message.getConversationId();
        env.messageId = message.getId();
        env.message = message;
        return env;
    }

    public static WsEnvelope messageSent(MessageEntity message, String clientTempId) {
        WsEnvelope env = base(WsEventTypes.MESSAGE_SENT);
        env.clientTempId = clientTempId;
        env.conversationId = message.getConversationId();
        env.messageId = message.getId();
        env.status = message.getStatus() == null ? null : message.getStatus().getDesc();
        env.message = message;
        return env;
    }

    /**
     * 重复提交：只回已分配的 messageId。
     */
    public static WsEnvelope messageSentDuplicate(long conversationId, long messageId, String clientTempId) {
        WsEnvelope env = base(WsEventTypes.MESSAGE_SENT);
        env.clientTempId = clientTempId;
        env.conversationId = conversationId;
        env.messageId = messageId;
        return env;
    }

    public static WsEnvelope messageFailed(long conversationId, long messageId, String clientTempId, String reason) {
        WsEnvelope env = base(WsEventTypes.MESSAGE_FAILED);
        env.clientTempId = clientTempId;
        env.conversationId = conversationId;
        env.messageId = messageId;
        env.status = "failed";
        env.reason = reason;
        return env;
    }

    public static WsEnvelope delivered(MessageEntity message) {
        WsEnvelope env = base(WsEventTypes.MESSAGE_DELIVERED);
        env.conversationId = message.getConversationId();
        env.messageId = message.getId();
        env.status = "delivered";
        env.deliveredAt = toEpochMilli(message.getDeliveredAt());
        return env;
    }

    public static WsEnvelope read(long conversationId, List<Long> messageIds, long readerId, LocalDateTime readAt) {
        WsEnvelope env = base(WsEventTypes.MESSAGE_READ);
        env.conversationId = conversationId;
        if (messageIds != null && messageIds.size() == 1) {
            env.messageId = messageIds.get(0);
        }
        env.messageIds = messageIds;
        env.readerId = readerId;
        env.status = "read";
        env.readAt = toEpochMilli(readAt);
        return env;
    }

    public static WsEnvelope edited(MessageEntity message) {
        WsEnvelope env = base(WsEventTypes.MESSAGE_EDITED);
        env.conversationId = message.getConversationId();
        env.messageId = message.getId();
        env.content = message.getContent();
        env.message = message;
        return env;
    }

    public static WsEnvelope deleted(MessageEntity message, boolean forEveryone) {
        WsEnvelope env = base(WsEventTypes.MESSAGE_DELETED);
        env.conversationId = message.getConversationId();
        env.messageId = message.getId();
        env.forEveryone = forEveryone;
        env.userId = message.getDeletedBy();
        if (forEveryone) {
            env.content = message.getContent();
        }
        return env;
    }

    public static WsEnvelope reaction(ReactionUpdate update) {
        WsEnvelope env = base(WsEventTypes.MESSAGE_REACTION);
        env.conversationId = update.message().getConversationId();
        env.messageId = update.message().getId();
        env.userId = update.userId();
        env.reaction = update.reaction() == null ? null : update.reaction().getDesc();
        env.reactions = update.reactions();
        return env;
    }

    public static WsEnvelope typing(long userId, long conversationId, boolean isTyping) {
        WsEnvelope env = base(WsEventTypes.USER_TYPING);
        env.userId = userId;
        env.conversationId = conversationId;
        env.isTyping = isTyping;
        return env;
    }

    public static WsEnvelope statusChange(long userId, PresenceStatus status, long lastSeenMs) {
        WsEnvelope env = base(WsEventTypes.USER_STATUS_CHANGE);
        env.userId = userId;
        env.status = status.getDesc();
        env.lastSeen = lastSeenMs;
        return env;
    }

    public static WsEnvelope conversationCreated(ConversationEntity conversation, List<Long> participantIds) {
        WsEnvelope env = base(WsEventTypes.CONVERSATION_CREATED);
        env.conversationId = conversation.getId();
        env.conversationType = conversation.getType() == null ? null : conversation.getType().getDesc();
        env.conversation = conversation;
        env.participantIds = participantIds;
        return env;
    }

    public static WsEnvelope base(String type) {
        WsEnvelope env = new WsEnvelope();
        env.type = type;
        env.ts = Instant.now().toEpochMilli();
        return env;
    }

    public static Long toEpochMilli(LocalDateTime time) {
        if (time == null) {
            return null;
        }
        return time.atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
    }
}
