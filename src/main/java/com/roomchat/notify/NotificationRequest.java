package com.roomchat.notify;

/**
 * 交给外部通知服务的一条请求。content 已截断为预览长度。
 */
public record NotificationRequest(
        long recipientId,
        long conversationId,
        long messageId,
        long senderId,
        String messageType,
        String preview,
        NotificationDecision decision
) {
}
