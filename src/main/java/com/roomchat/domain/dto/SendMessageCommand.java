package com.roomchat.domain.dto;

import com.roomchat.domain.enums.MessageType;

import java.util.Map;

/**
 * 发送入参。messageId 由调用方预分配，落库失败时据此把消息标记为 failed。
 */
public record SendMessageCommand(
        long messageId,
        long senderId,
        long conversationId,
        String content,
        MessageType type,
        Map<String, Object> metadata,
        Long replyToId,
        String clientTempId
) {
}
