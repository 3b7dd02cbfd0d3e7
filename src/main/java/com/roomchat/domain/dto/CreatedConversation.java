package com.roomchat.domain.dto;

import com.roomchat.domain.entity.ConversationEntity;

import java.util.List;

/**
 * @param reused 单聊已存在同一对用户的活跃会话，直接复用
 */
public record CreatedConversation(
        ConversationEntity conversation,
        List<Long> participantIds,
        boolean reused
) {
}
