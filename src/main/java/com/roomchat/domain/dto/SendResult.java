package com.roomchat.domain.dto;

import com.roomchat.domain.entity.ConversationEntity;
import com.roomchat.domain.entity.ConversationParticipantEntity;
import com.roomchat.domain.entity.MessageEntity;

import java.util.List;

/**
 * @param duplicate 同一 (senderId, clientTempId) 已落库过，message 为已有记录，不应再次广播
 */
public record SendResult(
        MessageEntity message,
        ConversationEntity conversation,
        List<ConversationParticipantEntity> participants,
        boolean duplicate
) {
}
