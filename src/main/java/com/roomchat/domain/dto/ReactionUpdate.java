package com.roomchat.domain.dto;

import com.roomchat.domain.entity.MessageEntity;
import com.roomchat.domain.entity.MessageReactionEntity;
import com.roomchat.domain.enums.ReactionType;

import java.util.List;

/**
 * @param reaction 为 null 表示该用户撤销了 reaction
 */
public record ReactionUpdate(
        MessageEntity message,
        long userId,
        ReactionType reaction,
        List<MessageReactionEntity> reactions
) {
}
