package com.roomchat.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.roomchat.domain.enums.ReactionType;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * (messageId, userId) 唯一：同一用户对同一消息只保留最后一次 reaction。
 */
@Data
@TableName("t_message_reaction")
public class MessageReactionEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long messageId;

    private Long userId;

    private ReactionType reaction;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;
}
