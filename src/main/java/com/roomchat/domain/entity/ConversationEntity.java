package com.roomchat.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.roomchat.domain.enums.ConversationStatus;
import com.roomchat.domain.enums.ConversationType;
import com.roomchat.domain.enums.MessageType;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 会话。lastMessage 与 analytics 是消息流的增量投影，不是第二份事实来源。
 */
@Data
@TableName("t_conversation")
public class ConversationEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private ConversationType type;

    private ConversationStatus status;

    private String title;

    /** 撮合来源（室友匹配 id），可空 */
    private Long matchId;

    /** 关联房源 id，可空 */
    private Long listingId;

    private Long createdBy;

    private Integer maxParticipants;

    private Long lastMessageId;

    private String lastMessageContent;

    private Long lastMessageSenderId;

    private MessageType lastMessageType;

    private LocalDateTime lastMessageAt;

    private Long totalMessages;

    private Integer messagesThisWeek;

    private Integer messagesThisMonth;

    private LocalDate weekStart;

    private LocalDate monthStart;

    private Long responseCount;

    private Long averageResponseTimeMs;

    private LocalDateTime lastActivityAt;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;
}
