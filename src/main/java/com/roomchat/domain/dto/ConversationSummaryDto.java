package com.roomchat.domain.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 会话列表项：会话投影 + 当前用户自己的未读/静音状态。
 */
@Data
public class ConversationSummaryDto {
    private Long id;
    private String type;
    private String status;
    private String title;
    private Long matchId;
    private Long listingId;
    private Long lastMessageId;
    private String lastMessageContent;
    private Long lastMessageSenderId;
    private String lastMessageType;
    private LocalDateTime lastMessageAt;
    private Integer unreadCount;
    private Boolean muted;
    private LocalDateTime muteUntil;
}
