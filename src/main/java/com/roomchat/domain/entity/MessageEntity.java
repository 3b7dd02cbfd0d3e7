package com.roomchat.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.roomchat.domain.enums.MessageStatus;
import com.roomchat.domain.enums.MessageType;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 消息：只追加、软删除，状态列只前进。
 */
@Data
@TableName(value = "t_message", autoResultMap = true)
public class MessageEntity {

    public static final String DELETED_PLACEHOLDER = "This message was deleted";

    /** 网关落库前预分配（IdWorker），失败时据此把行标记为 failed。 */
    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long conversationId;

    private Long senderId;

    /** 单聊时为对端 userId；群聊为 null，按房间广播。 */
    private Long receiverId;

    private MessageType msgType;

    private String content;

    /** file: fileUrl/fileName/fileSize/mimeType；location: latitude/longitude/address；shared_listing: listingId；system: systemMessageType */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private Map<String, Object> metadata;

    private MessageStatus status;

    private LocalDateTime deliveredAt;

    private LocalDateTime readAt;

    private Long replyToId;

    private Boolean edited;

    private LocalDateTime editedAt;

    /** 首次编辑/全员删除前的原文，仅审计用，不下发。 */
    @JsonIgnore
    private String originalContent;

    private Boolean deleted;

    private LocalDateTime deletedAt;

    private Long deletedBy;

    private Boolean deletedForEveryone;

    private String clientTempId;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    @JsonIgnore
    public boolean isDeletedFlag() {
        return Boolean.TRUE.equals(deleted);
    }

    @JsonIgnore
    public boolean isDeletedForEveryoneFlag() {
        return Boolean.TRUE.equals(deletedForEveryone);
    }
}
