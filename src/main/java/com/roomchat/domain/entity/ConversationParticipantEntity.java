package com.roomchat.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.roomchat.domain.enums.MemberRole;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_conversation_participant")
public class ConversationParticipantEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long conversationId;

    private Long userId;

    private MemberRole role;

    private Boolean active;

    private LocalDateTime joinedAt;

    private LocalDateTime leftAt;

    private LocalDateTime lastSeenAt;

    /** 非负；由 SQL 侧 +1 / 归零维护。 */
    private Integer unreadCount;

    private Boolean muted;

    /** 为空表示无限期静音。 */
    private LocalDateTime muteUntil;

    private Long lastReadMessageId;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    @JsonIgnore
    public boolean isActiveFlag() {
        return Boolean.TRUE.equals(active);
    }

    /**
     * 静音是否在 now 时刻生效：muted 且 muteUntil 为空或尚未到期。
     */
    public boolean isMutedAt(LocalDateTime now) {
        if (!Boolean.TRUE.equals(muted)) {
            return false;
        }
        return muteUntil == null || muteUntil.isAfter(now);
    }
}
