package com.roomchat.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 会话状态（对应表字段：t_conversation.status）。会话从不物理删除，只流转到 DELETED。
 */
@Getter
@RequiredArgsConstructor
public enum ConversationStatus {

    ACTIVE(1, "active"),
    ARCHIVED(2, "archived"),
    BLOCKED(3, "blocked"),
    DELETED(4, "deleted");

    @EnumValue
    private final Integer code;

    @JsonValue
    private final String desc;

    public static ConversationStatus fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        for (ConversationStatus s : values()) {
            if (s.name().equalsIgnoreCase(v) || s.desc.equalsIgnoreCase(v)) {
                return s;
            }
        }
        return null;
    }
}
