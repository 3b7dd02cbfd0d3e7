package com.roomchat.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 会话类型（对应表字段：t_conversation.type）。
 *
 * <ul>
 *   <li>1 = 单聊（DIRECT），恰好 2 人</li>
 *   <li>2 = 群聊（GROUP），2-50 人</li>
 *   <li>3 = 客服（SUPPORT）</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum ConversationType {

    DIRECT(1, "direct", 2),
    GROUP(2, "group", 50),
    SUPPORT(3, "support", 50);

    @EnumValue
    private final Integer code;

    @JsonValue
    private final String desc;

    private final int maxParticipants;

    public static ConversationType fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        for (ConversationType t : values()) {
            if (t.name().equalsIgnoreCase(v) || t.desc.equalsIgnoreCase(v)) {
                return t;
            }
        }
        return null;
    }
}
