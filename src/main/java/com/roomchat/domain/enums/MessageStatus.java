package com.roomchat.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 消息投递状态（对应表字段：t_message.status）。
 *
 * <p>只允许前进：sent → delivered → read；failed 只能从 sent 进入，且为终态。</p>
 */
@Getter
@RequiredArgsConstructor
public enum MessageStatus {

    /** 0 = sent */
    SENT(0, "sent"),

    /** 1 = delivered */
    DELIVERED(1, "delivered"),

    /** 2 = read */
    READ(2, "read"),

    /** 3 = failed */
    FAILED(3, "failed");

    @EnumValue
    private final Integer code;

    @JsonValue
    private final String desc;

    public boolean canAdvanceTo(MessageStatus next) {
        if (next == null || next == this) {
            return false;
        }
        return switch (this) {
            case SENT -> true;
            case DELIVERED -> next == READ;
            case READ, FAILED -> false;
        };
    }
}
