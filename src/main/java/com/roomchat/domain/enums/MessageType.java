package com.roomchat.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 消息内容类型（对应表字段：t_message.msg_type）。
 */
@Getter
@RequiredArgsConstructor
public enum MessageType {

    TEXT(1, "text"),
    IMAGE(2, "image"),
    FILE(3, "file"),
    LOCATION(4, "location"),
    SHARED_LISTING(5, "shared_listing"),
    /** 系统消息只能由服务端生成 */
    SYSTEM(6, "system");

    @EnumValue
    private final Integer code;

    @JsonValue
    private final String desc;

    /**
     * 协议层字符串（"TEXT" / "text" / "shared-listing"）转枚举；空值按 TEXT，无法识别返回 null。
     */
    public static MessageType fromString(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        String v = value.trim().replace('-', '_');
        for (MessageType t : values()) {
            if (t.name().equalsIgnoreCase(v) || t.desc.equalsIgnoreCase(v)) {
                return t;
            }
        }
        return null;
    }
}
