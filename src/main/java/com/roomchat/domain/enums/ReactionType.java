package com.roomchat.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ReactionType {

    LIKE(1, "like"),
    LOVE(2, "love"),
    LAUGH(3, "laugh"),
    WOW(4, "wow"),
    SAD(5, "sad"),
    ANGRY(6, "angry");

    @EnumValue
    private final Integer code;

    @JsonValue
    private final String desc;

    public static ReactionType fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        for (ReactionType t : values()) {
            if (t.name().equalsIgnoreCase(v) || t.desc.equalsIgnoreCase(v)) {
                return t;
            }
        }
        return null;
    }
}
