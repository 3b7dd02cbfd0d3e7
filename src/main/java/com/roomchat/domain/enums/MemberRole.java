package com.roomchat.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 会话成员角色（对应表字段：t_conversation_participant.role）。
 */
@Getter
@RequiredArgsConstructor
public enum MemberRole {

    /** 2 = admin */
    ADMIN(2, "admin"),

    /** 3 = member */
    MEMBER(3, "member");

    @EnumValue
    private final Integer code;

    @JsonValue
    private final String desc;
}
