package com.roomchat.gateway.presence;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ActivityKind {

    BROWSING("browsing"),
    /** detail 为正在查看的 conversationId */
    MESSAGING("messaging"),
    VIEWING_PROPERTY("viewing_property"),
    MATCHING("matching");

    @JsonValue
    private final String desc;

    public static ActivityKind fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim().replace('-', '_');
        for (ActivityKind k : values()) {
            if (k.desc.equalsIgnoreCase(v)) {
                return k;
            }
        }
        return null;
    }
}
