package com.roomchat.gateway.presence;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * offline 以外的状态都算“可达”。
 */
@Getter
@RequiredArgsConstructor
public enum PresenceStatus {

    ONLINE("online"),
    AWAY("away"),
    BUSY("busy"),
    OFFLINE("offline");

    @JsonValue
    private final String desc;

    public boolean isReachable() {
        return this != OFFLINE;
    }

    public static PresenceStatus fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        for (PresenceStatus s : values()) {
            if (s.desc.equalsIgnoreCase(v)) {
                return s;
            }
        }
        return null;
    }
}
