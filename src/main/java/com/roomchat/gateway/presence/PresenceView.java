package com.roomchat.gateway.presence;

/**
 * 对外的在线状态视图。没有内存记录时 status 为 offline，lastSeen 取持久化的最后活跃时间（可能为 null）。
 */
public record PresenceView(
        long userId,
        PresenceStatus status,
        Long lastSeen,
        PresenceActivity activity
) {

    public static PresenceView of(PresenceSnapshot snapshot) {
        return new PresenceView(snapshot.userId(), snapshot.status(), snapshot.lastSeenMs(), snapshot.activity());
    }
}
