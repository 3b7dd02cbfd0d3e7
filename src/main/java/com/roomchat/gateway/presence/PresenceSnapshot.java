package com.roomchat.gateway.presence;

import java.util.Set;

/**
 * 某一时刻的不可变在线记录。
 *
 * @param sessionStartedAtMs 本次从 offline 变为可达的时间；offline 时保留上一段会话的起点
 */
public record PresenceSnapshot(
        long userId,
        PresenceStatus status,
        long lastSeenMs,
        Set<String> connectionIds,
        PresenceActivity activity,
        long sessionStartedAtMs
) {

    public boolean isOnline() {
        return status.isReachable();
    }

    PresenceSnapshot withConnections(PresenceStatus newStatus, Set<String> newConnectionIds, long seenMs) {
        return new PresenceSnapshot(userId, newStatus, seenMs, Set.copyOf(newConnectionIds), activity, sessionStartedAtMs);
    }

    PresenceSnapshot withStatus(PresenceStatus newStatus, long seenMs) {
        return new PresenceSnapshot(userId, newStatus, seenMs, connectionIds, activity, sessionStartedAtMs);
    }

    PresenceSnapshot withActivity(PresenceActivity newActivity, long seenMs) {
        return new PresenceSnapshot(userId, status, seenMs, connectionIds, newActivity, sessionStartedAtMs);
    }

    PresenceSnapshot withLastSeen(long seenMs) {
        return new PresenceSnapshot(userId, status, seenMs, connectionIds, activity, sessionStartedAtMs);
    }

    PresenceSnapshot offline(long seenMs) {
        return new PresenceSnapshot(userId, PresenceStatus.OFFLINE, seenMs, Set.of(), null, sessionStartedAtMs);
    }
}
