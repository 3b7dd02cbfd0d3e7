package com.roomchat.gateway.presence;

import java.util.Set;

/**
 * 一次变更前后的状态。previous 为 null 表示此前没有记录。
 *
 * @param removedConnectionIds 本次被移除的连接（清扫时用于关闭残留 channel）
 */
public record PresenceTransition(
        long userId,
        PresenceStatus previous,
        PresenceStatus current,
        long lastSeenMs,
        Set<String> removedConnectionIds
) {

    public boolean statusChanged() {
        PresenceStatus before = previous == null ? PresenceStatus.OFFLINE : previous;
        return current != null && before != current;
    }

    public boolean wentOnline() {
        return statusChanged() && (previous == null || previous == PresenceStatus.OFFLINE);
    }

    public boolean wentOffline() {
        return statusChanged() && current == PresenceStatus.OFFLINE;
    }
}
