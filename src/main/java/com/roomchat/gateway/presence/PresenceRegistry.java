package com.roomchat.gateway.presence;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内在线状态表：userId -> {@link PresenceSnapshot}。
 *
 * <p>所有写操作都走 {@link ConcurrentHashMap#compute}，同一 userId 串行；记录本身不可变，读到的总是一致快照。</p>
 * <p>不变式：status != offline 当且仅当 connectionIds 非空。</p>
 */
@Slf4j
@Component
public class PresenceRegistry {

    private final ConcurrentHashMap<Long, PresenceSnapshot> records = new ConcurrentHashMap<>();

    /**
     * 加入一个连接。首个连接使状态变为 online；已处于 away/busy 时保持原状态。
     */
    public PresenceTransition setOnline(long userId, String connectionId, long nowMs) {
        PresenceTransition[] out = new PresenceTransition[1];
        records.compute(userId, (k, cur) -> {
            PresenceStatus prev = cur == null ? null : cur.status();
            Set<String> conns = new LinkedHashSet<>(cur == null ? Set.of() : cur.connectionIds());
            conns.add(connectionId);
            PresenceSnapshot next;
            if (cur == null || !cur.status().isReachable()) {
                next = new PresenceSnapshot(userId, PresenceStatus.ONLINE, nowMs, Set.copyOf(conns), null, nowMs);
            } else {
                next = cur.withConnections(cur.status(), conns, nowMs);
            }
            out[0] = new PresenceTransition(userId, prev, next.status(), nowMs, Set.of());
            return next;
        });
        return out[0];
    }

    /**
     * 移除连接；connectionId 为 null 时移除全部。连接集合为空时强制 offline 并记录 lastSeen。
     */
    public PresenceTransition setOffline(long userId, String connectionId, long nowMs) {
        PresenceTransition[] out = new PresenceTransition[1];
        records.computeIfPresent(userId, (k, cur) -> {
            Set<String> conns = new LinkedHashSet<>(cur.connectionIds());
            Set<String> removed;
            if (connectionId == null) {
                removed = Set.copyOf(conns);
                conns.clear();
            } else {
                removed = conns.remove(connectionId) ? Set.of(connectionId) : Set.of();
            }
            PresenceSnapshot next;
            if (conns.isEmpty()) {
                next = cur.status().isReachable() ? cur.offline(nowMs) : cur;
            } else {
                next = cur.withConnections(cur.status(), conns, cur.lastSeenMs());
            }
            out[0] = new PresenceTransition(userId, cur.status(), next.status(), next.lastSeenMs(), removed);
            return next;
        });
        if (out[0] == null) {
            return new PresenceTransition(userId, null, PresenceStatus.OFFLINE, nowMs, Set.of());
        }
        return out[0];
    }

    /**
     * 客户端主动切换 online/away/busy。没有存活连接时不生效（返回的 transition 无变化）。
     */
    public PresenceTransition updateStatus(long userId, PresenceStatus status, long nowMs) {
        if (status == null || status == PresenceStatus.OFFLINE) {
            throw new IllegalArgumentException("status must be online/away/busy");
        }
        PresenceTransition[] out = new PresenceTransition[1];
        records.computeIfPresent(userId, (k, cur) -> {
            if (cur.connectionIds().isEmpty()) {
                out[0] = new PresenceTransition(userId, cur.status(), cur.status(), cur.lastSeenMs(), Set.of());
                return cur;
            }
            PresenceSnapshot next = cur.withStatus(status, nowMs);
            out[0] = new PresenceTransition(userId, cur.status(), status, nowMs, Set.of());
            return next;
        });
        if (out[0] == null) {
            return new PresenceTransition(userId, null, PresenceStatus.OFFLINE, nowMs, Set.of());
        }
        return out[0];
    }

    public boolean setActivity(long userId, ActivityKind kind, String detail, long nowMs) {
        boolean[] applied = new boolean[1];
        records.computeIfPresent(userId, (k, cur) -> {
            if (!cur.status().isReachable()) {
                return cur;
            }
            applied[0] = true;
            return cur.withActivity(new PresenceActivity(kind, detail, nowMs), nowMs);
        });
        return applied[0];
    }

    public boolean clearActivity(long userId, long nowMs) {
        boolean[] applied = new boolean[1];
        records.computeIfPresent(userId, (k, cur) -> {
            if (cur.activity() == null) {
                return cur;
            }
            applied[0] = true;
            return cur.withActivity(null, cur.status().isReachable() ? nowMs : cur.lastSeenMs());
        });
        return applied[0];
    }

    /**
     * 心跳：刷新 lastSeen。offline 记录不受影响。
     */
    public void touch(long userId, long nowMs) {
        records.computeIfPresent(userId, (k, cur) -> cur.status().isReachable() ? cur.withLastSeen(nowMs) : cur);
    }

    public boolean isOnline(long userId) {
        PresenceSnapshot s = records.get(userId);
        return s != null && s.status().isReachable();
    }

    public PresenceStatus status(long userId) {
        PresenceSnapshot s = records.get(userId);
        return s == null ? PresenceStatus.OFFLINE : s.status();
    }

    public Set<String> connectionIds(long userId) {
        PresenceSnapshot s = records.get(userId);
        return s == null ? Collections.emptySet() : s.connectionIds();
    }

    /**
     * 无记录返回 null。
     */
    public PresenceSnapshot snapshot(long userId) {
        return records.get(userId);
    }

    public List<Long> onlineUserIds() {
        List<Long> ids = new ArrayList<>();
        for (PresenceSnapshot s : records.values()) {
            if (s.status().isReachable()) {
                ids.add(s.userId());
            }
        }
        return ids;
    }

    /**
     * 清扫：lastSeen 超过 staleAfterMs 且仍可达的记录强制 offline，连接一并清空。
     */
    public List<PresenceTransition> sweepStale(long nowMs, long staleAfterMs) {
        List<PresenceTransition> forced = new ArrayList<>();
        for (Long userId : records.keySet()) {
            records.computeIfPresent(userId, (k, cur) -> {
                if (!cur.status().isReachable() || nowMs - cur.lastSeenMs() <= staleAfterMs) {
                    return cur;
                }
                forced.add(new PresenceTransition(k, cur.status(), PresenceStatus.OFFLINE, cur.lastSeenMs(), cur.connectionIds()));
                // lastSeen 保留最后一次心跳时间，不用清扫时间
                return cur.offline(cur.lastSeenMs());
            });
        }
        if (!forced.isEmpty()) {
            log.info("presence sweep forced offline: count={}", forced.size());
        }
        return forced;
    }

    /**
     * 删除 offline 超过 retentionMs 的记录，返回删除条数。
     */
    public int pruneOffline(long nowMs, long retentionMs) {
        int[] removed = new int[1];
        for (Long userId : records.keySet()) {
            records.computeIfPresent(userId, (k, cur) -> {
                if (!cur.status().isReachable() && nowMs - cur.lastSeenMs() > retentionMs) {
                    removed[0]++;
                    return null;
                }
                return cur;
            });
        }
        return removed[0];
    }

    public PresenceStats stats(long nowMs, int typingCount) {
        int online = 0;
        int away = 0;
        int busy = 0;
        int offline = 0;
        long totalSessionMs = 0;
        int sessions = 0;
        for (PresenceSnapshot s : records.values()) {
            switch (s.status()) {
                case ONLINE -> online++;
                case AWAY -> away++;
                case BUSY -> busy++;
                case OFFLINE -> offline++;
            }
            if (s.status().isReachable()) {
                totalSessionMs += Math.max(0, nowMs - s.sessionStartedAtMs());
                sessions++;
            }
        }
        double avgMinutes = sessions == 0 ? 0D : (totalSessionMs / (double) sessions) / 60_000D;
        return new PresenceStats(online, away, busy, offline, typingCount, avgMinutes);
    }
}
