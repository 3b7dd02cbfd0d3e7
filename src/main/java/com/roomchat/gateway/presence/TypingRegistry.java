package com.roomchat.gateway.presence;

import com.roomchat.gateway.config.PresenceProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 输入中状态：(userId, conversationId) -> startedAtMs。
 *
 * <p>超过 TTL 的条目即使还没被清扫也视为无效。</p>
 */
@Component
public class TypingRegistry {

    public record TypingKey(long userId, long conversationId) {
    }

    private final ConcurrentHashMap<TypingKey, Long> entries = new ConcurrentHashMap<>();
    private final long ttlMs;

    public TypingRegistry(PresenceProperties props) {
        this.ttlMs = props.typingTtlMsEffective();
    }

    /**
     * 刷新时间戳。返回 true 表示是一次新的开始（之前不存在或已过期），调用方据此决定是否广播。
     */
    public boolean start(long userId, long conversationId, long nowMs) {
        Long prev = entries.put(new TypingKey(userId, conversationId), nowMs);
        return prev == null || isExpired(prev, nowMs);
    }

    /**
     * 返回 true 表示确实移除了一个条目。
     */
    public boolean stop(long userId, long conversationId) {
        return entries.remove(new TypingKey(userId, conversationId)) != null;
    }

    public boolean isTyping(long userId, long conversationId, long nowMs) {
        Long startedAt = entries.get(new TypingKey(userId, conversationId));
        return startedAt != null && !isExpired(startedAt, nowMs);
    }

    public List<Long> typingUsers(long conversationId, long nowMs) {
        List<Long> out = new ArrayList<>();
        for (Map.Entry<TypingKey, Long> e : entries.entrySet()) {
            if (e.getKey().conversationId() == conversationId && !isExpired(e.getValue(), nowMs)) {
                out.add(e.getKey().userId());
            }
        }
        return out;
    }

    /**
     * 移除该用户所有条目，返回受影响的 conversationId。
     */
    public List<Long> clearUser(long userId) {
        List<Long> conversations = new ArrayList<>();
        for (TypingKey key : entries.keySet()) {
            if (key.userId() == userId && entries.remove(key) != null) {
                conversations.add(key.conversationId());
            }
        }
        return conversations;
    }

    /**
     * 移除所有过期条目。用 remove(key, value) 避免误删清扫期间被刷新的条目。
     */
    public List<TypingKey> sweepExpired(long nowMs) {
        List<TypingKey> expired = new ArrayList<>();
        for (Map.Entry<TypingKey, Long> e : entries.entrySet()) {
            Long startedAt = e.getValue();
            if (isExpired(startedAt, nowMs) && entries.remove(e.getKey(), startedAt)) {
                expired.add(e.getKey());
            }
        }
        return expired;
    }

    public int activeCount(long nowMs) {
        int n = 0;
        for (Long startedAt : entries.values()) {
            if (!isExpired(startedAt, nowMs)) {
                n++;
            }
        }
        return n;
    }

    private boolean isExpired(long startedAtMs, long nowMs) {
        return nowMs - startedAtMs >= ttlMs;
    }
}
