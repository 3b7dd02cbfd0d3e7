package com.roomchat.gateway.presence;

import com.roomchat.gateway.config.PresenceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * “最后活跃时间”的持久化：Redis 字符串 key，值为毫秒时间戳。
 *
 * <p>心跳写入按用户节流（lastActiveFlushMs 内最多一次），下线时强制写。Redis 不可用时只打 warn。</p>
 */
@Slf4j
@Component
public class LastActiveStore {

    static final String KEY_PREFIX = "chat:presence:last_active:";
    private static final Duration KEY_TTL = Duration.ofDays(30);

    private final StringRedisTemplate redis;
    private final long flushIntervalMs;
    private final ConcurrentHashMap<Long, Long> lastFlushedAt = new ConcurrentHashMap<>();

    public LastActiveStore(StringRedisTemplate redis, PresenceProperties props) {
        this.redis = redis;
        this.flushIntervalMs = props.lastActiveFlushMsEffective();
    }

    /**
     * @return 是否真的写了 Redis
     */
    public boolean record(long userId, long atMs, boolean force) {
        if (!force) {
            Long last = lastFlushedAt.get(userId);
            if (last != null && atMs - last < flushIntervalMs) {
                return false;
            }
        }
        try {
            redis.opsForValue().set(key(userId), String.valueOf(atMs), KEY_TTL);
        } catch (Exception e) {
            log.warn("record last active failed, redis unavailable? userId={}, err={}", userId, e.toString());
            return false;
        }
        if (force) {
            lastFlushedAt.remove(userId);
        } else {
            lastFlushedAt.put(userId, atMs);
        }
        return true;
    }

    /**
     * 无记录或 Redis 不可用时返回 null。
     */
    public Long get(long userId) {
        try {
            String v = redis.opsForValue().get(key(userId));
            return v == null || v.isBlank() ? null : Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            log.warn("bad last active value: userId={}", userId);
            return null;
        } catch (Exception e) {
            log.warn("read last active failed, redis unavailable? userId={}, err={}", userId, e.toString());
            return null;
        }
    }

    private static String key(long userId) {
        return KEY_PREFIX + userId;
    }
}
