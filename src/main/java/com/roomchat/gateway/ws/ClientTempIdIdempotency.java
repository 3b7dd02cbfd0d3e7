package com.roomchat.gateway.ws;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.roomchat.gateway.config.ClientTempIdCaffeineProperties;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 基于 Caffeine 的发送幂等：(senderId, clientTempId) -> 预分配的 messageId。
 *
 * <p>客户端重发时直接回同一个 messageId，不再重复落库/广播。进程重启后靠 t_message 唯一键兜底。</p>
 */
@Component
public class ClientTempIdIdempotency {

    @Getter
    private final ClientTempIdCaffeineProperties props;

    private final Cache<String, Long> cache;

    public ClientTempIdIdempotency(ClientTempIdCaffeineProperties props) {
        this.props = props;
        this.cache = Caffeine.newBuilder()
                .initialCapacity(Math.max(1, props.getInitialCapacity()))
                .maximumSize(Math.max(1, props.getMaximumSize()))
                .expireAfterAccess(Duration.ofSeconds(Math.max(1, props.getExpireAfterAccessSeconds())))
                .build();
    }

    public String key(long senderId, String clientTempId) {
        return senderId + "-" + clientTempId;
    }

    /**
     * 抢占 key。返回 null 表示抢占成功；否则返回已占用的 messageId。未启用时总是返回 null。
     */
    public Long claim(String key, long messageId) {
        if (!props.isEnabled() || key == null) {
            return null;
        }
        return cache.asMap().putIfAbsent(key, messageId);
    }

    public Long get(String key) {
        return key == null ? null : cache.getIfPresent(key);
    }

    /**
     * 发送失败时释放，允许用同一 clientTempId 重试。
     */
    public void release(String key) {
        if (key != null) {
            cache.invalidate(key);
        }
    }
}
