package com.roomchat.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 在线状态 / 输入中状态的时间参数（毫秒）。
 */
@ConfigurationProperties(prefix = "chat.presence")
public record PresenceProperties(
        Long staleAfterMs,
        Long typingTtlMs,
        Long offlineRetentionMs,
        Long lastActiveFlushMs,
        Long sweepFixedDelayMs
) {

    public long staleAfterMsEffective() {
        return staleAfterMs == null || staleAfterMs <= 0 ? 300_000 : staleAfterMs;
    }

    public long typingTtlMsEffective() {
        return typingTtlMs == null || typingTtlMs <= 0 ? 30_000 : typingTtlMs;
    }

    public long offlineRetentionMsEffective() {
        return offlineRetentionMs == null || offlineRetentionMs <= 0 ? 86_400_000 : offlineRetentionMs;
    }

    public long lastActiveFlushMsEffective() {
        return lastActiveFlushMs == null || lastActiveFlushMs < 0 ? 60_000 : lastActiveFlushMs;
    }
}
