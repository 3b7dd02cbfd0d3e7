package com.roomchat.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chat.caffeine.client-temp-id")
public class ClientTempIdCaffeineProperties {

    /** 是否启用发送幂等缓存。关闭后只靠库表唯一键兜底。 */
    private boolean enabled = true;

    /** Caffeine 初始容量。 */
    private int initialCapacity = 100;

    /** Caffeine 最大条目数。 */
    private long maximumSize = 10000;

    /** 过期（秒）。 */
    private long expireAfterAccessSeconds = 1800;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    public void setInitialCapacity(int initialCapacity) {
        this.initialCapacity = initialCapacity;
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public void setMaximumSize(long maximumSize) {
        this.maximumSize = maximumSize;
    }

    public long getExpireAfterAccessSeconds() {
        return expireAfterAccessSeconds;
    }

    public void setExpireAfterAccessSeconds(long expireAfterAccessSeconds) {
        this.expireAfterAccessSeconds = expireAfterAccessSeconds;
    }
}
