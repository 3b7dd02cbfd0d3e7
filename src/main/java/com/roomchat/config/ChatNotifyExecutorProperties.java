package com.roomchat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 离线通知投递线程池：与落库线程池隔离，通知侧变慢不拖累消息链路。
 */
@ConfigurationProperties(prefix = "chat.executors.notify")
public record ChatNotifyExecutorProperties(
        Integer corePoolSize,
        Integer maxPoolSize,
        Integer queueCapacity
) {

    public int corePoolSizeEffective() {
        return corePoolSize == null ? 2 : Math.max(1, corePoolSize);
    }

    public int maxPoolSizeEffective() {
        return maxPoolSize == null ? 4 : Math.max(1, maxPoolSize);
    }

    public int queueCapacityEffective() {
        return queueCapacity == null ? 5_000 : Math.max(0, queueCapacity);
    }
}
