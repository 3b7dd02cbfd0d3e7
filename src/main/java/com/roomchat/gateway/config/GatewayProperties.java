package com.roomchat.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chat.gateway.ws")
public record GatewayProperties(
        String host,
        int port,
        String path,
        /** 握手后未完成鉴权的最长等待（毫秒），<=0 表示不限制 */
        Long authTimeoutMs,
        Integer readerIdleSeconds,
        Integer writerIdleSeconds,
        Integer maxFrameBytes
) {

    public String hostEffective() {
        return host == null || host.isBlank() ? "0.0.0.0" : host;
    }

    public String pathEffective() {
        return path == null || path.isBlank() ? "/ws" : path;
    }

    public long authTimeoutMsEffective() {
        return authTimeoutMs == null ? 5000 : authTimeoutMs;
    }

    public int readerIdleSecondsEffective() {
        return readerIdleSeconds == null || readerIdleSeconds < 0 ? 90 : readerIdleSeconds;
    }

    public int writerIdleSecondsEffective() {
        return writerIdleSeconds == null || writerIdleSeconds < 0 ? 30 : writerIdleSeconds;
    }

    public int maxFrameBytesEffective() {
        return maxFrameBytes == null || maxFrameBytes <= 0 ? 65536 : maxFrameBytes;
    }
}
