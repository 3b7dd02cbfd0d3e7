package com.roomchat.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chat.auth")
public record AuthProperties(
        String issuer,
        String jwtSecret,
        long accessTokenTtlSeconds
) {

    public long accessTokenTtlSecondsEffective() {
        return accessTokenTtlSeconds <= 0 ? 1800 : accessTokenTtlSeconds;
    }
}
