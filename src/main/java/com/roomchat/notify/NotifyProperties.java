package com.roomchat.notify;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chat.notify")
public record NotifyProperties(
        Boolean enabled,
        Long emailAfterAbsentMs
) {

    public boolean enabledEffective() {
        return enabled == null || enabled;
    }

    public long emailAfterAbsentMsEffective() {
        return emailAfterAbsentMs == null || emailAfterAbsentMs <= 0 ? 1_800_000 : emailAfterAbsentMs;
    }
}
