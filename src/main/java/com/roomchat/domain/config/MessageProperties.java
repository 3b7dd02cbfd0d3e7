package com.roomchat.domain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chat.message")
public record MessageProperties(
        Integer maxContentLength,
        Integer editWindowHours,
        Integer deleteForEveryoneWindowMinutes,
        Integer lastMessagePreviewLength,
        Integer historyMaxPageSize
) {

    public int maxContentLengthEffective() {
        return maxContentLength == null || maxContentLength <= 0 ? 5000 : maxContentLength;
    }

    public int editWindowHoursEffective() {
        return editWindowHours == null || editWindowHours <= 0 ? 24 : editWindowHours;
    }

    public int deleteForEveryoneWindowMinutesEffective() {
        return deleteForEveryoneWindowMinutes == null || deleteForEveryoneWindowMinutes <= 0 ? 60 : deleteForEveryoneWindowMinutes;
    }

    public int lastMessagePreviewLengthEffective() {
        return lastMessagePreviewLength == null || lastMessagePreviewLength <= 0 ? 200 : lastMessagePreviewLength;
    }

    public int historyMaxPageSizeEffective() {
        return historyMaxPageSize == null || historyMaxPageSize <= 0 ? 100 : historyMaxPageSize;
    }
}
