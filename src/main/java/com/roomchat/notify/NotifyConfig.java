package com.roomchat.notify;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(NotifyProperties.class)
public class NotifyConfig {

    @Bean
    @ConditionalOnMissingBean(NotificationDispatcher.class)
    public NotificationDispatcher notificationDispatcher() {
        return new LoggingNotificationDispatcher();
    }
}
