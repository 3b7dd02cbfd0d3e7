package com.roomchat.gateway.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({GatewayProperties.class, PresenceProperties.class, ClientTempIdCaffeineProperties.class})
public class GatewayConfig {
}
