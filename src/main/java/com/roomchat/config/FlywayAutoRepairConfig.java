package com.roomchat.config;

import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 开发期迁移脚本被改动后 checksum 不一致时，先 repair 再 migrate，避免启动直接失败。
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "chat.flyway.auto-repair", havingValue = "true", matchIfMissing = true)
public class FlywayAutoRepairConfig {

    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy() {
        return flyway -> {
            repairIfInvalid(flyway);
            flyway.migrate();
        };
    }

    static void repairIfInvalid(Flyway flyway) {
        try {
            flyway.validate();
        } catch (FlywayValidateException e) {
            log.warn("Flyway: validate failed, running repair() before migrate(): {}", e.toString());
            try {
                flyway.repair();
            } catch (Exception repairError) {
                log.warn("Flyway: repair() failed, continue migrate(): {}", repairError.toString());
            }
        } catch (Exception e) {
            log.warn("Flyway: validate() failed, continue migrate(): {}", e.toString());
        }
    }
}
