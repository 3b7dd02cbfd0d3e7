package com.roomchat.config;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class FlywayAutoRepairConfigTest {
    private final ApplicationContextRunner contextRunner =
            new ApplicationContextRunner().withUserConfiguration(FlywayAutoRepairConfig.class);

    @Test
    void createsStrategyByDefault() {
        contextRunner.run(context -> assertThat(context).hasSingleBean(FlywayMigrationStrategy.class));
    }

    @Test
    void canDisableByProperty() {
        contextRunner
                .withPropertyValues("chat.flyway.auto-repair=false")
                .run(context -> assertThat(context).doesNotHaveBean(FlywayMigrationStrategy.class));
    }

    @Test
    void repairsOnlyWhenValidateFails() {
        Flyway ok = mock(Flyway.class);
        FlywayAutoRepairConfig.repairIfInvalid(ok);
        verify(ok, never()).repair();

        Flyway broken = mock(Flyway.class);
        doThrow(mock(FlywayValidateException.class)).when(broken).validate();
        FlywayAutoRepairConfig.repairIfInvalid(broken);
        verify(broken).repair();
    }
}
