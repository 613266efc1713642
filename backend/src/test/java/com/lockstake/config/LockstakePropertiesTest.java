package com.lockstake.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LockstakePropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    ConfigurationPropertiesAutoConfiguration.class,
                    ValidationAutoConfiguration.class
            ))
            .withUserConfiguration(LockstakeProperties.class);

    @Test
    void contextStartsWithLockstakePropertyBean() {
        contextRunner.run(context -> assertTrue(context.containsBean("lockstakeProperties")));
    }

    @Test
    void bindsDefaultValues() {
        contextRunner.run(context -> {
            LockstakeProperties properties = context.getBean(LockstakeProperties.class);

            assertEquals("operator", properties.getOperator());
            assertEquals(List.of(90, 180, 360), properties.getDefaultSchedules().stream()
                    .map(LockstakeProperties.ScheduleSeed::getLockDays)
                    .toList());
            assertEquals(List.of(10, 20, 40), properties.getDefaultSchedules().stream()
                    .map(LockstakeProperties.ScheduleSeed::getPercentage)
                    .toList());
            assertEquals(0L, properties.getTransfer().getInitialPoolBalance());
        });
    }

    @Test
    void bindsOverridesFromProperties() {
        contextRunner
                .withPropertyValues(
                        "lockstake.operator=treasury-admin",
                        "lockstake.default-schedules[0].lock-days=30",
                        "lockstake.default-schedules[0].percentage=3",
                        "lockstake.default-schedules[1].lock-days=365",
                        "lockstake.default-schedules[1].percentage=45",
                        "lockstake.transfer.initial-pool-balance=1000000"
                )
                .run(context -> {
                    LockstakeProperties properties = context.getBean(LockstakeProperties.class);

                    assertEquals("treasury-admin", properties.getOperator());
                    assertEquals(2, properties.getDefaultSchedules().size());
                    assertEquals(30, properties.getDefaultSchedules().get(0).getLockDays());
                    assertEquals(3, properties.getDefaultSchedules().get(0).getPercentage());
                    assertEquals(365, properties.getDefaultSchedules().get(1).getLockDays());
                    assertEquals(45, properties.getDefaultSchedules().get(1).getPercentage());
                    assertEquals(1_000_000L, properties.getTransfer().getInitialPoolBalance());
                });
    }

    @Test
    void rejectsScheduleSeedWithoutLockDays() {
        contextRunner
                .withPropertyValues(
                        "lockstake.default-schedules[0].lock-days=0",
                        "lockstake.default-schedules[0].percentage=10"
                )
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    void rejectsBlankOperator() {
        contextRunner
                .withPropertyValues("lockstake.operator= ")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }
}
