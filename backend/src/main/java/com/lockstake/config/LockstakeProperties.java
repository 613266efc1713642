package com.lockstake.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Ledger-wide settings: the privileged operator identity, the schedules seeded
 * into an empty catalog, and the in-process transfer gateway's starting pool.
 */
@Getter
@Setter
@Validated
@Component
@ConfigurationProperties(prefix = "lockstake")
public class LockstakeProperties {

    /**
     * Account allowed to upsert and disable reward schedules.
     */
    @NotBlank
    private String operator = "operator";

    /**
     * Seeded on startup when the schedule catalog is empty.
     */
    @Valid
    private List<ScheduleSeed> defaultSchedules = new ArrayList<>(List.of(
            new ScheduleSeed(90, 10),
            new ScheduleSeed(180, 20),
            new ScheduleSeed(360, 40)
    ));

    @Valid
    private Transfer transfer = new Transfer();

    @Getter
    @Setter
    public static class ScheduleSeed {
        @Min(1)
        private int lockDays;

        @Min(0)
        private int percentage;

        public ScheduleSeed() {
        }

        public ScheduleSeed(int lockDays, int percentage) {
            this.lockDays = lockDays;
            this.percentage = percentage;
        }
    }

    @Getter
    @Setter
    public static class Transfer {
        /**
         * Reward reserve credited to the pool when the in-memory gateway starts.
         */
        @Min(0)
        private long initialPoolBalance = 0L;
    }
}
