package com.lockstake.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Ensures the default schedule catalog exists on startup.
 */
@Component
public class RewardScheduleBootstrapService implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(RewardScheduleBootstrapService.class);

    private final RewardScheduleService rewardScheduleService;

    public RewardScheduleBootstrapService(RewardScheduleService rewardScheduleService) {
        this.rewardScheduleService = rewardScheduleService;
    }

    @Override
    public void run(ApplicationArguments args) {
        int seeded = rewardScheduleService.initialize();
        if (seeded == 0) {
            log.debug("Schedule bootstrap skipped: catalog already populated.");
            return;
        }
        log.info("Bootstrapped {} reward schedules, catalog version {}",
                seeded, rewardScheduleService.catalogVersion());
    }
}
