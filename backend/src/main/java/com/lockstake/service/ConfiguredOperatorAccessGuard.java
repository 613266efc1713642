package com.lockstake.service;

import com.lockstake.config.LockstakeProperties;
import com.lockstake.exception.StakingException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ConfiguredOperatorAccessGuard implements OperatorAccessGuard {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredOperatorAccessGuard.class);

    private final LockstakeProperties lockstakeProperties;

    @Override
    public void requireOperator(String caller) {
        String operator = lockstakeProperties.getOperator();
        if (caller == null || operator == null || !operator.equals(caller)) {
            log.warn("Rejected privileged call from {}", caller);
            throw StakingException.unauthorized(caller);
        }
    }
}
