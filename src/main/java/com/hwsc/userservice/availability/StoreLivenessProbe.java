package com.hwsc.userservice.availability;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.actuate.jdbc.DataSourceHealthIndicator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * Answers whether the relational store currently accepts connections.
 */
@Slf4j
@Component
public class StoreLivenessProbe {

    private final DataSourceHealthIndicator indicator;

    public StoreLivenessProbe(DataSource dataSource) {
        this.indicator = new DataSourceHealthIndicator(dataSource);
    }

    public boolean isReachable() {
        Health health = indicator.health();
        if (!Status.UP.equals(health.getStatus())) {
            log.error("Relational store is not reachable: {}", health.getDetails());
            return false;
        }
        return true;
    }
}
