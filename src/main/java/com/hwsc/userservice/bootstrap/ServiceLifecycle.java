package com.hwsc.userservice.bootstrap;

import com.hwsc.userservice.availability.ServiceStateGate;
import com.hwsc.userservice.concurrency.IdentityLockRegistry;
import com.hwsc.userservice.entity.Secret;
import com.hwsc.userservice.service.SecretService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Startup: loads (or creates) the active secret before the first request.
 * Weekly: re-checks the active secret at the rotation boundary.
 * Shutdown: refuses new work and drops process-local state.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class ServiceLifecycle implements CommandLineRunner {

    private final SecretService secretService;
    private final ServiceStateGate stateGate;
    private final IdentityLockRegistry lockRegistry;

    @Override
    public void run(String... args) {
        Secret active = secretService.getActive();
        log.info("Active secret loaded; expires at {}", active.getExpiresAt());
    }

    @Scheduled(cron = "${user-service.secret.rotation-cron:0 0 3 * * MON}", zone = "UTC")
    public void rotateOnSchedule() {
        Secret active = secretService.getActive();
        log.info("Scheduled secret check done; active secret expires at {}", active.getExpiresAt());
    }

    @EventListener(ContextClosedEvent.class)
    public void onShutdown() {
        stateGate.lock();
        lockRegistry.clear();
        secretService.invalidateCache();
        log.info("User service stopped accepting requests");
    }
}
