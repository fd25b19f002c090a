package com.hwsc.userservice.availability;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Administrative on/off switch checked at the start of every operation.
 */
@Slf4j
@Component
public class ServiceStateGate {

    private final ReadWriteLock stateLock = new ReentrantReadWriteLock();
    private ServiceState state = ServiceState.AVAILABLE;

    public boolean isAvailable() {
        stateLock.readLock().lock();
        try {
            return state == ServiceState.AVAILABLE;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public ServiceState current() {
        stateLock.readLock().lock();
        try {
            return state;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public void lock() {
        set(ServiceState.UNAVAILABLE);
    }

    public void unlock() {
        set(ServiceState.AVAILABLE);
    }

    private void set(ServiceState next) {
        stateLock.writeLock().lock();
        try {
            if (state != next) {
                log.info("Service state {} -> {}", state, next);
            }
            state = next;
        } finally {
            stateLock.writeLock().unlock();
        }
    }
}
