package com.meritmarket.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes every state-mutating protocol operation and refuses re-entry from inside one.
 * Must wrap the transactional call so the transaction commits before the next operation starts.
 */
@Component
public class ProtocolOperationGuard {

    private static final Logger log = LoggerFactory.getLogger(ProtocolOperationGuard.class);

    private final ReentrantLock lock = new ReentrantLock(true);
    private final ThreadLocal<String> inFlight = new ThreadLocal<>();

    public <T> T execute(String operation, Supplier<T> body) {
        if (lock.isHeldByCurrentThread()) {
            throw new ReentrantOperationException(operation, inFlight.get());
        }
        lock.lock();
        inFlight.set(operation);
        try {
            log.debug("Executing {}", operation);
            return body.get();
        } finally {
            inFlight.remove();
            lock.unlock();
        }
    }

    public void execute(String operation, Runnable body) {
        execute(operation, () -> {
            body.run();
            return null;
        });
    }

    public boolean isBusy() {
        return lock.isLocked();
    }
}
