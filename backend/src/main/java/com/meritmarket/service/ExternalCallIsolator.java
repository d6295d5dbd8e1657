package com.meritmarket.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs best-effort collaborator calls. A failure is logged and published as an
 * {@link ExternalCallFailedEvent} and returned to the caller instead of propagating.
 */
@Component
@RequiredArgsConstructor
public class ExternalCallIsolator {

    private static final Logger log = LoggerFactory.getLogger(ExternalCallIsolator.class);

    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public CallOutcome<Void> run(String collaborator, String operation, String marketId, Runnable call) {
        return call(collaborator, operation, marketId, () -> {
            call.run();
            return null;
        });
    }

    public <T> CallOutcome<T> call(String collaborator, String operation, String marketId, Supplier<T> call) {
        try {
            return CallOutcome.succeeded(call.get());
        } catch (RuntimeException e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("{}.{} failed for market {}: {}", collaborator, operation, marketId, reason);
            eventPublisher.publishEvent(new ExternalCallFailedEvent(
                    collaborator, operation, marketId, reason, OffsetDateTime.now(clock)));
            return CallOutcome.failed(reason);
        }
    }

    public record CallOutcome<T>(boolean success, T value, String failureReason) {

        static <T> CallOutcome<T> succeeded(T value) {
            return new CallOutcome<>(true, value, null);
        }

        static <T> CallOutcome<T> failed(String reason) {
            return new CallOutcome<>(false, null, reason);
        }

        public Optional<T> valueIfPresent() {
            return success ? Optional.ofNullable(value) : Optional.empty();
        }
    }
}
