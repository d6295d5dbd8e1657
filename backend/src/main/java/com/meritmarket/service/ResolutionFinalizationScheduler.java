package com.meritmarket.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically finalizes resolution cycles whose dispute window and buffer have passed.
 * Claims finalize lazily as well, so this only keeps the external market mirror current.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "resolution.finalizer", name = "enabled", havingValue = "true")
public class ResolutionFinalizationScheduler {

    private static final Logger log = LoggerFactory.getLogger(ResolutionFinalizationScheduler.class);

    private final ResolutionProtocol resolutionProtocol;

    @Scheduled(
            initialDelayString = "${resolution.finalizer.initial-delay-ms:30000}",
            fixedDelayString = "${resolution.finalizer.poll-interval-ms:60000}"
    )
    public void finalizeDueResolutions() {
        int finalized = resolutionProtocol.finalizeDue();
        if (finalized > 0) {
            log.info("Finalization sweep settled {} resolution cycle(s)", finalized);
        }
    }
}
