package com.meritmarket.service;

import java.time.OffsetDateTime;

/**
 * A best-effort call into a collaborator failed; the enclosing operation went ahead without it.
 */
public record ExternalCallFailedEvent(
        String collaborator,
        String operation,
        String marketId,
        String reason,
        OffsetDateTime occurredAt
) {
}
