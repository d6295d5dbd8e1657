package com.meritmarket.service;

import lombok.Getter;

/**
 * Malformed input, wrong phase, closed window or unmet threshold. Thrown before any state change,
 * so the enclosing operation is rejected as a whole.
 */
@Getter
public class ResolutionValidationException extends RuntimeException {

    private final ResolutionError error;

    public ResolutionValidationException(ResolutionError error, String message) {
        super(message);
        this.error = error;
    }

    public static ResolutionValidationException invalidArgument(String detail) {
        return new ResolutionValidationException(ResolutionError.INVALID_ARGUMENT, detail);
    }

    public static ResolutionValidationException resolutionNotFound(String marketId) {
        return new ResolutionValidationException(
                ResolutionError.RESOLUTION_NOT_FOUND,
                "No resolution for market " + marketId
        );
    }

    public static ResolutionValidationException windowClosed(String window, Object deadline) {
        return new ResolutionValidationException(
                ResolutionError.WINDOW_CLOSED,
                window + " window closed at " + deadline
        );
    }

    public static ResolutionValidationException windowNotOpen(String window, Object opensAt) {
        return new ResolutionValidationException(
                ResolutionError.WINDOW_NOT_OPEN,
                window + " window opens at " + opensAt
        );
    }

    public static ResolutionValidationException invalidStatus(String detail) {
        return new ResolutionValidationException(ResolutionError.INVALID_STATUS, detail);
    }
}
