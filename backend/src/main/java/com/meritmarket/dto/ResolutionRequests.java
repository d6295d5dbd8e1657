package com.meritmarket.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public final class ResolutionRequests {

    private static final String HASH_REGEX = "^(0x)?[a-fA-F0-9]{64}$";
    private static final String HASH_MESSAGE = "must be 32 bytes of hex";

    private ResolutionRequests() {
    }

    public record CommitRequest(
            @NotBlank(message = "committer is required")
            String committer,

            @NotBlank(message = "commitHash is required")
            @Pattern(regexp = HASH_REGEX, message = "commitHash " + HASH_MESSAGE)
            String commitHash,

            @Positive(message = "bond must be positive")
            long bond
    ) {
    }

    public record ProposeRequest(
            @NotBlank(message = "proposer is required")
            String proposer,

            @NotNull(message = "outcome is required")
            @PositiveOrZero(message = "outcome must be non-negative")
            Integer outcome,

            @NotBlank(message = "evidenceUri is required")
            @Size(max = 512, message = "evidenceUri must be at most 512 characters")
            String evidenceUri,

            @NotBlank(message = "evidenceHash is required")
            @Pattern(regexp = HASH_REGEX, message = "evidenceHash " + HASH_MESSAGE)
            String evidenceHash,

            @NotBlank(message = "salt is required")
            @Pattern(regexp = HASH_REGEX, message = "salt " + HASH_MESSAGE)
            String salt,

            @Positive(message = "stake must be positive")
            long stake
    ) {
    }

    public record SlashCommitRequest(
            @NotBlank(message = "caller is required")
            String caller,

            @NotBlank(message = "committer is required")
            String committer
    ) {
    }

    public record StakeRequest(
            @NotBlank(message = "participant is required")
            String participant,

            @Positive(message = "amount must be positive")
            long amount
    ) {
    }

    public record ChallengeEvidenceRequest(
            @NotBlank(message = "challenger is required")
            String challenger,

            @NotBlank(message = "reason is required")
            @Size(max = 1000, message = "reason must be at most 1000 characters")
            String reason,

            @Positive(message = "stake must be positive")
            long stake
    ) {
    }

    public record ResolveChallengeRequest(
            @NotBlank(message = "resolver is required")
            String resolver,

            @NotNull(message = "upheld is required")
            Boolean upheld
    ) {
    }

    public record VoteCommitRequest(
            @NotBlank(message = "legislator is required")
            String legislator,

            @NotBlank(message = "commitHash is required")
            @Pattern(regexp = HASH_REGEX, message = "commitHash " + HASH_MESSAGE)
            String commitHash
    ) {
    }

    public record VoteRevealRequest(
            @NotBlank(message = "legislator is required")
            String legislator,

            @NotNull(message = "support is required")
            Boolean support,

            @NotBlank(message = "salt is required")
            @Pattern(regexp = HASH_REGEX, message = "salt " + HASH_MESSAGE)
            String salt
    ) {
    }

    /**
     * {@code cycle} defaults to the market's latest resolution cycle.
     */
    public record SlashLegislatorRequest(
            @NotBlank(message = "caller is required")
            String caller,

            @NotBlank(message = "legislator is required")
            String legislator,

            @Min(value = 1, message = "cycle must be at least 1")
            Integer cycle
    ) {
    }

    public record DisputeRequest(
            @NotBlank(message = "challenger is required")
            String challenger,

            @NotNull(message = "alternativeOutcome is required")
            @PositiveOrZero(message = "alternativeOutcome must be non-negative")
            Integer alternativeOutcome,

            @NotBlank(message = "evidenceUri is required")
            @Size(max = 512, message = "evidenceUri must be at most 512 characters")
            String evidenceUri,

            @NotBlank(message = "evidenceHash is required")
            @Pattern(regexp = HASH_REGEX, message = "evidenceHash " + HASH_MESSAGE)
            String evidenceHash,

            @Positive(message = "bond must be positive")
            long bond
    ) {
    }

    public record EndorseRequest(
            @NotBlank(message = "legislator is required")
            String legislator
    ) {
    }

    /**
     * {@code cycle} defaults to the market's latest resolution cycle.
     */
    public record ClaimRequest(
            @NotBlank(message = "participant is required")
            String participant,

            @Min(value = 1, message = "cycle must be at least 1")
            Integer cycle
    ) {
    }

    public record WithdrawFeesRequest(
            @NotBlank(message = "caller is required")
            String caller,

            @NotBlank(message = "recipient is required")
            String recipient,

            @Positive(message = "amount must be positive")
            long amount
    ) {
    }
}
