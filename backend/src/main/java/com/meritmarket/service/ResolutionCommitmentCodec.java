package com.meritmarket.service;

import org.bouncycastle.jcajce.provider.digest.Keccak;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Canonical Keccak-256 commitments for resolution proposals and legislator votes.
 * <p>
 * Proposal preimage: {@code outcome (uint32 BE) ‖ utf8(evidenceUri) ‖ evidenceHash (32) ‖ salt (32) ‖ utf8(committer)}.
 * Vote preimage: {@code support (1 byte) ‖ salt (32) ‖ utf8(legislator)}.
 */
public final class ResolutionCommitmentCodec {

    private static final Pattern HEX_64 = Pattern.compile("^[0-9a-f]{64}$");
    private static final String ZERO_DIGEST = "0x" + "0".repeat(64);

    public static final int BYTES32 = 32;

    private ResolutionCommitmentCodec() {
    }

    public static String computeResolutionCommitment(
            int outcome,
            String evidenceUri,
            String evidenceHash,
            String salt,
            String committer) {

        if (outcome < 0) {
            throw new IllegalArgumentException("outcome must be non-negative");
        }
        if (evidenceUri == null) {
            throw new IllegalArgumentException("evidenceUri is required");
        }
        requireIdentity(committer);

        byte[] outcomeBytes = ByteBuffer.allocate(4)
                .order(ByteOrder.BIG_ENDIAN)
                .putInt(outcome)
                .array();
        byte[] uriBytes = evidenceUri.getBytes(StandardCharsets.UTF_8);
        byte[] evidenceBytes = decodeBytes32(evidenceHash, "evidenceHash");
        byte[] saltBytes = decodeBytes32(salt, "salt");
        byte[] committerBytes = committer.getBytes(StandardCharsets.UTF_8);

        return keccak(outcomeBytes, uriBytes, evidenceBytes, saltBytes, committerBytes);
    }

    public static String computeVoteCommitment(boolean support, String salt, String legislator) {
        requireIdentity(legislator);
        byte[] supportByte = new byte[]{support ? (byte) 1 : (byte) 0};
        byte[] saltBytes = decodeBytes32(salt, "salt");
        byte[] legislatorBytes = legislator.getBytes(StandardCharsets.UTF_8);
        return keccak(supportByte, saltBytes, legislatorBytes);
    }

    public static String normalizeHash(String hash) {
        if (hash == null) {
            throw new IllegalArgumentException("Hash is required");
        }

        String trimmed = hash.trim().toLowerCase();
        String withoutPrefix = trimmed.startsWith("0x") ? trimmed.substring(2) : trimmed;
        if (!HEX_64.matcher(withoutPrefix).matches()) {
            throw new IllegalArgumentException("Hash must be 64 hex characters");
        }
        return "0x" + withoutPrefix;
    }

    public static boolean isZeroHash(String normalizedHash) {
        return ZERO_DIGEST.equals(normalizedHash);
    }

    private static byte[] decodeBytes32(String hex, String field) {
        String normalized;
        try {
            normalized = normalizeHash(hex);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(field + " must be 32 bytes of hex", e);
        }
        byte[] out = new byte[BYTES32];
        for (int i = 0; i < BYTES32; i++) {
            int offset = 2 + i * 2;
            out[i] = (byte) Integer.parseInt(normalized.substring(offset, offset + 2), 16);
        }
        return out;
    }

    private static void requireIdentity(String identity) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Identity is required");
        }
    }

    private static String keccak(byte[]... parts) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        for (byte[] part : parts) {
            digest.update(part);
        }
        return "0x" + toHex(digest.digest());
    }

    private static String toHex(byte[] bytes) {
        StringBuilder out = new StringBuilder(bytes.length * 2);
        for (byte value : bytes) {
            out.append(Character.forDigit((value >>> 4) & 0x0f, 16));
            out.append(Character.forDigit(value & 0x0f, 16));
        }
        return out.toString();
    }
}
