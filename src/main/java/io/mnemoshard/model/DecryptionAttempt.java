package io.mnemoshard.model;

/**
 * Result of applying one password to one encrypted input. The password itself
 * is never kept.
 */
public record DecryptionAttempt(
        String source,
        int pass,
        Outcome outcome,
        String detail
) {
    public enum Outcome {
        SUCCESS,
        WRONG_PASSWORD,
        MALFORMED,
        NOT_A_SHARD
    }
}
