package io.mnemoshard.recovery;

import io.mnemoshard.model.RecoveryVerdict;

public record DecryptionOutcome(
        Status status,
        int passes,
        int decrypted,
        boolean wrongPasswordSeen,
        RecoveryVerdict verdict
) {
    public enum Status {
        NOTHING_PENDING,
        COMPLETED,
        CANCELLED,
        RETRIES_EXHAUSTED
    }
}
