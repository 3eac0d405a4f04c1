package io.mnemoshard.recovery;

public enum RecoveryError {
    INVALID_FORMAT,
    INSUFFICIENT_SHARES,
    DUPLICATE_INDICES,
    PASSWORD_REQUIRED,
    WRONG_PASSWORD,
    CANCELLED,
    RECONSTRUCTION_FAILED
}
