package io.mnemoshard.model;

public enum VerdictStatus {
    WAITING,
    INSUFFICIENT_SHARES,
    DUPLICATE_INDICES,
    INVALID_FORMAT,
    PASSWORD_REQUIRED,
    READY
}
