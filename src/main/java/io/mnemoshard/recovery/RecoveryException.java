package io.mnemoshard.recovery;

import io.mnemoshard.model.RecoveryVerdict;

public final class RecoveryException extends RuntimeException {
    private final RecoveryError error;
    private final RecoveryVerdict verdict;

    public RecoveryException(RecoveryError error, RecoveryVerdict verdict, String message) {
        super(message);
        this.error = error;
        this.verdict = verdict;
    }

    public RecoveryException(RecoveryError error, RecoveryVerdict verdict, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
        this.verdict = verdict;
    }

    public RecoveryError error() {
        return error;
    }

    public RecoveryVerdict verdict() {
        return verdict;
    }
}
