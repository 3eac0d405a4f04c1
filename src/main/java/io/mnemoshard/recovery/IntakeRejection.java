package io.mnemoshard.recovery;

/**
 * A file turned away before classification. The rest of the batch is unaffected.
 */
public record IntakeRejection(String source, Reason reason, String message) {
    public enum Reason {
        UNSUPPORTED_EXTENSION,
        FILE_TOO_LARGE,
        DUPLICATE_FILE,
        UNREADABLE
    }
}
