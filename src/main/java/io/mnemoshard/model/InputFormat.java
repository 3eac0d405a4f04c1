package io.mnemoshard.model;

/**
 * Verdict of {@code FormatDetector}: the tag of the classified-input union.
 */
public enum InputFormat {
    PLAINTEXT,
    ARMORED,
    BINARY,
    UNRECOGNIZED;

    public boolean isEncrypted() {
        return this == ARMORED || this == BINARY;
    }
}
