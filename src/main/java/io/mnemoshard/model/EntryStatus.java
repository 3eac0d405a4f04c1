package io.mnemoshard.model;

public enum EntryStatus {
    PLAINTEXT,
    ENCRYPTED,
    DECRYPTED,
    INVALID;

    public boolean isUsable() {
        return this == PLAINTEXT || this == DECRYPTED;
    }
}
