package io.mnemoshard.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One slot of a recovery batch. Immutable; the owning session swaps entries as
 * decryption resolves them.
 */
public record ShareEntry(
        ClassifiedInput input,
        EntryStatus status,
        ShardRecord record,
        String error
) {
    public ShareEntry {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(status, "status");
        if (status.isUsable() && record == null) {
            throw new IllegalArgumentException("usable entry requires a record: " + input.source());
        }
    }

    public static ShareEntry of(ClassifiedInput input) {
        return switch (input.format()) {
            case PLAINTEXT -> new ShareEntry(input, EntryStatus.PLAINTEXT, input.record().orElseThrow(), null);
            case ARMORED, BINARY -> new ShareEntry(input, EntryStatus.ENCRYPTED, null, null);
            case UNRECOGNIZED -> new ShareEntry(input, EntryStatus.INVALID, null, "format not recognized");
        };
    }

    public ShareEntry decrypted(ShardRecord decoded) {
        return new ShareEntry(input, EntryStatus.DECRYPTED, Objects.requireNonNull(decoded, "decoded"), null);
    }

    public ShareEntry invalid(String reason) {
        return new ShareEntry(input, EntryStatus.INVALID, null, reason);
    }

    public String source() {
        return input.source();
    }

    public boolean isUsable() {
        return status.isUsable();
    }

    public boolean isPendingEncrypted() {
        return status == EntryStatus.ENCRYPTED;
    }

    public Optional<ShardRecord> usableRecord() {
        return isUsable() ? Optional.of(record) : Optional.empty();
    }

    public OptionalInt thresholdHint() {
        return input.thresholdHint();
    }
}
