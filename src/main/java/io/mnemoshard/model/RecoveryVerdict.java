package io.mnemoshard.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of validating a batch. {@code have} is the usable record count,
 * {@code need} the consensus threshold, {@code pending} the encrypted entries
 * still waiting for a password.
 */
public record RecoveryVerdict(
        VerdictStatus status,
        int have,
        int need,
        int pending,
        List<Integer> duplicateIndices
) {
    public RecoveryVerdict {
        Objects.requireNonNull(status, "status");
        duplicateIndices = duplicateIndices == null ? List.of() : List.copyOf(duplicateIndices);
    }

    public static RecoveryVerdict waiting(int need) {
        return new RecoveryVerdict(VerdictStatus.WAITING, 0, need, 0, List.of());
    }

    public static RecoveryVerdict invalidFormat(int need) {
        return new RecoveryVerdict(VerdictStatus.INVALID_FORMAT, 0, need, 0, List.of());
    }

    public static RecoveryVerdict passwordRequired(int need, int pending) {
        return new RecoveryVerdict(VerdictStatus.PASSWORD_REQUIRED, 0, need, pending, List.of());
    }

    public static RecoveryVerdict duplicateIndices(int have, int need, int pending, List<Integer> indices) {
        return new RecoveryVerdict(VerdictStatus.DUPLICATE_INDICES, have, need, pending, indices);
    }

    public static RecoveryVerdict insufficient(int have, int need, int pending) {
        return new RecoveryVerdict(VerdictStatus.INSUFFICIENT_SHARES, have, need, pending, List.of());
    }

    public static RecoveryVerdict ready(int have, int need, int pending) {
        return new RecoveryVerdict(VerdictStatus.READY, have, need, pending, List.of());
    }

    public boolean isReady() {
        return status == VerdictStatus.READY;
    }

    public String message() {
        return switch (status) {
            case WAITING -> "Waiting for shard input";
            case INSUFFICIENT_SHARES -> "Need more shards: have " + have + ", need " + need;
            case DUPLICATE_INDICES -> "Shards conflict: duplicate shard index "
                    + duplicateIndices.stream().map(String::valueOf).collect(Collectors.joining(", "));
            case INVALID_FORMAT -> "Format not recognized: no valid shard found";
            case PASSWORD_REQUIRED -> "Password required to decrypt " + pending + " encrypted shard(s)";
            case READY -> "Ready: " + have + " valid shard(s), need " + need;
        };
    }
}
