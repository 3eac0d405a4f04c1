package io.mnemoshard.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * One decoded shard: its 1-based position in the split, the split parameters
 * and the raw share bytes produced by the sharing primitive.
 */
public record ShardRecord(
        int ordinalIndex,
        int threshold,
        int totalCount,
        byte[] payload
) {
    public static final int MIN_THRESHOLD = 2;
    public static final int MAX_TOTAL_COUNT = 255;

    public ShardRecord {
        Objects.requireNonNull(payload, "payload");
        if (threshold < MIN_THRESHOLD) {
            throw new IllegalArgumentException("threshold must be >= " + MIN_THRESHOLD + ": " + threshold);
        }
        if (totalCount < threshold || totalCount > MAX_TOTAL_COUNT) {
            throw new IllegalArgumentException(
                    "totalCount must be in [" + threshold + "," + MAX_TOTAL_COUNT + "]: " + totalCount);
        }
        if (ordinalIndex < 1 || ordinalIndex > totalCount) {
            throw new IllegalArgumentException("ordinalIndex must be in [1," + totalCount + "]: " + ordinalIndex);
        }
        if (payload.length == 0) {
            throw new IllegalArgumentException("payload cannot be empty");
        }
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ShardRecord)) {
            return false;
        }
        ShardRecord that = (ShardRecord) other;
        return ordinalIndex == that.ordinalIndex
                && threshold == that.threshold
                && totalCount == that.totalCount
                && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(ordinalIndex, threshold, totalCount) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "ShardRecord[ordinalIndex=" + ordinalIndex
                + ", threshold=" + threshold
                + ", totalCount=" + totalCount
                + ", payload=" + payload.length + " bytes]";
    }
}
