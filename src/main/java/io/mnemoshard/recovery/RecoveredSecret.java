package io.mnemoshard.recovery;

import java.util.List;

public record RecoveredSecret(
        String secret,
        int threshold,
        int usableCount,
        List<Integer> usedIndices
) {
    public RecoveredSecret {
        usedIndices = List.copyOf(usedIndices);
    }

    @Override
    public String toString() {
        return "RecoveredSecret[threshold=" + threshold
                + ", usableCount=" + usableCount
                + ", usedIndices=" + usedIndices + "]";
    }
}
