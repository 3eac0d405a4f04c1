package io.mnemoshard.validation;

import io.mnemoshard.config.MnemoShardConfig;
import io.mnemoshard.model.ShareEntry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Picks the threshold a batch is held to.
 *
 * <p>Input order is authoritative: the first usable record decides. Without one,
 * the most frequent hint wins (ties go to the first seen), and without hints the
 * configured default applies. Shards from unrelated splits are not told apart
 * here; a mixed batch is only caught when reconstruction fails.
 */
public final class ThresholdConsensus {
    private final int defaultThreshold;

    public ThresholdConsensus() {
        this(MnemoShardConfig.DEFAULT_THRESHOLD);
    }

    public ThresholdConsensus(int defaultThreshold) {
        if (defaultThreshold < 2) {
            throw new IllegalArgumentException("default threshold must be >= 2: " + defaultThreshold);
        }
        this.defaultThreshold = defaultThreshold;
    }

    public int resolve(List<ShareEntry> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return defaultThreshold;
        }
        for (ShareEntry entry : candidates) {
            if (entry.isUsable()) {
                return entry.record().threshold();
            }
        }
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (ShareEntry entry : candidates) {
            OptionalInt hint = entry.thresholdHint();
            if (hint.isPresent()) {
                counts.merge(hint.getAsInt(), 1, Integer::sum);
            }
        }
        int best = defaultThreshold;
        int bestCount = 0;
        for (Map.Entry<Integer, Integer> count : counts.entrySet()) {
            if (count.getValue() > bestCount) {
                best = count.getKey();
                bestCount = count.getValue();
            }
        }
        return best;
    }

    public int defaultThreshold() {
        return defaultThreshold;
    }
}
