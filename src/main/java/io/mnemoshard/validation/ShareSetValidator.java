package io.mnemoshard.validation;

import io.mnemoshard.model.RecoveryVerdict;
import io.mnemoshard.model.ShardRecord;
import io.mnemoshard.model.ShareEntry;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Pure verdict over a batch snapshot. Callers re-run it after every mutation.
 * Duplicate indices invalidate the whole set; nothing is deduplicated.
 */
public final class ShareSetValidator {
    private final ThresholdConsensus consensus;

    public ShareSetValidator(ThresholdConsensus consensus) {
        this.consensus = consensus;
    }

    public ShareSetValidator() {
        this(new ThresholdConsensus());
    }

    public RecoveryVerdict validate(List<ShareEntry> entries) {
        int need = consensus.resolve(entries);
        if (entries == null || entries.isEmpty()) {
            return RecoveryVerdict.waiting(need);
        }
        List<ShardRecord> usable = usableRecords(entries);
        int pending = 0;
        for (ShareEntry entry : entries) {
            if (entry.isPendingEncrypted()) {
                pending++;
            }
        }
        if (usable.isEmpty()) {
            return pending == 0
                    ? RecoveryVerdict.invalidFormat(need)
                    : RecoveryVerdict.passwordRequired(need, pending);
        }
        List<Integer> duplicates = duplicateIndices(usable);
        if (!duplicates.isEmpty()) {
            return RecoveryVerdict.duplicateIndices(usable.size(), need, pending, duplicates);
        }
        if (usable.size() < need) {
            return RecoveryVerdict.insufficient(usable.size(), need, pending);
        }
        return RecoveryVerdict.ready(usable.size(), need, pending);
    }

    public ThresholdConsensus consensus() {
        return consensus;
    }

    static List<ShardRecord> usableRecords(List<ShareEntry> entries) {
        List<ShardRecord> out = new ArrayList<>();
        for (ShareEntry entry : entries) {
            entry.usableRecord().ifPresent(out::add);
        }
        return out;
    }

    static List<Integer> duplicateIndices(List<ShardRecord> records) {
        Set<Integer> seen = new HashSet<>();
        Set<Integer> duplicates = new TreeSet<>();
        for (ShardRecord record : records) {
            if (!seen.add(record.ordinalIndex())) {
                duplicates.add(record.ordinalIndex());
            }
        }
        return List.copyOf(duplicates);
    }
}
