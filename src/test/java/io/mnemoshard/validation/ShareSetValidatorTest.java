package io.mnemoshard.validation;

import io.mnemoshard.model.ClassifiedInput;
import io.mnemoshard.model.RawInput;
import io.mnemoshard.model.RecoveryVerdict;
import io.mnemoshard.model.ShardRecord;
import io.mnemoshard.model.ShareEntry;
import io.mnemoshard.model.VerdictStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

final class ShareSetValidatorTest {
    private final ShareSetValidator validator = new ShareSetValidator();

    static ShareEntry plain(int index, int threshold, int total) {
        ShardRecord record = new ShardRecord(index, threshold, total, new byte[]{(byte) index, 7});
        return ShareEntry.of(ClassifiedInput.plaintext(RawInput.pasted("line " + index, "t" + index), record));
    }

    static ShareEntry encrypted(String source) {
        return ShareEntry.of(ClassifiedInput.armored(RawInput.pasted(source, "armored"), new byte[]{1}));
    }

    static ShareEntry garbage(String source, OptionalInt hint) {
        return ShareEntry.of(ClassifiedInput.unrecognized(RawInput.pasted(source, "junk"), hint));
    }

    @Test
    void emptyBatchIsWaiting() {
        RecoveryVerdict verdict = validator.validate(List.of());
        Assertions.assertEquals(VerdictStatus.WAITING, verdict.status());
        Assertions.assertEquals(3, verdict.need());
    }

    @Test
    void onlyGarbageIsInvalidFormat() {
        RecoveryVerdict verdict = validator.validate(List.of(garbage("a", OptionalInt.empty())));
        Assertions.assertEquals(VerdictStatus.INVALID_FORMAT, verdict.status());
        Assertions.assertEquals("Format not recognized: no valid shard found", verdict.message());
    }

    @Test
    void onlyEncryptedIsPasswordRequired() {
        RecoveryVerdict verdict = validator.validate(List.of(encrypted("a"), encrypted("b"), garbage("c", OptionalInt.empty())));
        Assertions.assertEquals(VerdictStatus.PASSWORD_REQUIRED, verdict.status());
        Assertions.assertEquals(2, verdict.pending());
    }

    @Test
    void duplicatesOutrankInsufficientAndAreNotDeduplicated() {
        RecoveryVerdict verdict = validator.validate(List.of(plain(1, 3, 5), plain(1, 3, 5), plain(2, 3, 5)));
        Assertions.assertEquals(VerdictStatus.DUPLICATE_INDICES, verdict.status());
        Assertions.assertEquals(List.of(1), verdict.duplicateIndices());
        Assertions.assertEquals(3, verdict.have());
        Assertions.assertFalse(verdict.isReady());

        RecoveryVerdict fewer = validator.validate(List.of(plain(2, 3, 5), plain(2, 3, 5)));
        Assertions.assertEquals(VerdictStatus.DUPLICATE_INDICES, fewer.status());
    }

    @Test
    void belowThresholdIsInsufficient() {
        RecoveryVerdict verdict = validator.validate(List.of(plain(1, 3, 5), plain(2, 3, 5), encrypted("x")));
        Assertions.assertEquals(VerdictStatus.INSUFFICIENT_SHARES, verdict.status());
        Assertions.assertEquals(2, verdict.have());
        Assertions.assertEquals(3, verdict.need());
        Assertions.assertEquals(1, verdict.pending());
        Assertions.assertEquals("Need more shards: have 2, need 3", verdict.message());
    }

    @Test
    void enoughDistinctShardsAreReadyEvenWithGarbageAround() {
        RecoveryVerdict verdict = validator.validate(List.of(
                plain(1, 3, 5), garbage("junk", OptionalInt.empty()), plain(3, 3, 5), plain(5, 3, 5)));
        Assertions.assertEquals(VerdictStatus.READY, verdict.status());
        Assertions.assertEquals(3, verdict.have());
        Assertions.assertTrue(verdict.isReady());
    }

    @Test
    void readyNeverComesFromUnresolvedInput() {
        RecoveryVerdict verdict = validator.validate(List.of(
                encrypted("a"), encrypted("b"), encrypted("c"), plain(1, 2, 3)));
        Assertions.assertEquals(VerdictStatus.INSUFFICIENT_SHARES, verdict.status());
        Assertions.assertEquals(3, verdict.pending());
    }
}
