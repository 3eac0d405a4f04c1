package io.mnemoshard.recovery;

import io.mnemoshard.ShardFixtures;
import io.mnemoshard.config.ShardSettings;
import io.mnemoshard.model.RawInput;
import io.mnemoshard.model.VerdictStatus;
import io.mnemoshard.observability.AuditLogger;
import io.mnemoshard.security.OpenPgpPasswordCipher;
import io.mnemoshard.sharing.ShamirSecretSharing;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

final class RecoveryEngineTest {
    private static final OpenPgpPasswordCipher CIPHER = new OpenPgpPasswordCipher();

    private static RecoveryEngine engine() {
        return new RecoveryEngine(new ShamirSecretSharing(), CIPHER, ShardSettings.defaults(), null);
    }

    private static List<RawInput> pasted(List<String> tokens, int... indices) {
        List<RawInput> out = new ArrayList<>();
        for (int index : indices) {
            out.add(RawInput.pasted("line " + index, tokens.get(index - 1)));
        }
        return out;
    }

    private static PasswordPrompt script(String... answers) {
        Deque<String> queue = new ArrayDeque<>(List.of(answers));
        return request -> Optional.ofNullable(queue.pollFirst());
    }

    @Test
    void anyThresholdSubsetRecoversTheSecret() {
        List<String> tokens = ShardFixtures.tokens(ShardFixtures.SECRET, 5, 3);
        RecoveredSecret recovered = engine().recover(pasted(tokens, 1, 3, 5), null);
        Assertions.assertEquals(ShardFixtures.SECRET, recovered.secret());
        Assertions.assertEquals(List.of(1, 3, 5), recovered.usedIndices());
        Assertions.assertEquals(3, recovered.threshold());
        Assertions.assertFalse(recovered.toString().contains("abandon"));
    }

    @Test
    void everySubsetOfSmallSplitsBehaves() {
        for (int total = 2; total <= 5; total++) {
            for (int threshold = 2; threshold <= total; threshold++) {
                String secret = "word" + total + " other" + threshold + " zoo";
                List<String> tokens = ShardFixtures.tokens(secret, total, threshold);
                for (int mask = 1; mask < (1 << total); mask++) {
                    List<Integer> chosen = new ArrayList<>();
                    for (int bit = 0; bit < total; bit++) {
                        if ((mask & (1 << bit)) != 0) {
                            chosen.add(bit + 1);
                        }
                    }
                    int[] indices = chosen.stream().mapToInt(Integer::intValue).toArray();
                    if (chosen.size() >= threshold) {
                        Assertions.assertEquals(secret, engine().recover(pasted(tokens, indices), null).secret(),
                                "n=" + total + " t=" + threshold + " subset=" + chosen);
                    } else {
                        RecoveryException failure = Assertions.assertThrows(RecoveryException.class,
                                () -> engine().recover(pasted(tokens, indices), null));
                        Assertions.assertEquals(RecoveryError.INSUFFICIENT_SHARES, failure.error());
                    }
                }
            }
        }
    }

    @Test
    void twoOfThreeNeededIsInsufficient() {
        List<String> tokens = ShardFixtures.tokens(ShardFixtures.SECRET, 5, 3);
        RecoveryException failure = Assertions.assertThrows(RecoveryException.class,
                () -> engine().recover(pasted(tokens, 1, 2), null));
        Assertions.assertEquals(RecoveryError.INSUFFICIENT_SHARES, failure.error());
        Assertions.assertEquals(2, failure.verdict().have());
        Assertions.assertEquals(3, failure.verdict().need());
    }

    @Test
    void repeatedShardIsDuplicateNotDeduplicated() {
        List<String> tokens = ShardFixtures.tokens(ShardFixtures.SECRET, 5, 3);
        RecoveryException failure = Assertions.assertThrows(RecoveryException.class,
                () -> engine().recover(pasted(tokens, 1, 1, 2), null));
        Assertions.assertEquals(RecoveryError.DUPLICATE_INDICES, failure.error());
        Assertions.assertEquals(List.of(1), failure.verdict().duplicateIndices());
    }

    @Test
    void mixedBinaryArmoredAndPlaintextRecoverWithOnePassword() {
        List<String> tokens = ShardFixtures.tokens(ShardFixtures.SECRET, 5, 3);
        RecoveryEngine engine = engine();
        RecoverySession session = engine.newSession();
        Assertions.assertTrue(session.addFile("share-1.txt.gpg",
                CIPHER.encrypt(tokens.get(0).getBytes(StandardCharsets.UTF_8), "pw", false)).isEmpty());
        Assertions.assertTrue(session.addFile("share-2.txt.gpg",
                CIPHER.encrypt(tokens.get(1).getBytes(StandardCharsets.UTF_8), "pw", true)).isEmpty());
        session.addPastedText(tokens.get(3));
        Assertions.assertEquals(VerdictStatus.INSUFFICIENT_SHARES, session.verdict().status());

        RecoveredSecret recovered = engine.recover(session, script("pw"));

        Assertions.assertEquals(ShardFixtures.SECRET, recovered.secret());
        Assertions.assertEquals(List.of(1, 2, 4), recovered.usedIndices());
    }

    @Test
    void binaryAndArmoredFilesFromOneSplitRecover() {
        List<String> tokens = ShardFixtures.tokens(ShardFixtures.SECRET, 4, 2);
        List<RawInput> inputs = List.of(
                RawInput.file("share-3.txt.gpg", CIPHER.encrypt(tokens.get(2).getBytes(StandardCharsets.UTF_8), "pw", false)),
                RawInput.file("share-4.txt.gpg", CIPHER.encrypt(tokens.get(3).getBytes(StandardCharsets.UTF_8), "pw", true))
        );
        RecoveredSecret recovered = engine().recover(inputs, script("pw"));
        Assertions.assertEquals(ShardFixtures.SECRET, recovered.secret());
        Assertions.assertEquals(List.of(3, 4), recovered.usedIndices());
    }

    @Test
    void wrongPasswordThenRightPasswordRecovers() {
        List<String> tokens = ShardFixtures.tokens(ShardFixtures.SECRET, 3, 2);
        List<RawInput> inputs = List.of(
                RawInput.file("a.gpg", CIPHER.encrypt(tokens.get(0).getBytes(StandardCharsets.UTF_8), "pw", true)),
                RawInput.file("b.gpg", CIPHER.encrypt(tokens.get(2).getBytes(StandardCharsets.UTF_8), "pw", true))
        );
        RecoveredSecret recovered = engine().recover(inputs, script("nope", "pw"));
        Assertions.assertEquals(ShardFixtures.SECRET, recovered.secret());
    }

    @Test
    void encryptedBatchFailureModes() {
        List<String> tokens = ShardFixtures.tokens(ShardFixtures.SECRET, 3, 2);
        List<RawInput> inputs = List.of(
                RawInput.file("a.gpg", CIPHER.encrypt(tokens.get(0).getBytes(StandardCharsets.UTF_8), "pw", true)),
                RawInput.file("b.gpg", CIPHER.encrypt(tokens.get(1).getBytes(StandardCharsets.UTF_8), "pw", false))
        );

        RecoveryException noPrompt = Assertions.assertThrows(RecoveryException.class,
                () -> engine().recover(inputs, null));
        Assertions.assertEquals(RecoveryError.PASSWORD_REQUIRED, noPrompt.error());
        Assertions.assertEquals(2, noPrompt.verdict().pending());

        RecoveryException cancelled = Assertions.assertThrows(RecoveryException.class,
                () -> engine().recover(inputs, script()));
        Assertions.assertEquals(RecoveryError.CANCELLED, cancelled.error());

        RecoveryException exhausted = Assertions.assertThrows(RecoveryException.class,
                () -> engine().recover(inputs, script("a", "b", "c")));
        Assertions.assertEquals(RecoveryError.WRONG_PASSWORD, exhausted.error());
    }

    @Test
    void garbageOnlyIsInvalidFormat() {
        RecoveryException failure = Assertions.assertThrows(RecoveryException.class,
                () -> engine().recover(List.of(RawInput.pasted("line 1", "hello")), null));
        Assertions.assertEquals(RecoveryError.INVALID_FORMAT, failure.error());
    }

    @Test
    void shardsFromDifferentSplitsFailReconstruction() {
        List<String> first = ShardFixtures.tokens("alpha beta gamma", 3, 2);
        List<String> second = ShardFixtures.tokens("a much longer phrase of words", 3, 2);
        RecoveryException failure = Assertions.assertThrows(RecoveryException.class,
                () -> engine().recover(List.of(
                        RawInput.pasted("line 1", first.get(0)),
                        RawInput.pasted("line 2", second.get(1))
                ), null));
        Assertions.assertEquals(RecoveryError.RECONSTRUCTION_FAILED, failure.error());
        Assertions.assertNotNull(failure.getCause());
    }

    @Test
    void recoveryIsAudited() throws Exception {
        Path root = Files.createTempDirectory("mnemoshard-recovery-audit-test-");
        try {
            AuditLogger audit = new AuditLogger(root.resolve("audit.log"), "");
            RecoveryEngine engine = new RecoveryEngine(new ShamirSecretSharing(), CIPHER, ShardSettings.defaults(), audit);
            List<String> tokens = ShardFixtures.tokens(ShardFixtures.SECRET, 3, 2);
            engine.recover(pasted(tokens, 2, 3), null);

            String log = Files.readString(root.resolve("audit.log"), StandardCharsets.UTF_8);
            Assertions.assertTrue(log.contains("\"action\":\"shards.recover\""));
            Assertions.assertFalse(log.contains("abandon"));
            Assertions.assertFalse(log.contains(tokens.get(1)));
            Assertions.assertEquals(1, audit.verifyChain());
        } finally {
            ShardFixtures.deleteRecursively(root);
        }
    }
}
