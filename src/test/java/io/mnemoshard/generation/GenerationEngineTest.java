package io.mnemoshard.generation;

import io.mnemoshard.ShardFixtures;
import io.mnemoshard.codec.ShareCodec;
import io.mnemoshard.config.ShardSettings;
import io.mnemoshard.model.RawInput;
import io.mnemoshard.model.ShardRecord;
import io.mnemoshard.recovery.RecoveryEngine;
import io.mnemoshard.security.OpenPgpPasswordCipher;
import io.mnemoshard.security.PasswordCipher;
import io.mnemoshard.sharing.SecretSharing;
import io.mnemoshard.sharing.ShamirSecretSharing;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class GenerationEngineTest {
    private static final OpenPgpPasswordCipher CIPHER = new OpenPgpPasswordCipher();

    private static GenerationEngine engine() {
        return new GenerationEngine(new ShamirSecretSharing(), CIPHER, ShardSettings.defaults(), null);
    }

    @Test
    void plaintextShardsCarryTheSplitParameters() {
        GenerationResult result = engine().generate(GenerationRequest.plain("  " + ShardFixtures.SECRET + "\n", 5, 3));

        Assertions.assertEquals(5, result.shards().size());
        for (int i = 0; i < 5; i++) {
            GeneratedShard shard = result.shards().get(i);
            ShardRecord decoded = ShareCodec.decode(shard.token());
            Assertions.assertEquals(i + 1, decoded.ordinalIndex());
            Assertions.assertEquals(3, decoded.threshold());
            Assertions.assertEquals(5, decoded.totalCount());
            Assertions.assertFalse(shard.isEncrypted());
            Assertions.assertTrue(shard.encryptedArtifact().isEmpty());
        }

        RecoveryEngine recovery = new RecoveryEngine(new ShamirSecretSharing(), CIPHER, ShardSettings.defaults(), null);
        List<String> tokens = result.tokens();
        String recovered = recovery.recover(List.of(
                RawInput.pasted("line 1", tokens.get(4)),
                RawInput.pasted("line 2", tokens.get(0)),
                RawInput.pasted("line 3", tokens.get(2))
        ), null).secret();
        Assertions.assertEquals(ShardFixtures.SECRET, recovered);
    }

    @Test
    void passwordAddsEncryptedArtifactAndKeepsPlaintext() {
        GenerationResult armored = engine().generate(new GenerationRequest("alpha beta gamma", 3, 2, "pw", true));
        GeneratedShard first = armored.shards().get(0);
        Assertions.assertTrue(first.isEncrypted());
        Assertions.assertTrue(first.armoredText().orElseThrow().startsWith("-----BEGIN PGP MESSAGE-----"));
        Assertions.assertArrayEquals(first.token().getBytes(StandardCharsets.UTF_8),
                CIPHER.decrypt(first.encryptedArtifact().orElseThrow(), "pw"));

        GenerationResult binary = engine().generate(new GenerationRequest("alpha beta gamma", 3, 2, "pw", false));
        GeneratedShard packet = binary.shards().get(1);
        Assertions.assertTrue(packet.armoredText().isEmpty());
        Assertions.assertEquals(0x80, packet.encryptedArtifact().orElseThrow()[0] & 0x80);
        Assertions.assertNotNull(ShareCodec.decode(packet.token()));
    }

    @Test
    void blankPasswordMeansNoEncryption() {
        GenerationResult result = engine().generate(new GenerationRequest("alpha beta", 2, 2, "  ", true));
        Assertions.assertFalse(result.shards().get(0).isEncrypted());
    }

    @Test
    void invalidParametersAreRejected() {
        GenerationEngine engine = engine();
        for (int[] nt : new int[][]{{5, 1}, {3, 4}, {8, 3}, {1, 1}}) {
            Assertions.assertThrows(GenerationException.class,
                    () -> engine.generate(GenerationRequest.plain("alpha beta", nt[0], nt[1])),
                    "n=" + nt[0] + " t=" + nt[1]);
        }
        Assertions.assertThrows(GenerationException.class, () -> engine.generate(GenerationRequest.plain("   ", 3, 2)));
        GenerationException duplicate = Assertions.assertThrows(GenerationException.class,
                () -> engine.generate(GenerationRequest.plain("alpha Beta beta", 3, 2)));
        Assertions.assertTrue(duplicate.getMessage().contains("beta"));
    }

    @Test
    void vocabularyPredicateIsApplied() {
        Set<String> words = Set.of("alpha", "beta", "gamma");
        GenerationEngine engine = new GenerationEngine(
                new ShamirSecretSharing(), CIPHER, ShardSettings.defaults(), null, words::contains);
        Assertions.assertEquals(3, engine.generate(GenerationRequest.plain("Alpha beta", 3, 2)).shards().size());
        GenerationException failure = Assertions.assertThrows(GenerationException.class,
                () -> engine.generate(GenerationRequest.plain("alpha delta", 3, 2)));
        Assertions.assertEquals("Word 2 is not in the word list", failure.getMessage());
    }

    @Test
    void primitiveFailuresAreWrapped() {
        SecretSharing broken = new SecretSharing() {
            @Override
            public Map<Integer, byte[]> split(byte[] secret, int totalCount, int threshold) {
                throw new IllegalStateException("rng unavailable");
            }

            @Override
            public byte[] combine(Map<Integer, byte[]> shares) {
                throw new UnsupportedOperationException();
            }
        };
        GenerationEngine engine = new GenerationEngine(broken, CIPHER, ShardSettings.defaults(), null);
        GenerationException failure = Assertions.assertThrows(GenerationException.class,
                () -> engine.generate(GenerationRequest.plain("alpha beta", 3, 2)));
        Assertions.assertInstanceOf(IllegalStateException.class, failure.getCause());

        PasswordCipher failingCipher = new PasswordCipher() {
            @Override
            public byte[] encrypt(byte[] plaintext, String password, boolean armored) {
                throw new IllegalStateException("no provider");
            }

            @Override
            public byte[] decrypt(byte[] ciphertext, String password) {
                throw new UnsupportedOperationException();
            }
        };
        GenerationEngine encrypting = new GenerationEngine(
                new ShamirSecretSharing(), failingCipher, ShardSettings.defaults(), null);
        Assertions.assertThrows(GenerationException.class,
                () -> encrypting.generate(new GenerationRequest("alpha beta", 3, 2, "pw", true)));
    }
}
