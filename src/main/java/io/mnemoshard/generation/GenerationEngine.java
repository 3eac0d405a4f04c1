package io.mnemoshard.generation;

import io.mnemoshard.codec.ShareCodec;
import io.mnemoshard.config.ShardSettings;
import io.mnemoshard.model.ShardRecord;
import io.mnemoshard.observability.AuditLogger;
import io.mnemoshard.security.PasswordCipher;
import io.mnemoshard.sharing.SecretSharing;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

public final class GenerationEngine {
    private final SecretSharing sharing;
    private final PasswordCipher cipher;
    private final ShardSettings settings;
    private final AuditLogger auditLogger;
    private final Predicate<String> vocabulary;

    public GenerationEngine(SecretSharing sharing, PasswordCipher cipher, ShardSettings settings, AuditLogger auditLogger) {
        this(sharing, cipher, settings, auditLogger, null);
    }

    public GenerationEngine(
            SecretSharing sharing,
            PasswordCipher cipher,
            ShardSettings settings,
            AuditLogger auditLogger,
            Predicate<String> vocabulary
    ) {
        this.sharing = sharing;
        this.cipher = cipher;
        this.settings = settings;
        this.auditLogger = auditLogger;
        this.vocabulary = vocabulary;
    }

    public GenerationResult generate(GenerationRequest request) {
        int total = request.totalCount();
        int threshold = request.threshold();
        if (threshold < ShardRecord.MIN_THRESHOLD || threshold > total || total > settings.maxTotalShares()) {
            throw new GenerationException("Require 2 <= threshold <= total <= " + settings.maxTotalShares()
                    + ", got threshold=" + threshold + " total=" + total);
        }
        String phrase = SecretPhrase.validate(request.secretText(), vocabulary);

        Map<Integer, byte[]> parts;
        try {
            parts = sharing.split(phrase.getBytes(StandardCharsets.UTF_8), total, threshold);
        } catch (RuntimeException e) {
            throw new GenerationException("Failed to split secret: " + e.getMessage(), e);
        }
        if (parts == null || parts.size() != total) {
            throw new GenerationException("Splitting returned " + (parts == null ? 0 : parts.size())
                    + " shares, expected " + total);
        }

        List<GeneratedShard> shards = new ArrayList<>(total);
        for (int index = 1; index <= total; index++) {
            byte[] payload = parts.get(index);
            if (payload == null) {
                throw new GenerationException("Splitting returned no share for index " + index);
            }
            ShardRecord record = new ShardRecord(index, threshold, total, payload);
            String token = ShareCodec.encode(record);
            byte[] encrypted = null;
            if (request.encrypt()) {
                try {
                    encrypted = cipher.encrypt(token.getBytes(StandardCharsets.UTF_8), request.password(), request.armored());
                } catch (RuntimeException e) {
                    throw new GenerationException("Failed to encrypt shard " + index + ": " + e.getMessage(), e);
                }
            }
            shards.add(new GeneratedShard(record, token, encrypted, request.armored()));
        }
        if (auditLogger != null) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "shards.generate",
                    "generation",
                    "ok",
                    Map.of(
                            "total", total,
                            "threshold", threshold,
                            "words", SecretPhrase.words(phrase).size(),
                            "encrypted", request.encrypt(),
                            "armored", request.armored()
                    )
            ));
        }
        return new GenerationResult(total, threshold, shards);
    }
}
