package io.mnemoshard.recovery;

import io.mnemoshard.config.ShardSettings;
import io.mnemoshard.model.RawInput;
import io.mnemoshard.model.RecoveryVerdict;
import io.mnemoshard.model.ShardRecord;
import io.mnemoshard.model.VerdictStatus;
import io.mnemoshard.observability.AuditLogger;
import io.mnemoshard.security.PasswordCipher;
import io.mnemoshard.sharing.SecretSharing;
import io.mnemoshard.validation.ShareSetValidator;
import io.mnemoshard.validation.ThresholdConsensus;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classify, validate, decrypt when needed, then combine the first
 * {@code threshold} usable shards in input order.
 */
public final class RecoveryEngine {
    private final SecretSharing sharing;
    private final ShareSetValidator validator;
    private final DecryptionCoordinator coordinator;
    private final ShardSettings settings;
    private final AuditLogger auditLogger;

    public RecoveryEngine(SecretSharing sharing, PasswordCipher cipher, ShardSettings settings, AuditLogger auditLogger) {
        this.sharing = sharing;
        this.settings = settings;
        this.auditLogger = auditLogger;
        this.validator = new ShareSetValidator(new ThresholdConsensus(settings.defaultThreshold()));
        this.coordinator = new DecryptionCoordinator(cipher, validator, settings.maxPasswordAttempts(), auditLogger);
    }

    public RecoverySession newSession() {
        return new RecoverySession(validator, settings.maxFileBytes(), auditLogger);
    }

    public RecoveredSecret recover(List<RawInput> inputs, PasswordPrompt prompt) {
        RecoverySession session = newSession();
        for (RawInput input : inputs) {
            session.add(input);
        }
        return recover(session, prompt, DecryptionListener.NONE);
    }

    public RecoveredSecret recover(RecoverySession session, PasswordPrompt prompt) {
        return recover(session, prompt, DecryptionListener.NONE);
    }

    public RecoveredSecret recover(RecoverySession session, PasswordPrompt prompt, DecryptionListener listener) {
        RecoveryVerdict verdict = session.verdict();
        DecryptionOutcome outcome = null;
        if (!verdict.isReady() && !session.pendingEncrypted().isEmpty()) {
            if (prompt == null) {
                throw fail(RecoveryError.PASSWORD_REQUIRED, verdict, verdict.message());
            }
            outcome = coordinator.run(session, prompt, listener);
            verdict = session.verdict();
        }
        if (!verdict.isReady()) {
            throw failFor(verdict, outcome);
        }
        return reconstruct(session, verdict);
    }

    public ShareSetValidator validator() {
        return validator;
    }

    private RecoveredSecret reconstruct(RecoverySession session, RecoveryVerdict verdict) {
        List<ShardRecord> usable = session.usableRecords();
        Map<Integer, byte[]> chosen = new LinkedHashMap<>();
        for (ShardRecord record : usable.subList(0, verdict.need())) {
            chosen.put(record.ordinalIndex(), record.payload());
        }
        byte[] secretBytes;
        try {
            secretBytes = sharing.combine(chosen);
        } catch (RuntimeException e) {
            throw fail(RecoveryError.RECONSTRUCTION_FAILED, verdict, "Reconstruction failed: " + e.getMessage(), e);
        }
        String secret;
        try {
            secret = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(secretBytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw fail(RecoveryError.RECONSTRUCTION_FAILED, verdict,
                    "Reconstruction failed: shards do not belong to the same secret", e);
        }
        List<Integer> usedIndices = new ArrayList<>(chosen.keySet());
        audit("ok", Map.of(
                "usable_count", verdict.have(),
                "threshold", verdict.need(),
                "used_indices", usedIndices
        ));
        return new RecoveredSecret(secret, verdict.need(), verdict.have(), usedIndices);
    }

    private RecoveryException failFor(RecoveryVerdict verdict, DecryptionOutcome outcome) {
        if (verdict.status() == VerdictStatus.DUPLICATE_INDICES) {
            return fail(RecoveryError.DUPLICATE_INDICES, verdict, verdict.message());
        }
        if (outcome != null && outcome.status() == DecryptionOutcome.Status.CANCELLED) {
            return fail(RecoveryError.CANCELLED, verdict, "Password entry cancelled; " + verdict.message());
        }
        if (outcome != null && outcome.status() == DecryptionOutcome.Status.RETRIES_EXHAUSTED) {
            return fail(RecoveryError.WRONG_PASSWORD, verdict,
                    "Wrong password after " + outcome.passes() + " attempt(s); " + verdict.message());
        }
        RecoveryError error = switch (verdict.status()) {
            case INSUFFICIENT_SHARES -> RecoveryError.INSUFFICIENT_SHARES;
            case PASSWORD_REQUIRED -> RecoveryError.PASSWORD_REQUIRED;
            case DUPLICATE_INDICES -> RecoveryError.DUPLICATE_INDICES;
            case WAITING, INVALID_FORMAT, READY -> RecoveryError.INVALID_FORMAT;
        };
        return fail(error, verdict, verdict.message());
    }

    private RecoveryException fail(RecoveryError error, RecoveryVerdict verdict, String message) {
        return fail(error, verdict, message, null);
    }

    private RecoveryException fail(RecoveryError error, RecoveryVerdict verdict, String message, Throwable cause) {
        audit(error.name().toLowerCase(), Map.of(
                "verdict", verdict.status().name(),
                "have", verdict.have(),
                "need", verdict.need(),
                "pending", verdict.pending()
        ));
        return cause == null
                ? new RecoveryException(error, verdict, message)
                : new RecoveryException(error, verdict, message, cause);
    }

    private void audit(String result, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        auditLogger.log(AuditLogger.AuditEvent.of("shards.recover", "recovery", result, details));
    }
}
