package io.mnemoshard.recovery;

import io.mnemoshard.detect.FormatDetector;
import io.mnemoshard.model.DecryptionAttempt;
import io.mnemoshard.model.RecoveryVerdict;
import io.mnemoshard.model.ShardRecord;
import io.mnemoshard.model.ShareEntry;
import io.mnemoshard.observability.AuditLogger;
import io.mnemoshard.security.PasswordCipher;
import io.mnemoshard.security.ShardCryptoException;
import io.mnemoshard.security.WrongPasswordException;
import io.mnemoshard.validation.ShareSetValidator;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs bounded password passes over the encrypted entries of a session.
 *
 * <p>Each pass applies one password to every pending entry. Wrong-password
 * entries stay pending and make the next prompt a retry; anything else that
 * fails is marked invalid for good. The loop ends when nothing is pending, the
 * batch is ready, a pass saw no wrong password, the prompt is cancelled, or
 * the pass cap is reached. Entries decrypted by earlier passes survive a cancel.
 */
public final class DecryptionCoordinator {
    private final PasswordCipher cipher;
    private final ShareSetValidator validator;
    private final int maxPasses;
    private final AuditLogger auditLogger;

    public DecryptionCoordinator(PasswordCipher cipher, ShareSetValidator validator, int maxPasses, AuditLogger auditLogger) {
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be >= 1: " + maxPasses);
        }
        this.cipher = cipher;
        this.validator = validator;
        this.maxPasses = maxPasses;
        this.auditLogger = auditLogger;
    }

    public DecryptionOutcome run(RecoverySession session, PasswordPrompt prompt) {
        return run(session, prompt, DecryptionListener.NONE);
    }

    public DecryptionOutcome run(RecoverySession session, PasswordPrompt prompt, DecryptionListener listener) {
        DecryptionListener sink = listener == null ? DecryptionListener.NONE : listener;
        if (session.pendingEncrypted().isEmpty()) {
            return new DecryptionOutcome(DecryptionOutcome.Status.NOTHING_PENDING, 0, 0, false, session.verdict());
        }
        int pass = 0;
        int decrypted = 0;
        boolean retry = false;
        boolean wrongPasswordSeen = false;
        RecoveryVerdict verdict = session.verdict();
        while (pass < maxPasses) {
            List<String> pendingSources = pendingSources(session);
            if (pendingSources.isEmpty()) {
                break;
            }
            pass++;
            Optional<String> password = prompt.requestPassword(
                    new PasswordRequest(pass, maxPasses, retry, pendingSources));
            if (password.isEmpty() || password.get().isEmpty()) {
                return new DecryptionOutcome(
                        DecryptionOutcome.Status.CANCELLED, pass, decrypted, wrongPasswordSeen, session.verdict());
            }
            PassResult result = applyPassword(session, pass, password.get());
            decrypted += result.decrypted();
            verdict = validator.validate(session.entries());
            sink.onPassCompleted(pass, result.attempts(), verdict);
            if (!result.wrongPassword()) {
                return new DecryptionOutcome(DecryptionOutcome.Status.COMPLETED, pass, decrypted, wrongPasswordSeen, verdict);
            }
            wrongPasswordSeen = true;
            if (verdict.isReady()) {
                return new DecryptionOutcome(DecryptionOutcome.Status.COMPLETED, pass, decrypted, true, verdict);
            }
            retry = true;
        }
        DecryptionOutcome.Status status = session.pendingEncrypted().isEmpty()
                ? DecryptionOutcome.Status.COMPLETED
                : DecryptionOutcome.Status.RETRIES_EXHAUSTED;
        return new DecryptionOutcome(status, pass, decrypted, wrongPasswordSeen, verdict);
    }

    public int maxPasses() {
        return maxPasses;
    }

    private PassResult applyPassword(RecoverySession session, int pass, String password) {
        List<DecryptionAttempt> attempts = new ArrayList<>();
        int decrypted = 0;
        boolean wrongPassword = false;
        for (int i = 0; i < session.size(); i++) {
            ShareEntry entry = session.entryAt(i);
            if (!entry.isPendingEncrypted()) {
                continue;
            }
            DecryptionAttempt attempt;
            try {
                byte[] plain = cipher.decrypt(entry.input().payload(), password);
                Optional<ShardRecord> record = FormatDetector.decodeFirst(new String(plain, StandardCharsets.UTF_8));
                if (record.isPresent()) {
                    session.replace(i, entry.decrypted(record.get()));
                    decrypted++;
                    attempt = new DecryptionAttempt(entry.source(), pass, DecryptionAttempt.Outcome.SUCCESS, null);
                } else {
                    session.replace(i, entry.invalid("decrypted content is not a shard token"));
                    attempt = new DecryptionAttempt(entry.source(), pass, DecryptionAttempt.Outcome.NOT_A_SHARD,
                            "decrypted content is not a shard token");
                }
            } catch (WrongPasswordException e) {
                wrongPassword = true;
                attempt = new DecryptionAttempt(entry.source(), pass, DecryptionAttempt.Outcome.WRONG_PASSWORD,
                        e.getMessage());
            } catch (ShardCryptoException e) {
                session.replace(i, entry.invalid(e.getMessage()));
                attempt = new DecryptionAttempt(entry.source(), pass, DecryptionAttempt.Outcome.MALFORMED,
                        e.getMessage());
            }
            session.recordAttempt(attempt);
            attempts.add(attempt);
            audit(attempt);
        }
        return new PassResult(attempts, decrypted, wrongPassword);
    }

    private static List<String> pendingSources(RecoverySession session) {
        List<String> out = new ArrayList<>();
        for (ShareEntry entry : session.pendingEncrypted()) {
            out.add(entry.source());
        }
        return out;
    }

    private void audit(DecryptionAttempt attempt) {
        if (auditLogger == null) {
            return;
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "shard.decrypt",
                attempt.source(),
                attempt.outcome().name().toLowerCase(),
                Map.of("pass", attempt.pass())
        ));
    }

    private record PassResult(List<DecryptionAttempt> attempts, int decrypted, boolean wrongPassword) {
    }
}
