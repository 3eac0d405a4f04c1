package io.mnemoshard.recovery;

import io.mnemoshard.detect.FormatDetector;
import io.mnemoshard.model.DecryptionAttempt;
import io.mnemoshard.model.RawInput;
import io.mnemoshard.model.RecoveryVerdict;
import io.mnemoshard.model.ShardRecord;
import io.mnemoshard.model.ShareEntry;
import io.mnemoshard.observability.AuditLogger;
import io.mnemoshard.validation.ShareSetValidator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The batch of one recovery attempt. Owned by a single caller; every mutation
 * is followed by a full revalidation through {@link #verdict()}.
 */
public final class RecoverySession {
    private final ShareSetValidator validator;
    private final long maxFileBytes;
    private final AuditLogger auditLogger;
    private final List<ShareEntry> entries;
    private final List<IntakeRejection> rejections;
    private final List<DecryptionAttempt> attempts;
    private final Set<String> fileNames;

    RecoverySession(ShareSetValidator validator, long maxFileBytes, AuditLogger auditLogger) {
        this.validator = validator;
        this.maxFileBytes = maxFileBytes;
        this.auditLogger = auditLogger;
        this.entries = new ArrayList<>();
        this.rejections = new ArrayList<>();
        this.attempts = new ArrayList<>();
        this.fileNames = new LinkedHashSet<>();
    }

    public List<ShareEntry> addPastedText(String text) {
        List<ShareEntry> added = new ArrayList<>();
        for (BatchIntake.PastedCandidate candidate : BatchIntake.splitPastedText(text)) {
            added.add(add(RawInput.pasted(candidate.source(), candidate.text())));
        }
        return added;
    }

    public Optional<IntakeRejection> addFile(String fileName, byte[] content) {
        long size = content == null ? 0L : content.length;
        Optional<IntakeRejection> rejection = BatchIntake.checkFile(fileName, size, fileNames, maxFileBytes);
        if (rejection.isPresent()) {
            reject(rejection.get());
            return rejection;
        }
        fileNames.add(fileName);
        add(RawInput.file(fileName, content));
        return Optional.empty();
    }

    public Optional<IntakeRejection> addFile(Path file) {
        String fileName = file.getFileName() == null ? file.toString() : file.getFileName().toString();
        try {
            long size = Files.size(file);
            Optional<IntakeRejection> rejection = BatchIntake.checkFile(fileName, size, fileNames, maxFileBytes);
            if (rejection.isPresent()) {
                reject(rejection.get());
                return rejection;
            }
            return addFile(fileName, Files.readAllBytes(file));
        } catch (IOException e) {
            IntakeRejection unreadable = new IntakeRejection(fileName, IntakeRejection.Reason.UNREADABLE,
                    "Failed to read file: " + fileName + " (" + e.getMessage() + ")");
            reject(unreadable);
            return Optional.of(unreadable);
        }
    }

    public ShareEntry add(RawInput raw) {
        ShareEntry entry = ShareEntry.of(FormatDetector.classify(raw));
        entries.add(entry);
        return entry;
    }

    public RecoveryVerdict verdict() {
        return validator.validate(List.copyOf(entries));
    }

    public List<ShareEntry> entries() {
        return List.copyOf(entries);
    }

    public List<ShareEntry> pendingEncrypted() {
        List<ShareEntry> out = new ArrayList<>();
        for (ShareEntry entry : entries) {
            if (entry.isPendingEncrypted()) {
                out.add(entry);
            }
        }
        return out;
    }

    public List<ShardRecord> usableRecords() {
        List<ShardRecord> out = new ArrayList<>();
        for (ShareEntry entry : entries) {
            entry.usableRecord().ifPresent(out::add);
        }
        return out;
    }

    public List<IntakeRejection> rejections() {
        return List.copyOf(rejections);
    }

    public List<DecryptionAttempt> attempts() {
        return List.copyOf(attempts);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    int size() {
        return entries.size();
    }

    ShareEntry entryAt(int position) {
        return entries.get(position);
    }

    void replace(int position, ShareEntry entry) {
        entries.set(position, entry);
    }

    void recordAttempt(DecryptionAttempt attempt) {
        attempts.add(attempt);
    }

    private void reject(IntakeRejection rejection) {
        rejections.add(rejection);
        if (auditLogger != null) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "batch.intake.reject",
                    rejection.source(),
                    rejection.reason().name().toLowerCase(),
                    Map.of("message", rejection.message())
            ));
        }
    }
}
