package io.mnemoshard.recovery;

import io.mnemoshard.detect.FormatDetector;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Admission rules for the two input surfaces: pasted text and uploaded files.
 */
public final class BatchIntake {
    public static final List<String> PLAINTEXT_EXTENSIONS = List.of(".txt");
    public static final List<String> ENCRYPTED_EXTENSIONS = List.of(".gpg", ".asc");

    private BatchIntake() {
    }

    public enum ExpectedContent {
        PLAINTEXT,
        ENCRYPTED
    }

    /**
     * One candidate per non-empty trimmed line. Lines from an armor header up to
     * its footer stay together as a single candidate.
     */
    public static List<PastedCandidate> splitPastedText(String text) {
        List<PastedCandidate> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        String[] lines = text.split("\\r?\\n");
        StringBuilder block = null;
        int blockStart = 0;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            int lineNo = i + 1;
            if (block != null) {
                block.append(line).append('\n');
                if (line.startsWith(FormatDetector.ARMOR_FOOTER)) {
                    out.add(new PastedCandidate("lines " + blockStart + "-" + lineNo, block.toString()));
                    block = null;
                }
                continue;
            }
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith(FormatDetector.ARMOR_HEADER)) {
                block = new StringBuilder();
                block.append(line).append('\n');
                blockStart = lineNo;
                continue;
            }
            out.add(new PastedCandidate("line " + lineNo, line));
        }
        if (block != null) {
            // Unterminated block; hand it over as-is and let decryption report it.
            out.add(new PastedCandidate("lines " + blockStart + "-" + lines.length, block.toString()));
        }
        return out;
    }

    public static Optional<ExpectedContent> expectedContent(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return Optional.empty();
        }
        String name = fileName.trim().toLowerCase(Locale.ROOT);
        for (String ext : ENCRYPTED_EXTENSIONS) {
            if (name.endsWith(ext)) {
                return Optional.of(ExpectedContent.ENCRYPTED);
            }
        }
        for (String ext : PLAINTEXT_EXTENSIONS) {
            if (name.endsWith(ext)) {
                return Optional.of(ExpectedContent.PLAINTEXT);
            }
        }
        return Optional.empty();
    }

    public static Optional<IntakeRejection> checkFile(
            String fileName,
            long sizeBytes,
            Collection<String> acceptedNames,
            long maxFileBytes
    ) {
        if (expectedContent(fileName).isEmpty()) {
            return Optional.of(new IntakeRejection(fileName, IntakeRejection.Reason.UNSUPPORTED_EXTENSION,
                    "File type not supported: " + fileName));
        }
        if (sizeBytes > maxFileBytes) {
            return Optional.of(new IntakeRejection(fileName, IntakeRejection.Reason.FILE_TOO_LARGE,
                    "File too large: " + fileName + " (" + sizeBytes + " > " + maxFileBytes + " bytes)"));
        }
        if (acceptedNames != null && acceptedNames.contains(fileName)) {
            return Optional.of(new IntakeRejection(fileName, IntakeRejection.Reason.DUPLICATE_FILE,
                    "File already added: " + fileName));
        }
        return Optional.empty();
    }

    public record PastedCandidate(String source, String text) {
    }
}
