package io.mnemoshard.detect;

import io.mnemoshard.codec.ShareCodec;
import io.mnemoshard.model.ClassifiedInput;
import io.mnemoshard.model.InputOrigin;
import io.mnemoshard.model.RawInput;
import io.mnemoshard.model.ShardRecord;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Tags raw input once as plaintext token, armored OpenPGP message, binary OpenPGP
 * packet stream, or unrecognized. Rules are evaluated in order, first match wins.
 */
public final class FormatDetector {
    public static final String ARMOR_HEADER = "-----BEGIN PGP MESSAGE-----";
    public static final String ARMOR_FOOTER = "-----END PGP MESSAGE-----";
    static final int SHORT_TEXT_CHARS = 200;
    static final int MIN_REREAD_BYTES = 2;

    private static final byte[] ARMOR_HEADER_BYTES = ARMOR_HEADER.getBytes(StandardCharsets.US_ASCII);

    private FormatDetector() {
    }

    public static ClassifiedInput classify(RawInput raw) {
        if (raw.isTextual()) {
            return classifyText(raw);
        }
        return classifyBinary(raw);
    }

    private static ClassifiedInput classifyText(RawInput raw) {
        String text = raw.text();
        Optional<ShardRecord> record = decodeFirst(text);
        if (record.isPresent()) {
            return ClassifiedInput.plaintext(raw, record.get());
        }
        int header = text.indexOf(ARMOR_HEADER);
        if (header >= 0) {
            return ClassifiedInput.armored(raw, armoredFrom(text, header));
        }
        if (rereadAsBinary(raw, text.trim())) {
            // Binary file content that happened to survive text decoding.
            Optional<ClassifiedInput> asBinary = binaryMarkers(raw, raw.bytes());
            if (asBinary.isPresent()) {
                return asBinary.get();
            }
        }
        return ClassifiedInput.unrecognized(raw, peekThreshold(text));
    }

    /** Uploaded files only; a pasted label is never taken for packet data. */
    private static boolean rereadAsBinary(RawInput raw, String trimmed) {
        if (raw.origin() != InputOrigin.FILE || raw.size() < MIN_REREAD_BYTES) {
            return false;
        }
        return trimmed.length() < SHORT_TEXT_CHARS || RawInput.hasControlCharacters(trimmed);
    }

    private static ClassifiedInput classifyBinary(RawInput raw) {
        byte[] bytes = raw.bytes();
        String lenient = raw.text();
        int header = lenient.indexOf(ARMOR_HEADER);
        if (header >= 0) {
            return ClassifiedInput.armored(raw, armoredFrom(lenient, header));
        }
        return binaryMarkers(raw, bytes)
                .orElseGet(() -> ClassifiedInput.unrecognized(raw, OptionalInt.empty()));
    }

    private static Optional<ClassifiedInput> binaryMarkers(RawInput raw, byte[] bytes) {
        if (startsWith(bytes, ARMOR_HEADER_BYTES)) {
            return Optional.of(ClassifiedInput.armored(raw, bytes));
        }
        if (bytes.length > 0 && (bytes[0] & 0x80) == 0x80) {
            return Optional.of(ClassifiedInput.binary(raw, bytes));
        }
        return Optional.empty();
    }

    /**
     * Whole trimmed content first, then each non-empty trimmed line; the first
     * line that decodes wins.
     */
    public static Optional<ShardRecord> decodeFirst(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Optional<ShardRecord> whole = ShareCodec.tryDecode(text.trim());
        if (whole.isPresent()) {
            return whole;
        }
        for (String line : nonEmptyLines(text)) {
            Optional<ShardRecord> record = ShareCodec.tryDecode(line);
            if (record.isPresent()) {
                return record;
            }
        }
        return Optional.empty();
    }

    private static OptionalInt peekThreshold(String text) {
        OptionalInt whole = ShareCodec.peekThreshold(text.trim());
        if (whole.isPresent()) {
            return whole;
        }
        for (String line : nonEmptyLines(text)) {
            OptionalInt hint = ShareCodec.peekThreshold(line);
            if (hint.isPresent()) {
                return hint;
            }
        }
        return OptionalInt.empty();
    }

    static List<String> nonEmptyLines(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) {
            return out;
        }
        for (String line : text.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    private static byte[] armoredFrom(String text, int headerOffset) {
        return text.substring(headerOffset).trim().getBytes(StandardCharsets.UTF_8);
    }

    private static boolean startsWith(byte[] bytes, byte[] prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (bytes[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
