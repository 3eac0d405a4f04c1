package io.mnemoshard.model;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One candidate as the user supplied it: a pasted line (or armored block) or a
 * whole uploaded file. {@code source} names it in error reports.
 */
public final class RawInput {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0E-\\x1F\\x7F]");

    private final String source;
    private final InputOrigin origin;
    private final byte[] content;
    private final boolean textual;

    private RawInput(String source, InputOrigin origin, byte[] content, boolean textual) {
        this.source = Objects.requireNonNull(source, "source");
        this.origin = Objects.requireNonNull(origin, "origin");
        this.content = Objects.requireNonNull(content, "content").clone();
        this.textual = textual;
    }

    public static RawInput pasted(String source, String text) {
        String value = text == null ? "" : text;
        return new RawInput(source, InputOrigin.PASTED, value.getBytes(StandardCharsets.UTF_8), true);
    }

    public static RawInput file(String fileName, byte[] bytes) {
        byte[] value = bytes == null ? new byte[0] : bytes;
        return new RawInput(fileName, InputOrigin.FILE, value, looksTextual(value));
    }

    public String source() {
        return source;
    }

    public InputOrigin origin() {
        return origin;
    }

    public byte[] bytes() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    public boolean isTextual() {
        return textual;
    }

    /**
     * Content as text. Malformed sequences are replaced, so this is safe to call on
     * binary content when looking for textual markers. A leading byte order mark is dropped.
     */
    public String text() {
        String value = new String(content, StandardCharsets.UTF_8);
        return value.startsWith("\uFEFF") ? value.substring(1) : value;
    }

    static boolean looksTextual(byte[] bytes) {
        String decoded;
        try {
            decoded = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return false;
        }
        return !hasControlCharacters(decoded);
    }

    public static boolean hasControlCharacters(String text) {
        return text != null && CONTROL_CHARS.matcher(text).find();
    }

    @Override
    public String toString() {
        return "RawInput[" + origin.name().toLowerCase() + ":" + source + ", " + content.length + " bytes]";
    }
}
