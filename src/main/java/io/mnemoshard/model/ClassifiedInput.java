package io.mnemoshard.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A raw input tagged once by the detector. {@code record} is present only for
 * {@link InputFormat#PLAINTEXT}; {@code payload} holds what a decryption attempt
 * should consume (armored text bytes, binary packets, or the untouched content).
 */
public final class ClassifiedInput {
    private final RawInput raw;
    private final InputFormat format;
    private final ShardRecord record;
    private final byte[] payload;
    private final Integer thresholdHint;

    private ClassifiedInput(RawInput raw, InputFormat format, ShardRecord record, byte[] payload, Integer thresholdHint) {
        this.raw = Objects.requireNonNull(raw, "raw");
        this.format = Objects.requireNonNull(format, "format");
        this.record = record;
        this.payload = payload == null ? new byte[0] : payload.clone();
        this.thresholdHint = thresholdHint;
    }

    public static ClassifiedInput plaintext(RawInput raw, ShardRecord record) {
        Objects.requireNonNull(record, "record");
        return new ClassifiedInput(raw, InputFormat.PLAINTEXT, record, raw.bytes(), record.threshold());
    }

    public static ClassifiedInput armored(RawInput raw, byte[] armoredText) {
        return new ClassifiedInput(raw, InputFormat.ARMORED, null, armoredText, null);
    }

    public static ClassifiedInput binary(RawInput raw, byte[] packets) {
        return new ClassifiedInput(raw, InputFormat.BINARY, null, packets, null);
    }

    public static ClassifiedInput unrecognized(RawInput raw, OptionalInt thresholdHint) {
        Integer hint = thresholdHint.isPresent() ? thresholdHint.getAsInt() : null;
        return new ClassifiedInput(raw, InputFormat.UNRECOGNIZED, null, raw.bytes(), hint);
    }

    public RawInput raw() {
        return raw;
    }

    public String source() {
        return raw.source();
    }

    public InputFormat format() {
        return format;
    }

    public Optional<ShardRecord> record() {
        return Optional.ofNullable(record);
    }

    public byte[] payload() {
        return payload.clone();
    }

    public OptionalInt thresholdHint() {
        return thresholdHint == null ? OptionalInt.empty() : OptionalInt.of(thresholdHint);
    }

    @Override
    public String toString() {
        return "ClassifiedInput[" + raw.source() + " -> " + format + "]";
    }
}
