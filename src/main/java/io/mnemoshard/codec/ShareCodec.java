package io.mnemoshard.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mnemoshard.model.ShardRecord;
import io.mnemoshard.util.Jsons;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Shard token wire format: standard Base64 of a compact JSON object
 * {@code {"index":i,"threshold":t,"total":n,"data":"<base64 payload>"}}.
 * Unknown fields are ignored on decode.
 */
public final class ShareCodec {
    static final String FIELD_INDEX = "index";
    static final String FIELD_THRESHOLD = "threshold";
    static final String FIELD_TOTAL = "total";
    static final String FIELD_DATA = "data";

    private ShareCodec() {
    }

    public static String encode(ShardRecord record) {
        ObjectNode row = Jsons.mapper().createObjectNode();
        row.put(FIELD_INDEX, record.ordinalIndex());
        row.put(FIELD_THRESHOLD, record.threshold());
        row.put(FIELD_TOTAL, record.totalCount());
        row.put(FIELD_DATA, Base64.getEncoder().encodeToString(record.payload()));
        String json = Jsons.toCompactJson(row);
        return Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    public static ShardRecord decode(String token) {
        JsonNode node = readObject(token);
        int index = requireInt(node, FIELD_INDEX);
        int threshold = requireInt(node, FIELD_THRESHOLD);
        int total = requireInt(node, FIELD_TOTAL);
        JsonNode data = node.get(FIELD_DATA);
        if (data == null || data.isNull() || !data.isTextual() || data.asText().isBlank()) {
            throw new ShareDecodeException("Missing required field: " + FIELD_DATA);
        }
        byte[] payload;
        try {
            payload = Base64.getDecoder().decode(data.asText().trim());
        } catch (IllegalArgumentException e) {
            throw new ShareDecodeException("Shard data is not valid Base64", e);
        }
        try {
            return new ShardRecord(index, threshold, total, payload);
        } catch (IllegalArgumentException e) {
            throw new ShareDecodeException("Invalid shard: " + e.getMessage(), e);
        }
    }

    public static Optional<ShardRecord> tryDecode(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(decode(token));
        } catch (ShareDecodeException e) {
            return Optional.empty();
        }
    }

    /**
     * Threshold carried by a token that parses as a shard object even if other
     * fields are broken. Used only as a consensus hint.
     */
    public static OptionalInt peekThreshold(String token) {
        if (token == null || token.isBlank()) {
            return OptionalInt.empty();
        }
        try {
            JsonNode node = readObject(token);
            int threshold = requireInt(node, FIELD_THRESHOLD);
            return threshold >= ShardRecord.MIN_THRESHOLD ? OptionalInt.of(threshold) : OptionalInt.empty();
        } catch (ShareDecodeException e) {
            return OptionalInt.empty();
        }
    }

    private static JsonNode readObject(String token) {
        if (token == null || token.isBlank()) {
            throw new ShareDecodeException("Shard token is empty");
        }
        byte[] jsonBytes;
        try {
            jsonBytes = Base64.getDecoder().decode(token.trim());
        } catch (IllegalArgumentException e) {
            throw new ShareDecodeException("Shard token is not valid Base64", e);
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(new String(jsonBytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            throw new ShareDecodeException("Shard token does not contain JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new ShareDecodeException("Shard token is not a JSON object");
        }
        return node;
    }

    private static int requireInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new ShareDecodeException("Missing required field: " + field);
        }
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            return value.intValue();
        }
        if (value.isTextual()) {
            String raw = value.asText().trim();
            if (!raw.isEmpty() && raw.length() <= 9 && raw.chars().allMatch(Character::isDigit)) {
                return Integer.parseInt(raw);
            }
        }
        throw new ShareDecodeException("Field is not numeric: " + field);
    }
}
