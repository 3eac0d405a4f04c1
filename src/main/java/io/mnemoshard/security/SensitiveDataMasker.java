package io.mnemoshard.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.mnemoshard.codec.ShareCodec;
import io.mnemoshard.util.Jsons;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scrubs audit details before they reach disk. Keys hinting at key material are
 * replaced outright; shard tokens, armored bodies and other long opaque values
 * are masked wherever they appear.
 */
public final class SensitiveDataMasker {
    private static final TextNode MASK = TextNode.valueOf("***");
    private static final int OPAQUE_MIN_CHARS = 24;
    private static final Pattern OPAQUE = Pattern.compile("^[A-Za-z0-9+/=_\\-:.]{" + OPAQUE_MIN_CHARS + ",}$");
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "passphrase", "secret", "mnemonic", "token", "payload", "share_data", "key"
    );

    private SensitiveDataMasker() {
    }

    /** Returns a scrubbed copy; the input is left untouched. */
    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isTextual()) {
            return likelySecretValue(input.asText("")) ? MASK : input;
        }
        JsonNode copy = input.deepCopy();
        scrub(copy);
        return copy;
    }

    private static void scrub(JsonNode node) {
        if (node instanceof ObjectNode) {
            ObjectNode object = (ObjectNode) node;
            List<String> names = new ArrayList<>();
            object.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                JsonNode value = object.get(name);
                if (isSensitiveKey(name) || (value.isTextual() && likelySecretValue(value.asText("")))) {
                    object.set(name, MASK);
                } else {
                    scrub(value);
                }
            }
        } else if (node instanceof ArrayNode) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                JsonNode value = array.get(i);
                if (value.isTextual() && likelySecretValue(value.asText(""))) {
                    array.set(i, MASK);
                } else {
                    scrub(value);
                }
            }
        }
    }

    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        return SENSITIVE_HINTS.stream().anyMatch(key::contains);
    }

    static boolean likelySecretValue(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        if (v.contains("-----BEGIN PGP")) {
            return true;
        }
        if (ShareCodec.tryDecode(v).isPresent()) {
            return true;
        }
        return v.length() >= OPAQUE_MIN_CHARS && OPAQUE.matcher(v).matches();
    }
}
