package io.mnemoshard.codec;

import io.mnemoshard.ShardFixtures;
import io.mnemoshard.model.ShardRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.OptionalInt;

final class ShareCodecTest {

    private static String b64(String json) {
        return Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void encodeThenDecodeRestoresRecord() {
        for (ShardRecord record : ShardFixtures.records(ShardFixtures.SECRET, 5, 3)) {
            String token = ShareCodec.encode(record);
            Assertions.assertFalse(token.contains("\n"));
            Assertions.assertEquals(record, ShareCodec.decode(token));
        }
    }

    @Test
    void encodeIsDeterministicWithFixedFieldOrder() {
        ShardRecord record = new ShardRecord(2, 2, 3, new byte[]{1, 2, 3});
        String token = ShareCodec.encode(record);
        Assertions.assertEquals(token, ShareCodec.encode(record));
        String json = new String(Base64.getDecoder().decode(token), StandardCharsets.UTF_8);
        Assertions.assertEquals("{\"index\":2,\"threshold\":2,\"total\":3,\"data\":\"AQID\"}", json);
    }

    @Test
    void decodeIgnoresUnknownFieldsAndAcceptsDigitStrings() {
        ShardRecord decoded = ShareCodec.decode(b64(
                "{\"version\":1,\"index\":\"1\",\"threshold\":2,\"total\":\"3\",\"data\":\"AQID\",\"note\":\"x\"}"));
        Assertions.assertEquals(new ShardRecord(1, 2, 3, new byte[]{1, 2, 3}), decoded);
    }

    @Test
    void decodeRejectsMalformedTokens() {
        List<String> bad = List.of(
                "",
                "   ",
                "not base64 !!",
                b64("plain words"),
                b64("[1,2,3]"),
                b64("{\"threshold\":2,\"total\":3,\"data\":\"AQID\"}"),
                b64("{\"index\":1,\"total\":3,\"data\":\"AQID\"}"),
                b64("{\"index\":1,\"threshold\":2,\"data\":\"AQID\"}"),
                b64("{\"index\":1,\"threshold\":2,\"total\":3}"),
                b64("{\"index\":\"one\",\"threshold\":2,\"total\":3,\"data\":\"AQID\"}"),
                b64("{\"index\":1.5,\"threshold\":2,\"total\":3,\"data\":\"AQID\"}"),
                b64("{\"index\":1,\"threshold\":2,\"total\":3,\"data\":\"\"}"),
                b64("{\"index\":1,\"threshold\":2,\"total\":3,\"data\":\"%%%\"}"),
                b64("{\"index\":0,\"threshold\":2,\"total\":3,\"data\":\"AQID\"}"),
                b64("{\"index\":4,\"threshold\":2,\"total\":3,\"data\":\"AQID\"}"),
                b64("{\"index\":1,\"threshold\":1,\"total\":3,\"data\":\"AQID\"}"),
                b64("{\"index\":1,\"threshold\":4,\"total\":3,\"data\":\"AQID\"}"),
                b64("{\"index\":1,\"threshold\":2,\"total\":256,\"data\":\"AQID\"}")
        );
        for (String token : bad) {
            Assertions.assertThrows(ShareDecodeException.class, () -> ShareCodec.decode(token), token);
            Assertions.assertTrue(ShareCodec.tryDecode(token).isEmpty(), token);
        }
    }

    @Test
    void decodeToleratesSurroundingWhitespace() {
        ShardRecord record = new ShardRecord(1, 2, 2, new byte[]{9});
        Assertions.assertEquals(record, ShareCodec.decode("  " + ShareCodec.encode(record) + "\n"));
    }

    @Test
    void peekThresholdReadsStructurallyValidButBrokenTokens() {
        Assertions.assertEquals(OptionalInt.of(4),
                ShareCodec.peekThreshold(b64("{\"index\":9,\"threshold\":4,\"total\":3,\"data\":\"AQID\"}")));
        Assertions.assertEquals(OptionalInt.of(3),
                ShareCodec.peekThreshold(b64("{\"threshold\":\"3\"}")));
        Assertions.assertTrue(ShareCodec.peekThreshold(b64("{\"threshold\":1}")).isEmpty());
        Assertions.assertTrue(ShareCodec.peekThreshold(b64("{\"index\":1}")).isEmpty());
        Assertions.assertTrue(ShareCodec.peekThreshold("garbage!").isEmpty());
        Assertions.assertTrue(ShareCodec.peekThreshold(null).isEmpty());
    }
}
