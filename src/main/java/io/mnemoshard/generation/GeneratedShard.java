package io.mnemoshard.generation;

import io.mnemoshard.model.ShardRecord;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * A shard as handed to its custodian: the plaintext token always, plus the
 * encrypted artifact when a password was given.
 */
public final class GeneratedShard {
    private final ShardRecord record;
    private final String token;
    private final byte[] encrypted;
    private final boolean armored;

    GeneratedShard(ShardRecord record, String token, byte[] encrypted, boolean armored) {
        this.record = record;
        this.token = token;
        this.encrypted = encrypted == null ? null : encrypted.clone();
        this.armored = armored;
    }

    public int index() {
        return record.ordinalIndex();
    }

    public ShardRecord record() {
        return record;
    }

    public String token() {
        return token;
    }

    public boolean isEncrypted() {
        return encrypted != null;
    }

    public boolean isArmored() {
        return armored;
    }

    public Optional<byte[]> encryptedArtifact() {
        return encrypted == null ? Optional.empty() : Optional.of(encrypted.clone());
    }

    public Optional<String> armoredText() {
        if (encrypted == null || !armored) {
            return Optional.empty();
        }
        return Optional.of(new String(encrypted, StandardCharsets.US_ASCII));
    }
}
