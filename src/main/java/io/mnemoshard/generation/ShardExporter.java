package io.mnemoshard.generation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Writes one file per shard: {@code share-<i>.txt} with the plaintext token
 * wrapped in a readable template, and {@code share-<i>.txt.gpg} holding only the
 * encrypted artifact when there is one.
 */
public final class ShardExporter {
    static final String RULE = "=".repeat(50);

    private final Clock clock;

    public ShardExporter() {
        this(Clock.systemUTC());
    }

    public ShardExporter(Clock clock) {
        this.clock = clock;
    }

    public static String plainFileName(int index) {
        return "share-" + index + ".txt";
    }

    public static String encryptedFileName(int index) {
        return plainFileName(index) + ".gpg";
    }

    public String render(GeneratedShard shard) {
        return render(shard.index(), shard.token(), clock.instant());
    }

    static String render(int index, String token, Instant generatedAt) {
        return "MnemoShard Share " + index + "\n"
                + RULE + "\n\n"
                + "Share content:\n"
                + token + "\n\n"
                + RULE + "\n"
                + "Generated at: " + generatedAt + "\n\n"
                + "Safety notes:\n"
                + "- Keep this share somewhere safe and offline.\n"
                + "- Never store enough shares together to reach the threshold.\n"
                + "- Recovery needs the threshold number of distinct shares.\n";
    }

    public List<Path> export(GenerationResult result, Path directory) throws IOException {
        Files.createDirectories(directory);
        List<Path> written = new ArrayList<>();
        for (GeneratedShard shard : result.shards()) {
            Path plain = directory.resolve(plainFileName(shard.index()));
            Files.writeString(plain, render(shard), StandardCharsets.UTF_8);
            written.add(plain);
            Optional<byte[]> artifact = shard.encryptedArtifact();
            if (artifact.isPresent()) {
                Path encrypted = directory.resolve(encryptedFileName(shard.index()));
                Files.write(encrypted, artifact.get());
                written.add(encrypted);
            }
        }
        return written;
    }
}
