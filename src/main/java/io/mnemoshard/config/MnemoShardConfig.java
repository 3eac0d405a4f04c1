package io.mnemoshard.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class MnemoShardConfig {
    public static final String DEFAULT_HOME = ".mnemoshard";
    public static final int DEFAULT_THRESHOLD = 3;
    public static final int DEFAULT_TOTAL_SHARES = 5;
    public static final int MAX_TOTAL_SHARES = 7;
    public static final int DEFAULT_MAX_PASSWORD_ATTEMPTS = 3;
    public static final long DEFAULT_MAX_FILE_BYTES = 5L * 1024L * 1024L;
    public static final String SETTINGS_FILE = "mnemoshard-settings.json";

    private final Path homeDir;

    public MnemoShardConfig(Path homeDir) {
        this.homeDir = homeDir;
    }

    public static MnemoShardConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_HOME)
                : Paths.get(root);
        return new MnemoShardConfig(resolved.toAbsolutePath().normalize());
    }

    public Path homeDir() {
        return homeDir;
    }

    public Path settingsFile() {
        return homeDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return homeDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path exportRoot() {
        return homeDir.resolve("shares");
    }
}
