package io.mnemoshard.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.mnemoshard.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables read from {@code mnemoshard-settings.json}. Missing or out-of-range
 * fields fall back to the defaults field by field.
 */
public record ShardSettings(
        int maxPasswordAttempts,
        long maxFileBytes,
        int defaultThreshold,
        int maxTotalShares,
        String auditSigningSecret
) {
    static final int PASSWORD_ATTEMPTS_CAP = 10;
    static final long MIN_FILE_BYTES = 1024L;
    static final int TOTAL_SHARES_CAP = 255;

    public static ShardSettings defaults() {
        return new ShardSettings(
                MnemoShardConfig.DEFAULT_MAX_PASSWORD_ATTEMPTS,
                MnemoShardConfig.DEFAULT_MAX_FILE_BYTES,
                MnemoShardConfig.DEFAULT_THRESHOLD,
                MnemoShardConfig.MAX_TOTAL_SHARES,
                ""
        );
    }

    public static ShardSettings load(MnemoShardConfig config) {
        return load(config.settingsFile());
    }

    public static ShardSettings load(Path settingsFile) {
        ShardSettings defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + settingsFile, e);
        }
    }

    static ShardSettings fromFile(SettingsFile file, ShardSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int maxPasswordAttempts = sanitizeInt(file.maxPasswordAttempts(), defaults.maxPasswordAttempts(), 1);
        if (maxPasswordAttempts > PASSWORD_ATTEMPTS_CAP) {
            maxPasswordAttempts = PASSWORD_ATTEMPTS_CAP;
        }
        long maxFileBytes = sanitizeLong(file.maxFileBytes(), defaults.maxFileBytes(), MIN_FILE_BYTES);
        int maxTotalShares = sanitizeInt(file.maxTotalShares(), defaults.maxTotalShares(), 2);
        if (maxTotalShares > TOTAL_SHARES_CAP) {
            maxTotalShares = TOTAL_SHARES_CAP;
        }
        int defaultThreshold = sanitizeInt(file.defaultThreshold(), defaults.defaultThreshold(), 2);
        String signingSecret = file.auditSigningSecret() == null
                ? defaults.auditSigningSecret()
                : file.auditSigningSecret().trim();
        return new ShardSettings(
                maxPasswordAttempts,
                maxFileBytes,
                defaultThreshold,
                maxTotalShares,
                signingSecret
        );
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Integer maxPasswordAttempts,
            Long maxFileBytes,
            Integer defaultThreshold,
            Integer maxTotalShares,
            String auditSigningSecret
    ) {
    }
}
