package io.mnemoshard.recovery;

import java.util.List;

/**
 * What a password prompt is told about the pass it is asked for.
 */
public record PasswordRequest(
        int pass,
        int maxPasses,
        boolean retry,
        List<String> pendingSources
) {
    public PasswordRequest {
        pendingSources = pendingSources == null ? List.of() : List.copyOf(pendingSources);
    }

    public int pendingCount() {
        return pendingSources.size();
    }

    public String message() {
        if (retry) {
            return "Incorrect password, please try again (attempt " + pass + " of " + maxPasses + ")";
        }
        return "Enter the password for " + pendingSources.size() + " encrypted shard(s)";
    }
}
