package io.mnemoshard.recovery;

import java.util.Optional;

/**
 * Suspension point of a recovery: asks the user for a password.
 * An empty result cancels the current decryption pass.
 */
@FunctionalInterface
public interface PasswordPrompt {
    Optional<String> requestPassword(PasswordRequest request);
}
