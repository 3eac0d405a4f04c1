package io.mnemoshard.security;

/**
 * The ciphertext is well formed but the password does not open it.
 */
public final class WrongPasswordException extends ShardCryptoException {
    public WrongPasswordException(String message) {
        super(message);
    }

    public WrongPasswordException(String message, Throwable cause) {
        super(message, cause);
    }
}
