package io.mnemoshard.security;

public class ShardCryptoException extends RuntimeException {
    public ShardCryptoException(String message) {
        super(message);
    }

    public ShardCryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
