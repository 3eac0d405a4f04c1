package io.mnemoshard.security;

public final class MalformedCiphertextException extends ShardCryptoException {
    public MalformedCiphertextException(String message) {
        super(message);
    }

    public MalformedCiphertextException(String message, Throwable cause) {
        super(message, cause);
    }
}
