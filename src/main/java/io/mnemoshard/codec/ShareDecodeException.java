package io.mnemoshard.codec;

public final class ShareDecodeException extends RuntimeException {
    public ShareDecodeException(String message) {
        super(message);
    }

    public ShareDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
