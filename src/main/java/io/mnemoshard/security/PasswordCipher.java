package io.mnemoshard.security;

/**
 * Password-based symmetric encryption of shard tokens.
 */
public interface PasswordCipher {
    /**
     * @param armored ASCII-armored text output when true, raw binary packets otherwise
     */
    byte[] encrypt(byte[] plaintext, String password, boolean armored);

    /**
     * @throws WrongPasswordException when the message is intact but the password is wrong
     * @throws MalformedCiphertextException when the input is not a readable encrypted message
     */
    byte[] decrypt(byte[] ciphertext, String password);
}
