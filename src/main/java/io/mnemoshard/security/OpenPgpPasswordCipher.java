package io.mnemoshard.security;

import org.bouncycastle.bcpg.ArmoredOutputStream;
import org.bouncycastle.bcpg.CompressionAlgorithmTags;
import org.bouncycastle.bcpg.HashAlgorithmTags;
import org.bouncycastle.bcpg.SymmetricKeyAlgorithmTags;
import org.bouncycastle.openpgp.PGPCompressedData;
import org.bouncycastle.openpgp.PGPCompressedDataGenerator;
import org.bouncycastle.openpgp.PGPDataValidationException;
import org.bouncycastle.openpgp.PGPEncryptedData;
import org.bouncycastle.openpgp.PGPEncryptedDataGenerator;
import org.bouncycastle.openpgp.PGPEncryptedDataList;
import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPLiteralData;
import org.bouncycastle.openpgp.PGPLiteralDataGenerator;
import org.bouncycastle.openpgp.PGPMarker;
import org.bouncycastle.openpgp.PGPPBEEncryptedData;
import org.bouncycastle.openpgp.PGPUtil;
import org.bouncycastle.openpgp.bc.BcPGPObjectFactory;
import org.bouncycastle.openpgp.operator.PGPDigestCalculator;
import org.bouncycastle.openpgp.operator.bc.BcPBEDataDecryptorFactory;
import org.bouncycastle.openpgp.operator.bc.BcPBEKeyEncryptionMethodGenerator;
import org.bouncycastle.openpgp.operator.bc.BcPGPDataEncryptorBuilder;
import org.bouncycastle.openpgp.operator.bc.BcPGPDigestCalculatorProvider;
import org.bouncycastle.util.io.Streams;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.security.SecureRandom;
import java.util.Date;

/**
 * OpenPGP symmetric (passphrase) encryption compatible with {@code gpg --symmetric}:
 * AES-256, iterated and salted SHA-256 S2K, ZIP compression, integrity-protected packets.
 */
public final class OpenPgpPasswordCipher implements PasswordCipher {
    private static final int S2K_ITERATION_COUNT = 0x90;
    private static final int BUFFER_BYTES = 4096;

    private final SecureRandom secureRandom;
    private final int s2kIterationCount;

    public OpenPgpPasswordCipher() {
        this(new SecureRandom());
    }

    public OpenPgpPasswordCipher(SecureRandom secureRandom) {
        this(secureRandom, S2K_ITERATION_COUNT);
    }

    OpenPgpPasswordCipher(SecureRandom secureRandom, int s2kIterationCount) {
        this.secureRandom = secureRandom;
        this.s2kIterationCount = s2kIterationCount;
    }

    @Override
    public byte[] encrypt(byte[] plaintext, String password, boolean armored) {
        if (plaintext == null || plaintext.length == 0) {
            throw new ShardCryptoException("Plaintext must not be empty");
        }
        requirePassword(password);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            OutputStream target = armored ? new ArmoredOutputStream(out) : out;
            PGPDigestCalculator s2kDigest = new BcPGPDigestCalculatorProvider().get(HashAlgorithmTags.SHA256);
            PGPEncryptedDataGenerator encryptor = new PGPEncryptedDataGenerator(
                    new BcPGPDataEncryptorBuilder(SymmetricKeyAlgorithmTags.AES_256)
                            .setWithIntegrityPacket(true)
                            .setSecureRandom(secureRandom));
            encryptor.addMethod(new BcPBEKeyEncryptionMethodGenerator(
                    password.toCharArray(), s2kDigest, s2kIterationCount).setSecureRandom(secureRandom));
            try (OutputStream encrypted = encryptor.open(target, new byte[BUFFER_BYTES])) {
                PGPCompressedDataGenerator compressor = new PGPCompressedDataGenerator(CompressionAlgorithmTags.ZIP);
                try (OutputStream compressed = compressor.open(encrypted)) {
                    PGPLiteralDataGenerator literal = new PGPLiteralDataGenerator();
                    try (OutputStream body = literal.open(
                            compressed, PGPLiteralData.UTF8, PGPLiteralData.CONSOLE, plaintext.length, new Date())) {
                        body.write(plaintext);
                    }
                }
            }
            if (armored) {
                target.close();
            }
            return out.toByteArray();
        } catch (IOException | PGPException e) {
            throw new ShardCryptoException("Failed to encrypt shard", e);
        }
    }

    @Override
    public byte[] decrypt(byte[] ciphertext, String password) {
        if (ciphertext == null || ciphertext.length == 0) {
            throw new MalformedCiphertextException("Encrypted data is empty");
        }
        requirePassword(password);
        PGPPBEEncryptedData encrypted = readPasswordPacket(ciphertext);
        InputStream clear;
        try {
            clear = encrypted.getDataStream(new BcPBEDataDecryptorFactory(
                    password.toCharArray(), new BcPGPDigestCalculatorProvider()));
        } catch (PGPDataValidationException e) {
            throw new WrongPasswordException("Incorrect password", e);
        } catch (PGPException e) {
            // A wrong passphrase over an encrypted session key surfaces as an unusable key.
            throw new WrongPasswordException("Session key decryption failed", e);
        }
        // Past the two-byte quick check about one wrong password in 65536 still gets
        // here, so under an integrity packet a garbled body is a wrong password too.
        boolean protectedBody = encrypted.isIntegrityProtected();
        byte[] plaintext;
        try {
            plaintext = readLiteral(clear);
        } catch (IOException | PGPException | RuntimeException e) {
            if (protectedBody) {
                throw new WrongPasswordException("Decrypted body is not a valid message", e);
            }
            throw new MalformedCiphertextException("Encrypted message body is unreadable", e);
        }
        try {
            if (protectedBody && !encrypted.verify()) {
                throw new WrongPasswordException("Integrity check failed");
            }
        } catch (IOException | PGPException e) {
            throw new WrongPasswordException("Integrity packet does not match", e);
        }
        return plaintext;
    }

    private PGPPBEEncryptedData readPasswordPacket(byte[] ciphertext) {
        try {
            InputStream decoded = PGPUtil.getDecoderStream(new ByteArrayInputStream(ciphertext));
            BcPGPObjectFactory factory = new BcPGPObjectFactory(decoded);
            Object next = factory.nextObject();
            while (next instanceof PGPMarker) {
                next = factory.nextObject();
            }
            if (!(next instanceof PGPEncryptedDataList)) {
                throw new MalformedCiphertextException("Not an OpenPGP encrypted message");
            }
            PGPEncryptedDataList list = (PGPEncryptedDataList) next;
            for (int i = 0; i < list.size(); i++) {
                PGPEncryptedData item = list.get(i);
                if (item instanceof PGPPBEEncryptedData) {
                    return (PGPPBEEncryptedData) item;
                }
            }
            throw new MalformedCiphertextException("Message is not password encrypted");
        } catch (MalformedCiphertextException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new MalformedCiphertextException("Unreadable OpenPGP data", e);
        }
    }

    private static byte[] readLiteral(InputStream clear) throws IOException, PGPException {
        Object message = new BcPGPObjectFactory(clear).nextObject();
        if (message instanceof PGPCompressedData) {
            message = new BcPGPObjectFactory(((PGPCompressedData) message).getDataStream()).nextObject();
        }
        if (!(message instanceof PGPLiteralData)) {
            throw new PGPException("Expected literal data packet");
        }
        return Streams.readAll(((PGPLiteralData) message).getInputStream());
    }

    private static void requirePassword(String password) {
        if (password == null || password.isEmpty()) {
            throw new ShardCryptoException("Password must not be empty");
        }
    }
}
