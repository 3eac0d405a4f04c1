package io.mnemoshard.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;

public final class PasswordPolicy {
    public static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    public static final String LOWER = "abcdefghijklmnopqrstuvwxyz";
    public static final String DIGITS = "0123456789";
    public static final String SPECIAL = "!@#$%^&*()_+-=[]{}|;:,.<>?";
    public static final int DEFAULT_LENGTH = 16;

    private static final String SPECIAL_PATTERN = ".*[!@#$%^&*()_+\\-=\\[\\]{};':\"\\\\|,.<>/?].*";
    private static final SecureRandom RANDOM = new SecureRandom();

    public enum Strength {
        WEAK,
        MEDIUM,
        STRONG
    }

    private PasswordPolicy() {
    }

    public static int score(String password) {
        if (password == null || password.isEmpty()) {
            return 0;
        }
        int score = 0;
        if (password.length() >= 8) {
            score++;
        }
        if (password.length() >= 12) {
            score++;
        }
        if (password.chars().anyMatch(c -> c >= 'A' && c <= 'Z')) {
            score++;
        }
        if (password.chars().anyMatch(c -> c >= 'a' && c <= 'z')) {
            score++;
        }
        if (password.chars().anyMatch(c -> c >= '0' && c <= '9')) {
            score++;
        }
        if (password.matches(SPECIAL_PATTERN)) {
            score++;
        }
        return score;
    }

    public static Strength strength(String password) {
        int score = score(password);
        if (score < 3) {
            return Strength.WEAK;
        }
        if (score < 5) {
            return Strength.MEDIUM;
        }
        return Strength.STRONG;
    }

    /** Constant-time for equal-length inputs. */
    public static boolean matches(String password, String confirmation) {
        if (password == null || confirmation == null) {
            return false;
        }
        return MessageDigest.isEqual(
                password.getBytes(StandardCharsets.UTF_8),
                confirmation.getBytes(StandardCharsets.UTF_8)
        );
    }

    public static String generate(int length) {
        if (length < 1) {
            throw new IllegalArgumentException("password length must be positive");
        }
        String alphabet = UPPER + LOWER + DIGITS + SPECIAL;
        StringBuilder out = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            out.append(alphabet.charAt(RANDOM.nextInt(alphabet.length())));
        }
        return out.toString();
    }
}
