package io.mnemoshard.generation;

/**
 * @param password when non-blank, each shard also gets an encrypted artifact
 * @param armored  encrypted artifacts as ASCII-armored text rather than binary packets
 */
public record GenerationRequest(
        String secretText,
        int totalCount,
        int threshold,
        String password,
        boolean armored
) {
    public static GenerationRequest plain(String secretText, int totalCount, int threshold) {
        return new GenerationRequest(secretText, totalCount, threshold, null, true);
    }

    public boolean encrypt() {
        return password != null && !password.isBlank();
    }

    @Override
    public String toString() {
        return "GenerationRequest[totalCount=" + totalCount
                + ", threshold=" + threshold
                + ", encrypt=" + encrypt()
                + ", armored=" + armored + "]";
    }
}
