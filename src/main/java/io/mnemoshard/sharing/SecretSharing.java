package io.mnemoshard.sharing;

import java.util.Map;

/**
 * Threshold secret sharing primitive. Shares are keyed by their 1-based index.
 */
public interface SecretSharing {
    Map<Integer, byte[]> split(byte[] secret, int totalCount, int threshold);

    byte[] combine(Map<Integer, byte[]> shares);
}
