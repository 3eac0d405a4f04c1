package io.mnemoshard.sharing;

import com.codahale.shamir.Scheme;

import java.security.SecureRandom;
import java.util.Map;

public final class ShamirSecretSharing implements SecretSharing {
    private final SecureRandom random;

    public ShamirSecretSharing() {
        this(new SecureRandom());
    }

    public ShamirSecretSharing(SecureRandom random) {
        this.random = random;
    }

    @Override
    public Map<Integer, byte[]> split(byte[] secret, int totalCount, int threshold) {
        Scheme scheme = new Scheme(random, totalCount, threshold);
        return scheme.split(secret);
    }

    @Override
    public byte[] combine(Map<Integer, byte[]> shares) {
        if (shares == null || shares.isEmpty()) {
            throw new IllegalArgumentException("No shares provided");
        }
        // join interpolates exactly the parts it is given; n and k only gate construction.
        int parts = Math.max(2, shares.size());
        Scheme scheme = new Scheme(random, parts, parts);
        return scheme.join(shares);
    }
}
