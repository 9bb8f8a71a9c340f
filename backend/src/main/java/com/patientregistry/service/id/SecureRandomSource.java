package com.patientregistry.service.id;

import lombok.extern.slf4j.Slf4j;

import java.security.NoSuchAlgorithmException;
import java.security.ProviderException;
import java.security.SecureRandom;
import java.util.Random;

/**
 * Random source backed by {@link SecureRandom}.
 * <p>
 * If the requested algorithm is not available, or the provider fails while
 * generating, the source switches to a pseudo-random generator and keeps going.
 */
@Slf4j
public class SecureRandomSource implements RandomSource {

    private final SecureRandom secureRandom;
    private final Random fallback = new Random();
    private volatile boolean degraded;

    SecureRandomSource(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
        this.degraded = secureRandom == null;
    }

    /**
     * Create a source for the platform default secure algorithm.
     */
    public static SecureRandomSource create() {
        return new SecureRandomSource(new SecureRandom());
    }

    /**
     * Create a source for the named algorithm, e.g. "NativePRNG" or "DRBG".
     * A blank name selects the platform default.
     */
    public static SecureRandomSource create(String algorithm) {
        if (algorithm == null || algorithm.isBlank()) {
            return create();
        }
        try {
            return new SecureRandomSource(SecureRandom.getInstance(algorithm));
        } catch (NoSuchAlgorithmException e) {
            log.warn("SecureRandom algorithm {} unavailable, falling back to pseudo-random ids", algorithm);
            return new SecureRandomSource(null);
        }
    }

    @Override
    public void nextBytes(byte[] bytes) {
        if (!degraded) {
            try {
                secureRandom.nextBytes(bytes);
                return;
            } catch (ProviderException e) {
                log.warn("SecureRandom provider failed, falling back to pseudo-random ids", e);
                degraded = true;
            }
        }
        fallback.nextBytes(bytes);
    }

    public boolean isDegraded() {
        return degraded;
    }
}
