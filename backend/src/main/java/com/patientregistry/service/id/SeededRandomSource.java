package com.patientregistry.service.id;

import java.util.Random;

/**
 * Deterministic random source: the same seed always yields the same byte sequence.
 * Meant for reproducible runs and tests, never for production ids.
 */
public class SeededRandomSource implements RandomSource {

    private final Random random;

    public SeededRandomSource(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public void nextBytes(byte[] bytes) {
        random.nextBytes(bytes);
    }
}
