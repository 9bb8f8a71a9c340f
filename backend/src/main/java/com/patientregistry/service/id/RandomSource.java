package com.patientregistry.service.id;

/**
 * Source of random bytes for identifier generation.
 */
public interface RandomSource {

    /**
     * Fill {@code bytes} with random values. Must not fail.
     */
    void nextBytes(byte[] bytes);
}
