package com.patientregistry.service.id;

import java.nio.ByteBuffer;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Generates patient ids as RFC 4122 version 4 UUID strings.
 */
public class PatientIdGenerator {

    private static final Pattern UUID_SHAPE =
        Pattern.compile("^[\\da-f]{8}-([\\da-f]{4}-){3}[\\da-f]{12}$", Pattern.CASE_INSENSITIVE);

    private final RandomSource randomSource;

    public PatientIdGenerator(RandomSource randomSource) {
        this.randomSource = randomSource;
    }

    public String newId() {
        byte[] bytes = new byte[16];
        randomSource.nextBytes(bytes);

        bytes[6] &= 0x0f;
        bytes[6] |= 0x40; // version 4
        bytes[8] &= 0x3f;
        bytes[8] |= (byte) 0x80; // IETF variant

        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        return new UUID(buffer.getLong(), buffer.getLong()).toString();
    }

    /**
     * True if {@code id} has the 8-4-4-4-12 hex shape of a UUID (any case, any version).
     */
    public static boolean isValidUuid(String id) {
        return id != null && UUID_SHAPE.matcher(id).matches();
    }
}
