package com.patientregistry.model.patient;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable patient value as held by the patient store.
 * <p>
 * Every change produces a new instance (usually via {@link #toBuilder()}) that is
 * written back under the same id. The record list built by Lombok is unmodifiable.
 */
@Value
@Builder(toBuilder = true)
public class Patient {

    String id;

    String name;

    int age;

    String gender;

    boolean admitted;

    @Nullable
    Instant admittedAt;

    @Nullable
    Instant dischargedAt;

    @Singular
    List<MedicalRecord> medicalRecords;

    public Optional<Instant> admittedAtIfPresent() {
        return Optional.ofNullable(admittedAt);
    }

    public Optional<Instant> dischargedAtIfPresent() {
        return Optional.ofNullable(dischargedAt);
    }

    /**
     * Copy of this patient with its record list replaced wholesale.
     */
    public Patient withMedicalRecords(List<MedicalRecord> records) {
        return toBuilder()
            .clearMedicalRecords()
            .medicalRecords(records)
            .build();
    }

    /**
     * Position of the first record with the given id, or -1.
     */
    public int indexOfMedicalRecord(String recordId) {
        for (int i = 0; i < medicalRecords.size(); i++) {
            MedicalRecord record = medicalRecords.get(i);
            if (record != null && recordId.equals(record.getId())) {
                return i;
            }
        }
        return -1;
    }
}
