package com.patientregistry.model.patient;

import lombok.Builder;
import lombok.Value;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Caller-supplied patient attributes for add and update.
 * A null record list on update means "keep the existing records".
 */
@Value
@Builder
public class PatientPayload {

    String name;

    Integer age;

    String gender;

    @Nullable
    List<MedicalRecord> medicalRecords;
}
