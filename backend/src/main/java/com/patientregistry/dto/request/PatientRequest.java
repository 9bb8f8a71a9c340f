package com.patientregistry.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request DTO for adding or updating a patient.
 * Required fields are checked by the service so that the error message stays
 * the same whichever way the registry is called.
 */
public record PatientRequest(
    String name,
    Integer age,
    String gender,

    // Omitted on update: existing records are kept
    List<@NotNull(message = "Medical record must not be null") @Valid MedicalRecordRequest> medicalRecords
) {}
