package com.patientregistry.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * Request DTO for a medical record, used on its own and nested in {@link PatientRequest}.
 */
public record MedicalRecordRequest(
    @NotBlank(message = "Medical record id is required")
    String id,

    String patientId,

    @NotBlank(message = "Diagnosis is required")
    String diagnosis,

    @NotBlank(message = "Treatment is required")
    String treatment,

    @NotNull(message = "Medical record date is required")
    Instant date
) {}
