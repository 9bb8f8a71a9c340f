package com.patientregistry.dto.response;

import java.time.Instant;

/**
 * Medical record as returned by the API.
 */
public record MedicalRecordDto(
    String id,
    String patientId,
    String diagnosis,
    String treatment,
    Instant date
) {}
