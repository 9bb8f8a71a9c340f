package com.patientregistry.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Patient as returned by the API. Absent admission timestamps are omitted.
 */
public record PatientDto(
    String id,
    String name,
    int age,
    String gender,
    @JsonProperty("isAdmitted")
    boolean admitted,

    @JsonInclude(JsonInclude.Include.NON_NULL)
    Instant admittedAt,

    @JsonInclude(JsonInclude.Include.NON_NULL)
    Instant dischargedAt,

    List<MedicalRecordDto> medicalRecords
) {}
