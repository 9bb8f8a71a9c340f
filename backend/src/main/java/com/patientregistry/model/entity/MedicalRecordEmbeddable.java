package com.patientregistry.model.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Embeddable row of a patient's medical record collection.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MedicalRecordEmbeddable {

    @Column(name = "record_id", length = 255)
    private String recordId;

    /**
     * Patient id as supplied with the record; may differ from the owning row.
     */
    @Column(name = "record_patient_id", length = 255)
    private String recordPatientId;

    @Column(name = "diagnosis", columnDefinition = "TEXT")
    private String diagnosis;

    @Column(name = "treatment", columnDefinition = "TEXT")
    private String treatment;

    @Column(name = "record_date")
    private Instant recordDate;
}
