package com.patientregistry.model.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persistent form of a patient.
 * Medical records live in an ordered element collection; the order column keeps
 * their insertion sequence across reloads.
 */
@Entity
@Table(name = "patient", indexes = {
    @Index(name = "idx_patient_name", columnList = "name")
})
@Getter
@Setter
@NoArgsConstructor
public class PatientEntity {

    @Id
    @Column(length = 255)
    private String id;

    @Column(nullable = false, length = 500)
    private String name;

    @Column(nullable = false)
    private int age;

    @Column(nullable = false, length = 50)
    private String gender;

    @Column(name = "is_admitted", nullable = false)
    private boolean admitted;

    @Column(name = "admitted_at")
    private Instant admittedAt;

    @Column(name = "discharged_at")
    private Instant dischargedAt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "patient_medical_record", joinColumns = @JoinColumn(name = "patient_id"))
    @OrderColumn(name = "record_order")
    private List<MedicalRecordEmbeddable> medicalRecords = new ArrayList<>();
}
