package com.patientregistry.model.patient;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One clinical entry embedded in a patient's record list.
 * The id is supplied by the caller and is expected, not enforced, to be unique per patient.
 */
@Value
@Builder(toBuilder = true)
public class MedicalRecord {

    String id;

    /**
     * Id of the owning patient as supplied by the caller. Advisory only.
     */
    String patientId;

    String diagnosis;

    String treatment;

    Instant date;
}
