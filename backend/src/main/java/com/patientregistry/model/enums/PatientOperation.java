package com.patientregistry.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Catalogue of the operations the registry exposes, each declared as a query or an update.
 */
public enum PatientOperation {
    ADD_PATIENT("addPatient", OperationKind.UPDATE),
    GET_PATIENTS("getPatients", OperationKind.QUERY),
    GET_PATIENT("getPatient", OperationKind.QUERY),
    UPDATE_PATIENT("updatePatient", OperationKind.UPDATE),
    ADMIT_PATIENT("admitPatient", OperationKind.UPDATE),
    DISCHARGE_PATIENT("dischargePatient", OperationKind.UPDATE),
    DELETE_PATIENT("deletePatient", OperationKind.UPDATE),
    SEARCH_PATIENTS("searchPatients", OperationKind.QUERY),
    ADD_MEDICAL_RECORD("addMedicalRecord", OperationKind.UPDATE),
    UPDATE_MEDICAL_RECORD("updateMedicalRecord", OperationKind.UPDATE),
    DELETE_MEDICAL_RECORD("deleteMedicalRecord", OperationKind.UPDATE),
    GET_MEDICAL_RECORDS("getMedicalRecords", OperationKind.QUERY);

    private final String value;
    private final OperationKind kind;

    PatientOperation(String value, OperationKind kind) {
        this.value = value;
        this.kind = kind;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public OperationKind getKind() {
        return kind;
    }

    public boolean isQuery() {
        return kind == OperationKind.QUERY;
    }

    @Override
    public String toString() {
        return value;
    }
}
