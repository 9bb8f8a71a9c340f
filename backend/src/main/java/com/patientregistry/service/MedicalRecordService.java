package com.patientregistry.service;

import com.patientregistry.common.Result;
import com.patientregistry.model.enums.PatientOperation;
import com.patientregistry.model.patient.MedicalRecord;
import com.patientregistry.model.patient.Patient;
import com.patientregistry.store.PatientStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Operations on the medical records embedded in a patient.
 * <p>
 * Records are not stored on their own: each change re-reads the patient, builds a
 * new record list and writes the whole patient back under its id. Records are
 * addressed by the first one in list order with a matching id.
 */
@Slf4j
@Service
public class MedicalRecordService {

    private final PatientStore patientStore;
    private final CallDispatcher dispatcher;

    public MedicalRecordService(PatientStore patientStore, CallDispatcher dispatcher) {
        this.patientStore = patientStore;
        this.dispatcher = dispatcher;
    }

    /**
     * Append a record to the patient's list.
     */
    public Result<Patient> addMedicalRecord(String patientId, MedicalRecord record) {
        return dispatcher.dispatch(PatientOperation.ADD_MEDICAL_RECORD, () -> {
            if (!StringUtils.hasLength(patientId)) {
                return Result.validation("Invalid patient ID for adding a medical record.");
            }

            try {
                Optional<Patient> existing = patientStore.get(patientId);
                if (existing.isEmpty()) {
                    return Result.notFound(patientDoesNotExist(patientId));
                }
                warnOnForeignPatientId(patientId, record);

                List<MedicalRecord> records = new ArrayList<>(existing.get().getMedicalRecords());
                records.add(record);
                Patient updated = existing.get().withMedicalRecords(records);

                patientStore.insert(patientId, updated);
                log.info("Added medical record {} to patient {}", record.getId(), patientId);
                return Result.ok(updated);
            } catch (RuntimeException e) {
                log.error("Failed to add medical record to patient {}", patientId, e);
                return Result.internal("Error adding medical record: " + e.getMessage());
            }
        });
    }

    /**
     * Replace the first record with {@code recordId}, keeping its position.
     */
    public Result<Patient> updateMedicalRecord(String patientId, String recordId, MedicalRecord record) {
        return dispatcher.dispatch(PatientOperation.UPDATE_MEDICAL_RECORD, () -> {
            if (!StringUtils.hasLength(patientId) || !StringUtils.hasLength(recordId)) {
                return Result.validation("Invalid patient or medical record ID for updating a medical record.");
            }

            try {
                Optional<Patient> existing = patientStore.get(patientId);
                if (existing.isEmpty()) {
                    return Result.notFound(patientDoesNotExist(patientId));
                }

                int index = existing.get().indexOfMedicalRecord(recordId);
                if (index < 0) {
                    return Result.notFound(recordNotFound(patientId, recordId));
                }
                warnOnForeignPatientId(patientId, record);

                List<MedicalRecord> records = new ArrayList<>(existing.get().getMedicalRecords());
                records.set(index, record);
                Patient updated = existing.get().withMedicalRecords(records);

                patientStore.insert(patientId, updated);
                log.info("Updated medical record {} of patient {}", recordId, patientId);
                return Result.ok(updated);
            } catch (RuntimeException e) {
                log.error("Failed to update medical record {} of patient {}", recordId, patientId, e);
                return Result.internal("Error updating medical record: " + e.getMessage());
            }
        });
    }

    /**
     * Remove the first record with {@code recordId}.
     */
    public Result<Patient> deleteMedicalRecord(String patientId, String recordId) {
        return dispatcher.dispatch(PatientOperation.DELETE_MEDICAL_RECORD, () -> {
            if (!StringUtils.hasLength(patientId) || !StringUtils.hasLength(recordId)) {
                return Result.validation("Invalid patient or medical record ID for deleting a medical record.");
            }

            try {
                Optional<Patient> existing = patientStore.get(patientId);
                if (existing.isEmpty()) {
                    return Result.notFound(patientDoesNotExist(patientId));
                }

                int index = existing.get().indexOfMedicalRecord(recordId);
                if (index < 0) {
                    return Result.notFound(recordNotFound(patientId, recordId));
                }

                List<MedicalRecord> records = new ArrayList<>(existing.get().getMedicalRecords());
                records.remove(index);
                Patient updated = existing.get().withMedicalRecords(records);

                patientStore.insert(patientId, updated);
                log.info("Deleted medical record {} of patient {}", recordId, patientId);
                return Result.ok(updated);
            } catch (RuntimeException e) {
                log.error("Failed to delete medical record {} of patient {}", recordId, patientId, e);
                return Result.internal("Error deleting medical record: " + e.getMessage());
            }
        });
    }

    public Result<List<MedicalRecord>> getMedicalRecords(String patientId) {
        return dispatcher.dispatch(PatientOperation.GET_MEDICAL_RECORDS, () -> {
            if (!StringUtils.hasLength(patientId)) {
                return Result.validation("Invalid ID for getting medical records.");
            }

            try {
                return patientStore.get(patientId)
                    .map(patient -> Result.ok(patient.getMedicalRecords()))
                    .orElseGet(() -> Result.notFound("Patient with id=" + patientId + " not found"));
            } catch (RuntimeException e) {
                log.error("Failed to retrieve medical records of patient {}", patientId, e);
                return Result.internal("Error retrieving medical records by ID: " + e.getMessage());
            }
        });
    }

    private static String patientDoesNotExist(String patientId) {
        return "Patient with id=" + patientId + " does not exist";
    }

    private static String recordNotFound(String patientId, String recordId) {
        return "Medical record with id=" + recordId + " not found for patient with id=" + patientId;
    }

    /**
     * The record's patientId is advisory; a mismatch is logged, not rejected.
     */
    private static void warnOnForeignPatientId(String patientId, MedicalRecord record) {
        if (record.getPatientId() != null && !Objects.equals(record.getPatientId(), patientId)) {
            log.warn("Medical record {} names patient {} but is attached to patient {}",
                record.getId(), record.getPatientId(), patientId);
        }
    }
}
