package com.patientregistry.service;

import com.patientregistry.common.Result;
import com.patientregistry.model.enums.PatientOperation;
import com.patientregistry.model.patient.Patient;
import com.patientregistry.model.patient.PatientPayload;
import com.patientregistry.service.id.PatientIdGenerator;
import com.patientregistry.store.PatientStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Patient Service
 *
 * Provides the patient operations on top of the patient store:
 * - add / update / delete with input validation
 * - admission state changes (admit, discharge)
 * - lookup, listing and name search
 *
 * Every operation returns a {@link Result}; failures never escape as exceptions.
 */
@Slf4j
@Service
public class PatientService {

    static final String MISSING_FIELDS = "Missing required fields in the patient object";

    private final PatientStore patientStore;
    private final PatientIdGenerator idGenerator;
    private final Clock clock;
    private final CallDispatcher dispatcher;

    public PatientService(
            PatientStore patientStore,
            PatientIdGenerator idGenerator,
            Clock clock,
            CallDispatcher dispatcher) {
        this.patientStore = patientStore;
        this.idGenerator = idGenerator;
        this.clock = clock;
        this.dispatcher = dispatcher;
    }

    // ========================================================================
    // CRUD Operations
    // ========================================================================

    /**
     * Create a patient with a generated id, not admitted and without timestamps.
     */
    public Result<Patient> addPatient(PatientPayload payload) {
        return dispatcher.dispatch(PatientOperation.ADD_PATIENT, () -> {
            if (!hasRequiredFields(payload)) {
                return Result.validation(MISSING_FIELDS);
            }

            try {
                Patient patient = Patient.builder()
                    .id(idGenerator.newId())
                    .name(payload.getName())
                    .age(payload.getAge())
                    .gender(payload.getGender())
                    .admitted(false)
                    .medicalRecords(payload.getMedicalRecords() != null ? payload.getMedicalRecords() : List.of())
                    .build();

                patientStore.insert(patient.getId(), patient);
                log.info("Added patient {}", patient.getId());
                return Result.ok(patient);
            } catch (RuntimeException e) {
                log.error("Failed to add patient", e);
                return Result.internal("Error adding patient: " + e.getMessage());
            }
        });
    }

    /**
     * All patients in store order.
     */
    public Result<List<Patient>> getPatients() {
        return dispatcher.dispatch(PatientOperation.GET_PATIENTS, () -> {
            try {
                return Result.ok(patientStore.values());
            } catch (RuntimeException e) {
                log.error("Failed to list patients", e);
                return Result.internal("Error getting patients: " + e.getMessage());
            }
        });
    }

    public Result<Patient> getPatient(String id) {
        return dispatcher.dispatch(PatientOperation.GET_PATIENT, () -> {
            if (!StringUtils.hasLength(id)) {
                return Result.validation("Invalid ID for getting a patient.");
            }

            try {
                return patientStore.get(id)
                    .map(Result::ok)
                    .orElseGet(() -> Result.notFound("Patient with id=" + id + " not found"));
            } catch (RuntimeException e) {
                log.error("Failed to retrieve patient {}", id, e);
                return Result.internal("Error retrieving patient by ID: " + e.getMessage());
            }
        });
    }

    /**
     * Merge the payload over an existing patient.
     * Id, admission state and timestamps are kept; the record list is replaced
     * only when the payload carries one.
     */
    public Result<Patient> updatePatient(String id, PatientPayload payload) {
        return dispatcher.dispatch(PatientOperation.UPDATE_PATIENT, () -> {
            if (!StringUtils.hasLength(id)) {
                return Result.validation("Invalid ID for updating a patient.");
            }
            if (!hasRequiredFields(payload)) {
                return Result.validation(MISSING_FIELDS);
            }

            try {
                Optional<Patient> existing = patientStore.get(id);
                if (existing.isEmpty()) {
                    return Result.notFound("Patient with id=" + id + " does not exist");
                }

                Patient.PatientBuilder builder = existing.get().toBuilder()
                    .name(payload.getName())
                    .age(payload.getAge())
                    .gender(payload.getGender());
                if (payload.getMedicalRecords() != null) {
                    builder.clearMedicalRecords().medicalRecords(payload.getMedicalRecords());
                }
                Patient updated = builder.build();

                patientStore.insert(id, updated);
                log.info("Updated patient {}", id);
                return Result.ok(updated);
            } catch (RuntimeException e) {
                log.error("Failed to update patient {}", id, e);
                return Result.internal("Error updating patient: " + e.getMessage());
            }
        });
    }

    /**
     * Remove a patient. The id must have the UUID shape; other operations accept any non-empty id.
     */
    public Result<Patient> deletePatient(String id) {
        return dispatcher.dispatch(PatientOperation.DELETE_PATIENT, () -> {
            try {
                if (!PatientIdGenerator.isValidUuid(id)) {
                    return Result.validation("Invalid patient ID");
                }

                Optional<Patient> removed = patientStore.remove(id);
                if (removed.isEmpty()) {
                    return Result.notFound("Patient with ID " + id + " does not exist");
                }

                log.info("Deleted patient {}", id);
                return Result.ok(removed.get());
            } catch (RuntimeException e) {
                log.error("Failed to delete patient {}", id, e);
                return Result.internal("Error deleting patient: " + e.getMessage());
            }
        });
    }

    /**
     * Patients whose name contains the query, ignoring case. A null query matches everyone.
     */
    public Result<List<Patient>> searchPatients(String query) {
        return dispatcher.dispatch(PatientOperation.SEARCH_PATIENTS, () -> {
            try {
                String needle = query == null ? "" : query.toLowerCase(Locale.ROOT);
                List<Patient> matches = patientStore.values().stream()
                    .filter(patient -> patient.getName() != null
                        && patient.getName().toLowerCase(Locale.ROOT).contains(needle))
                    .collect(Collectors.toList());
                return Result.ok(matches);
            } catch (RuntimeException e) {
                log.error("Failed to search patients", e);
                return Result.internal("Error searching for patients: " + e.getMessage());
            }
        });
    }

    // ========================================================================
    // Admission
    // ========================================================================

    public Result<Patient> admitPatient(String id) {
        return dispatcher.dispatch(PatientOperation.ADMIT_PATIENT, () -> {
            if (!StringUtils.hasLength(id)) {
                return Result.validation("Invalid ID for admitting a patient.");
            }

            try {
                Optional<Patient> existing = patientStore.get(id);
                if (existing.isEmpty()) {
                    return Result.notFound("Patient with id=" + id + " not found");
                }
                if (existing.get().isAdmitted()) {
                    log.warn("Rejected admission of patient {}: already admitted", id);
                    return Result.conflict("Patient with id=" + id + " is already admitted");
                }

                Patient admitted = existing.get().toBuilder()
                    .admitted(true)
                    .admittedAt(now())
                    .build();
                patientStore.insert(id, admitted);
                log.info("Admitted patient {}", id);
                return Result.ok(admitted);
            } catch (RuntimeException e) {
                log.error("Failed to admit patient {}", id, e);
                return Result.internal("Error admitting patient: " + e.getMessage());
            }
        });
    }

    public Result<Patient> dischargePatient(String id) {
        return dispatcher.dispatch(PatientOperation.DISCHARGE_PATIENT, () -> {
            if (!StringUtils.hasLength(id)) {
                return Result.validation("Invalid ID for discharging a patient.");
            }

            try {
                Optional<Patient> existing = patientStore.get(id);
                if (existing.isEmpty()) {
                    return Result.notFound("Patient with id=" + id + " not found");
                }
                if (!existing.get().isAdmitted()) {
                    log.warn("Rejected discharge of patient {}: not admitted", id);
                    return Result.conflict("Patient with id=" + id + " is not currently admitted");
                }

                Patient discharged = existing.get().toBuilder()
                    .admitted(false)
                    .dischargedAt(now())
                    .build();
                patientStore.insert(id, discharged);
                log.info("Discharged patient {}", id);
                return Result.ok(discharged);
            } catch (RuntimeException e) {
                log.error("Failed to discharge patient {}", id, e);
                return Result.internal("Error discharging patient: " + e.getMessage());
            }
        });
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private Instant now() {
        return Instant.now(clock);
    }

    private static boolean hasRequiredFields(PatientPayload payload) {
        return payload != null
            && StringUtils.hasLength(payload.getName())
            && payload.getAge() != null
            && payload.getAge() != 0
            && StringUtils.hasLength(payload.getGender())
            && (payload.getMedicalRecords() == null
                || payload.getMedicalRecords().stream().noneMatch(Objects::isNull));
    }
}
