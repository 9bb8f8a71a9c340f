package com.patientregistry.controller;

import com.patientregistry.common.ErrorKind;
import com.patientregistry.common.Result;
import com.patientregistry.dto.mapper.PatientMapper;
import com.patientregistry.dto.request.MedicalRecordRequest;
import com.patientregistry.dto.request.PatientRequest;
import com.patientregistry.dto.response.OperationDto;
import com.patientregistry.model.enums.OperationKind;
import com.patientregistry.model.enums.PatientOperation;
import com.patientregistry.service.MedicalRecordService;
import com.patientregistry.service.PatientService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * REST controller for patients and their medical records.
 * Each endpoint maps to one registry operation; failed operations are returned
 * as {"error": message} with a status derived from the error kind.
 */
@Slf4j
@RestController
@RequestMapping("/api/patients")
public class PatientController {

    private final PatientService patientService;
    private final MedicalRecordService medicalRecordService;
    private final PatientMapper patientMapper;

    public PatientController(
            PatientService patientService,
            MedicalRecordService medicalRecordService,
            PatientMapper patientMapper) {
        this.patientService = patientService;
        this.medicalRecordService = medicalRecordService;
        this.patientMapper = patientMapper;
    }

    // ========================================================================
    // Read Operations
    // ========================================================================

    /**
     * Get all patients, or the ones whose name contains the search term.
     */
    @GetMapping
    public ResponseEntity<?> getPatients(@RequestParam(required = false) String search) {
        if (search != null) {
            return respond(patientService.searchPatients(search), HttpStatus.OK, patientMapper::toDtoList);
        }
        return respond(patientService.getPatients(), HttpStatus.OK, patientMapper::toDtoList);
    }

    /**
     * Search patients by name (case-insensitive substring).
     */
    @GetMapping("/search")
    public ResponseEntity<?> searchPatients(@RequestParam(required = false, defaultValue = "") String query) {
        return respond(patientService.searchPatients(query), HttpStatus.OK, patientMapper::toDtoList);
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getPatient(@PathVariable String id) {
        return respond(patientService.getPatient(id), HttpStatus.OK, patientMapper::toDto);
    }

    /**
     * List the registry operations, optionally only queries or only updates.
     */
    @GetMapping("/operations")
    public ResponseEntity<List<OperationDto>> getOperations(@RequestParam(required = false) String kind) {
        OperationKind filter = OperationKind.fromValue(kind);
        List<OperationDto> operations = Arrays.stream(PatientOperation.values())
            .filter(op -> filter == null || op.getKind() == filter)
            .map(patientMapper::toOperationDto)
            .toList();
        return ResponseEntity.ok(operations);
    }

    // ========================================================================
    // Patient Mutations
    // ========================================================================

    @PostMapping
    public ResponseEntity<?> addPatient(@Valid @RequestBody PatientRequest request) {
        return respond(patientService.addPatient(patientMapper.toPayload(request)),
            HttpStatus.CREATED, patientMapper::toDto);
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> updatePatient(
            @PathVariable String id,
            @Valid @RequestBody PatientRequest request) {
        return respond(patientService.updatePatient(id, patientMapper.toPayload(request)),
            HttpStatus.OK, patientMapper::toDto);
    }

    @PostMapping("/{id}/admit")
    public ResponseEntity<?> admitPatient(@PathVariable String id) {
        return respond(patientService.admitPatient(id), HttpStatus.OK, patientMapper::toDto);
    }

    @PostMapping("/{id}/discharge")
    public ResponseEntity<?> dischargePatient(@PathVariable String id) {
        return respond(patientService.dischargePatient(id), HttpStatus.OK, patientMapper::toDto);
    }

    /**
     * Delete a patient and return the removed value.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<?> deletePatient(@PathVariable String id) {
        return respond(patientService.deletePatient(id), HttpStatus.OK, patientMapper::toDto);
    }

    // ========================================================================
    // Medical Records
    // ========================================================================

    @GetMapping("/{id}/medical-records")
    public ResponseEntity<?> getMedicalRecords(@PathVariable String id) {
        return respond(medicalRecordService.getMedicalRecords(id), HttpStatus.OK, patientMapper::toRecordDtoList);
    }

    @PostMapping("/{id}/medical-records")
    public ResponseEntity<?> addMedicalRecord(
            @PathVariable String id,
            @Valid @RequestBody MedicalRecordRequest request) {
        return respond(medicalRecordService.addMedicalRecord(id, patientMapper.toMedicalRecord(request)),
            HttpStatus.CREATED, patientMapper::toDto);
    }

    @PutMapping("/{id}/medical-records/{recordId}")
    public ResponseEntity<?> updateMedicalRecord(
            @PathVariable String id,
            @PathVariable String recordId,
            @Valid @RequestBody MedicalRecordRequest request) {
        return respond(
            medicalRecordService.updateMedicalRecord(id, recordId, patientMapper.toMedicalRecord(request)),
            HttpStatus.OK, patientMapper::toDto);
    }

    @DeleteMapping("/{id}/medical-records/{recordId}")
    public ResponseEntity<?> deleteMedicalRecord(
            @PathVariable String id,
            @PathVariable String recordId) {
        return respond(medicalRecordService.deleteMedicalRecord(id, recordId), HttpStatus.OK, patientMapper::toDto);
    }

    // ========================================================================
    // Result Mapping
    // ========================================================================

    private <T> ResponseEntity<Object> respond(Result<T> result, HttpStatus successStatus,
                                               Function<? super T, ?> toBody) {
        return result.<ResponseEntity<Object>>fold(
            value -> ResponseEntity.status(successStatus).body(toBody.apply(value)),
            err -> ResponseEntity.status(statusOf(err.kind())).body(Map.of("error", err.message()))
        );
    }

    private static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    // ========================================================================
    // Exception Handling
    // ========================================================================

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Rejected unreadable request body: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "Malformed request body"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleInvalid(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(FieldError::getDefaultMessage)
            .orElse("Invalid request");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", message));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", ex.getMessage()));
    }
}
