package com.patientregistry.dto.mapper;

import com.patientregistry.dto.request.MedicalRecordRequest;
import com.patientregistry.dto.request.PatientRequest;
import com.patientregistry.dto.response.MedicalRecordDto;
import com.patientregistry.dto.response.OperationDto;
import com.patientregistry.dto.response.PatientDto;
import com.patientregistry.model.enums.PatientOperation;
import com.patientregistry.model.patient.MedicalRecord;
import com.patientregistry.model.patient.Patient;
import com.patientregistry.model.patient.PatientPayload;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Mapper for converting between patient values and DTOs.
 */
@Component
public class PatientMapper {

    // ========================================================================
    // Value -> DTO Conversions
    // ========================================================================

    public PatientDto toDto(Patient patient) {
        if (patient == null) {
            return null;
        }

        return new PatientDto(
            patient.getId(),
            patient.getName(),
            patient.getAge(),
            patient.getGender(),
            patient.isAdmitted(),
            patient.getAdmittedAt(),
            patient.getDischargedAt(),
            toRecordDtoList(patient.getMedicalRecords())
        );
    }

    public List<PatientDto> toDtoList(List<Patient> patients) {
        if (patients == null) {
            return Collections.emptyList();
        }
        return patients.stream()
            .map(this::toDto)
            .collect(Collectors.toList());
    }

    public MedicalRecordDto toRecordDto(MedicalRecord record) {
        if (record == null) {
            return null;
        }

        return new MedicalRecordDto(
            record.getId(),
            record.getPatientId(),
            record.getDiagnosis(),
            record.getTreatment(),
            record.getDate()
        );
    }

    public List<MedicalRecordDto> toRecordDtoList(List<MedicalRecord> records) {
        if (records == null) {
            return Collections.emptyList();
        }
        return records.stream()
            .map(this::toRecordDto)
            .collect(Collectors.toList());
    }

    public OperationDto toOperationDto(PatientOperation operation) {
        return new OperationDto(operation.getValue(), operation.getKind().getValue());
    }

    // ========================================================================
    // DTO -> Value Conversions
    // ========================================================================

    public PatientPayload toPayload(PatientRequest request) {
        if (request == null) {
            return null;
        }

        return PatientPayload.builder()
            .name(request.name())
            .age(request.age())
            .gender(request.gender())
            .medicalRecords(request.medicalRecords() != null ?
                request.medicalRecords().stream()
                    .map(this::toMedicalRecord)
                    .collect(Collectors.toList()) :
                null)
            .build();
    }

    public MedicalRecord toMedicalRecord(MedicalRecordRequest request) {
        if (request == null) {
            return null;
        }

        return MedicalRecord.builder()
            .id(request.id())
            .patientId(request.patientId())
            .diagnosis(request.diagnosis())
            .treatment(request.treatment())
            .date(request.date())
            .build();
    }
}
