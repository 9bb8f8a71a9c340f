package com.patientregistry.store;

import com.patientregistry.model.entity.MedicalRecordEmbeddable;
import com.patientregistry.model.entity.PatientEntity;
import com.patientregistry.model.patient.MedicalRecord;
import com.patientregistry.model.patient.Patient;
import com.patientregistry.repository.PatientRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Durable patient store on top of {@link PatientRepository}.
 * Used when registry.store.type=jpa.
 * <p>
 * Each method runs in its own transaction, so every store call is atomic and
 * committed before it returns.
 */
@Slf4j
@Component
@Transactional
@ConditionalOnProperty(name = "registry.store.type", havingValue = "jpa")
public class JpaPatientStore implements PatientStore {

    private final PatientRepository patientRepository;

    public JpaPatientStore(PatientRepository patientRepository) {
        this.patientRepository = patientRepository;
        log.info("JPA patient store initialized");
    }

    @Override
    public Optional<Patient> insert(String key, Patient value) {
        Optional<PatientEntity> existing = patientRepository.findById(key);
        Optional<Patient> previous = existing.map(this::toPatient);

        PatientEntity entity = existing.orElseGet(() -> {
            PatientEntity created = new PatientEntity();
            created.setId(key);
            return created;
        });
        applyValue(entity, value);
        patientRepository.save(entity);

        return previous;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Patient> get(String key) {
        return patientRepository.findById(key).map(this::toPatient);
    }

    @Override
    public Optional<Patient> remove(String key) {
        Optional<PatientEntity> existing = patientRepository.findById(key);
        existing.ifPresent(patientRepository::delete);
        return existing.map(this::toPatient);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Patient> values() {
        return patientRepository.findAllOrderedById().stream()
            .map(this::toPatient)
            .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public boolean containsKey(String key) {
        return patientRepository.existsById(key);
    }

    @Override
    @Transactional(readOnly = true)
    public int size() {
        return Math.toIntExact(patientRepository.count());
    }

    // ========================================================================
    // Entity <-> Value Conversions
    // ========================================================================

    private void applyValue(PatientEntity entity, Patient value) {
        entity.setName(value.getName());
        entity.setAge(value.getAge());
        entity.setGender(value.getGender());
        entity.setAdmitted(value.isAdmitted());
        entity.setAdmittedAt(value.getAdmittedAt());
        entity.setDischargedAt(value.getDischargedAt());

        // Replace contents rather than the list so Hibernate keeps tracking the collection
        entity.getMedicalRecords().clear();
        value.getMedicalRecords().stream()
            .map(this::toEmbeddable)
            .forEach(entity.getMedicalRecords()::add);
    }

    private Patient toPatient(PatientEntity entity) {
        return Patient.builder()
            .id(entity.getId())
            .name(entity.getName())
            .age(entity.getAge())
            .gender(entity.getGender())
            .admitted(entity.isAdmitted())
            .admittedAt(entity.getAdmittedAt())
            .dischargedAt(entity.getDischargedAt())
            .medicalRecords(entity.getMedicalRecords().stream()
                .map(this::toMedicalRecord)
                .collect(Collectors.toList()))
            .build();
    }

    private MedicalRecordEmbeddable toEmbeddable(MedicalRecord record) {
        return MedicalRecordEmbeddable.builder()
            .recordId(record.getId())
            .recordPatientId(record.getPatientId())
            .diagnosis(record.getDiagnosis())
            .treatment(record.getTreatment())
            .recordDate(record.getDate())
            .build();
    }

    private MedicalRecord toMedicalRecord(MedicalRecordEmbeddable embeddable) {
        return MedicalRecord.builder()
            .id(embeddable.getRecordId())
            .patientId(embeddable.getRecordPatientId())
            .diagnosis(embeddable.getDiagnosis())
            .treatment(embeddable.getTreatment())
            .date(embeddable.getRecordDate())
            .build();
    }
}
