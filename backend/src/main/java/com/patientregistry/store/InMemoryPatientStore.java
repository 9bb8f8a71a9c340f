package com.patientregistry.store;

import com.patientregistry.model.patient.Patient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Patient store backed by a key-ordered {@link TreeMap}.
 * Used when registry.store.type=memory (default). Contents are lost on restart.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "registry.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryPatientStore implements PatientStore {

    private final TreeMap<String, Patient> patients = new TreeMap<>();

    public InMemoryPatientStore() {
        log.info("In-memory patient store initialized");
    }

    @Override
    public Optional<Patient> insert(String key, Patient value) {
        return Optional.ofNullable(patients.put(key, value));
    }

    @Override
    public Optional<Patient> get(String key) {
        return Optional.ofNullable(patients.get(key));
    }

    @Override
    public Optional<Patient> remove(String key) {
        return Optional.ofNullable(patients.remove(key));
    }

    @Override
    public List<Patient> values() {
        return List.copyOf(patients.values());
    }

    @Override
    public boolean containsKey(String key) {
        return patients.containsKey(key);
    }

    @Override
    public int size() {
        return patients.size();
    }
}
