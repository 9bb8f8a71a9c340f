package com.patientregistry.store;

import com.patientregistry.model.patient.Patient;

import java.util.List;
import java.util.Optional;

/**
 * Ordered key-value store holding every patient by id.
 * <p>
 * Values are immutable; updating a patient means inserting a new value under the
 * same key. Implementations are not required to be thread-safe: all calls reach
 * the store through {@link com.patientregistry.service.CallDispatcher}.
 */
public interface PatientStore {

    /**
     * Insert or overwrite the value at {@code key}.
     *
     * @return the value previously stored under the key, if any
     */
    Optional<Patient> insert(String key, Patient value);

    Optional<Patient> get(String key);

    /**
     * Remove the key.
     *
     * @return the removed value, or empty if the key was not present
     */
    Optional<Patient> remove(String key);

    /**
     * All stored values in key order.
     */
    List<Patient> values();

    boolean containsKey(String key);

    int size();
}
