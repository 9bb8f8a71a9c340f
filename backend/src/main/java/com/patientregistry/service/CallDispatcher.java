package com.patientregistry.service;

import com.patientregistry.model.enums.PatientOperation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Runs registry operations one at a time against the patient store.
 * <p>
 * Update operations hold the write lock for their whole duration, so a
 * read-modify-write of a patient never interleaves with another call.
 * Query operations share the read lock.
 */
@Slf4j
@Component
public class CallDispatcher {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    public <T> T dispatch(PatientOperation operation, Supplier<T> call) {
        Lock held = operation.isQuery() ? lock.readLock() : lock.writeLock();
        held.lock();
        try {
            log.debug("Dispatching {} ({})", operation, operation.getKind());
            return call.get();
        } finally {
            held.unlock();
        }
    }
}
