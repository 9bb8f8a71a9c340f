package com.patientregistry.repository;

import com.patientregistry.model.entity.PatientEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for persisted patients.
 */
@Repository
public interface PatientRepository extends JpaRepository<PatientEntity, String> {

    /**
     * All patients in key order, the iteration order of the patient store.
     */
    @Query("SELECT p FROM PatientEntity p ORDER BY p.id")
    List<PatientEntity> findAllOrderedById();
}
