package com.patientregistry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the patient registry backend.
 */
@SpringBootApplication
public class PatientRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(PatientRegistryApplication.class, args);
    }
}
