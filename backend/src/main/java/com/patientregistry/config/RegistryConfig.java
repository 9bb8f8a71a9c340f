package com.patientregistry.config;

import com.patientregistry.service.id.PatientIdGenerator;
import com.patientregistry.service.id.RandomSource;
import com.patientregistry.service.id.SecureRandomSource;
import com.patientregistry.service.id.SeededRandomSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring for the collaborators the registry core relies on: clock, randomness and id generation.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RegistryProperties.class)
public class RegistryConfig {

    public RegistryConfig(RegistryProperties properties) {
        log.info("Patient registry using {} store", properties.store().type());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RandomSource randomSource(RegistryProperties properties) {
        RegistryProperties.Ids ids = properties.ids();
        if (ids.seed() != null) {
            log.warn("Using seeded random source (seed={}); patient ids are predictable", ids.seed());
            return new SeededRandomSource(ids.seed());
        }
        return SecureRandomSource.create(ids.algorithm());
    }

    @Bean
    public PatientIdGenerator patientIdGenerator(RandomSource randomSource) {
        return new PatientIdGenerator(randomSource);
    }
}
