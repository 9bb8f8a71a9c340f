package com.patientregistry.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the patient registry.
 *
 * <pre>
 * registry:
 *   store:
 *     type: memory        # memory | jpa
 *   ids:
 *     seed:               # set for a deterministic id sequence
 *     algorithm:          # SecureRandom algorithm, blank for platform default
 * </pre>
 */
@ConfigurationProperties(prefix = "registry")
public record RegistryProperties(
        Store store,
        Ids ids
) {
    public RegistryProperties {
        if (store == null) {
            store = new Store(null);
        }
        if (ids == null) {
            ids = new Ids(null, null);
        }
    }

    public record Store(StoreType type) {
        public Store {
            if (type == null) {
                type = StoreType.MEMORY;
            }
        }
    }

    public record Ids(Long seed, String algorithm) {
    }

    public enum StoreType {
        MEMORY,
        JPA
    }
}
