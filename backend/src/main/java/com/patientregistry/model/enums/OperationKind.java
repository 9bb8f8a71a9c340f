package com.patientregistry.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether an operation only reads registry state or changes it.
 */
public enum OperationKind {
    QUERY("query"),
    UPDATE("update");

    private final String value;

    OperationKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }

    public static OperationKind fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (OperationKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown OperationKind: " + value);
    }
}
