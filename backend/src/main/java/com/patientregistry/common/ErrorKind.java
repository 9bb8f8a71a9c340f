package com.patientregistry.common;

/**
 * Category of a failed operation.
 * The message carried by {@link Result.Err} is the user-facing contract;
 * the kind only decides how the failure is reported (HTTP status, log level).
 */
public enum ErrorKind {
    /** Malformed or missing input, detected before the store is touched. */
    VALIDATION,
    /** Referenced patient or medical record is absent. */
    NOT_FOUND,
    /** Precondition on the current state is violated. */
    CONFLICT,
    /** Unexpected failure while reading or writing the store. */
    INTERNAL
}
