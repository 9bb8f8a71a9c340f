package com.patientregistry.dto.response;

/**
 * One entry of the operation catalogue.
 */
public record OperationDto(
    String name,
    String kind
) {}
