package com.congruence.core.model;

import com.congruence.core.error.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * What a mining trigger should produce.
 */
public enum MiningDataType {
    ASSIGNMENT_MATRIX,
    FILE_DEPENDENCY,
    FILES_OWNERSHIP,
    COORDINATION_MINIMAL;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the wire value ({@code assignment_matrix}, ...).
     *
     * @throws ValidationException for null or unknown values
     */
    public static MiningDataType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("dataType is required");
        }
        for (MiningDataType type : values()) {
            if (type.value().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new ValidationException("Unknown dataType '%s', expected one of %s".formatted(value,
                Arrays.stream(values()).map(MiningDataType::value).collect(Collectors.joining(", "))));
    }
}
