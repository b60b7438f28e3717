package com.genflow.quality.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a review finding.
 */
public enum Severity {
    CRITICAL,
    MAJOR,
    MINOR;
    
    /**
     * Critical and major findings keep the review loop going.
     */
    public boolean isBlocking() {
        return switch (this) {
            case CRITICAL, MAJOR -> true;
            case MINOR -> false;
        };
    }
    
    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    /**
     * Unknown or missing severities are treated as minor.
     */
    @JsonCreator
    public static Severity fromWireValue(String value) {
        if (value == null) {
            return MINOR;
        }
        for (Severity severity : values()) {
            if (severity.name().equalsIgnoreCase(value.trim())) {
                return severity;
            }
        }
        return MINOR;
    }
}
