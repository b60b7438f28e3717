package com.genflow.quality.model;

import java.util.Locale;

/**
 * Letter grade of a quality score.
 */
public enum Grade {
    A,
    B,
    C,
    D,
    F;
    
    public static Grade forScore(int overall) {
        if (overall >= 90) {
            return A;
        }
        if (overall >= 80) {
            return B;
        }
        if (overall >= 70) {
            return C;
        }
        if (overall >= 60) {
            return D;
        }
        return F;
    }
    
    /**
     * Lenient parse of a backend-provided grade; null when it is not a known letter.
     */
    public static Grade parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
