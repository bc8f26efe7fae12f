package com.dcruver.familysite.graph;

import java.util.Locale;

public enum Sex {
    MALE,
    FEMALE,
    UNKNOWN;

    public static Sex fromGedcom(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT).charAt(0)) {
            case 'M' -> MALE;
            case 'F' -> FEMALE;
            default -> UNKNOWN;
        };
    }
}
