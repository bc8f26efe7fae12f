package com.dcruver.familysite.graph;

import java.util.Set;

/**
 * Event categories the site distinguishes. Everything else is {@link #OTHER}
 * and keeps its source tag on the {@link Event}.
 */
public enum EventKind {
    BIRTH,
    DEATH,
    MARRIAGE,
    OTHER;

    /**
     * Individual-level tags read as events
     */
    public static final Set<String> INDIVIDUAL_TAGS = Set.of("BIRT", "DEAT", "BURI", "CHR", "BAPM", "RESI");

    /**
     * Family-level tags read as events
     */
    public static final Set<String> FAMILY_TAGS = Set.of("MARR", "DIV", "ENGA");

    public static EventKind fromTag(String tag) {
        return switch (tag) {
            case "BIRT" -> BIRTH;
            case "DEAT" -> DEATH;
            case "MARR" -> MARRIAGE;
            default -> OTHER;
        };
    }
}
