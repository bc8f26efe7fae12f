package com.dcruver.familysite.graph;

/**
 * How precisely a date was recovered from its source text.
 */
public enum DateFidelity {
    /**
     * Day, month and year
     */
    EXACT,

    /**
     * Year, or month and year
     */
    YEAR_ONLY,

    /**
     * ABT, CAL, EST, BEF or AFT qualified
     */
    APPROXIMATE,

    /**
     * BET .. AND .. or FROM .. TO ..
     */
    RANGE,

    /**
     * Kept as opaque source text
     */
    UNPARSED
}
