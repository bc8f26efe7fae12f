package com.dcruver.familysite.gedcom;

/**
 * Kinds of top-level GEDCOM records relevant to graph resolution.
 */
public enum RecordType {
    INDIVIDUAL,
    FAMILY,

    /**
     * Headers, sources, submitters, trailers and any other record
     */
    OTHER;

    public static RecordType fromTag(String tag) {
        if ("INDI".equals(tag)) {
            return INDIVIDUAL;
        } else if ("FAM".equals(tag)) {
            return FAMILY;
        }
        return OTHER;
    }
}
