package com.dcruver.familysite.gedcom;

import lombok.Value;

import java.util.List;

/**
 * Top-level records of a parsed GEDCOM file, in source order.
 */
@Value
public class RecordTree {
    List<RawRecord> roots;

    public List<RawRecord> recordsOfType(RecordType type) {
        return roots.stream()
            .filter(r -> r.getType() == type)
            .toList();
    }
}
