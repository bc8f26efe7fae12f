package com.dcruver.familysite.gedcom;

import lombok.Value;

/**
 * One tokenized physical line of a GEDCOM file.
 */
@Value
public class GedcomLine {
    int lineNumber;
    int level;
    String pointer;  // @I1@ on record lines, null otherwise
    String tag;
    String value;    // null when the line carries no value

    public boolean hasPointer() {
        return pointer != null;
    }
}
