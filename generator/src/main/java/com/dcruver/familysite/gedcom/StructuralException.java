package com.dcruver.familysite.gedcom;

import com.dcruver.familysite.GenealogyException;
import lombok.Getter;

/**
 * Raised when well-formed lines do not nest into a legal record tree,
 * e.g. a level jump of more than one or a duplicated record id.
 */
@Getter
public class StructuralException extends GenealogyException {

    private final int lineNumber;

    public StructuralException(int lineNumber, String message) {
        super(lineNumber > 0 ? "Line " + lineNumber + ": " + message : message);
        this.lineNumber = lineNumber;
    }
}
