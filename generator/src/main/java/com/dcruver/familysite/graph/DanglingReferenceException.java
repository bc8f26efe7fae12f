package com.dcruver.familysite.graph;

import com.dcruver.familysite.GenealogyException;
import lombok.Getter;

/**
 * A pointer that names no record of the expected kind.
 */
@Getter
public class DanglingReferenceException extends GenealogyException {

    private final String reference;
    private final String referrer;

    public DanglingReferenceException(String reference, String referrer, String expectedKind) {
        super(String.format("%s references %s %s, which does not exist", referrer, expectedKind, reference));
        this.reference = reference;
        this.referrer = referrer;
    }
}
