package com.dcruver.familysite;

/**
 * Base type for every failure raised while turning a GEDCOM file into site documents.
 */
public class GenealogyException extends RuntimeException {

    public GenealogyException(String message) {
        super(message);
    }

    public GenealogyException(String message, Throwable cause) {
        super(message, cause);
    }
}
