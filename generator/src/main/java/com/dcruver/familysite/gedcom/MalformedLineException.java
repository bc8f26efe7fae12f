package com.dcruver.familysite.gedcom;

import com.dcruver.familysite.GenealogyException;
import lombok.Getter;

/**
 * A physical line that does not follow {@code <level> [@id@] <tag> [value]}.
 */
@Getter
public class MalformedLineException extends GenealogyException {

    private final int lineNumber;

    public MalformedLineException(int lineNumber, String message) {
        super("Line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public MalformedLineException(int lineNumber, String message, Throwable cause) {
        super("Line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }
}
