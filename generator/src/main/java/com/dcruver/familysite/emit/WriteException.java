package com.dcruver.familysite.emit;

import com.dcruver.familysite.GenealogyException;
import lombok.Getter;

/**
 * The output location cannot hold the documents of this run.
 */
@Getter
public class WriteException extends GenealogyException {

    private final String path;

    public WriteException(String path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public WriteException(String path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }
}
