package com.dcruver.familysite.bio;

import com.dcruver.familysite.GenealogyException;
import lombok.Getter;

import java.nio.file.Path;

/**
 * A matched biography file that could not be read as UTF-8 text.
 */
@Getter
public class BiographyReadException extends GenealogyException {

    private final Path source;

    public BiographyReadException(Path source, Throwable cause) {
        super("Cannot read biography " + source + ": " + cause.getMessage(), cause);
        this.source = source;
    }
}
