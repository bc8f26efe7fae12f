package com.dcruver.familysite.bio;

import com.dcruver.familysite.GenealogyException;
import lombok.Getter;

import java.nio.file.Path;
import java.util.List;

/**
 * More than one biography could belong to an individual and neither is id-keyed.
 */
@Getter
public class AmbiguousBiographyMatchException extends GenealogyException {

    private final String individualId;
    private final List<Path> candidates;

    public AmbiguousBiographyMatchException(String individualId, String reason, List<Path> candidates) {
        super(String.format("Ambiguous biography for %s: %s %s", individualId, reason, candidates));
        this.individualId = individualId;
        this.candidates = List.copyOf(candidates);
    }
}
