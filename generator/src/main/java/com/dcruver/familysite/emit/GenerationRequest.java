package com.dcruver.familysite.emit;

import com.dcruver.familysite.config.SiteProperties;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Inputs of one generation run.
 */
@Value
@Builder(toBuilder = true)
public class GenerationRequest {
    Path gedcomPath;
    Path outputDir;
    Path biosDir;  // null for no biographies
    boolean emitFamilies;
    boolean dryRun;

    /**
     * Request built from the configured defaults
     */
    public static GenerationRequest from(SiteProperties properties) {
        return GenerationRequest.builder()
            .gedcomPath(Path.of(properties.getGedcomPath()))
            .outputDir(Path.of(properties.getOutputDir()))
            .biosDir(properties.getBiosDir() == null || properties.getBiosDir().isBlank()
                ? null : Path.of(properties.getBiosDir()))
            .emitFamilies(properties.isEmitFamilies())
            .build();
    }
}
