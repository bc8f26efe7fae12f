package com.dcruver.familysite.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings for a generation run, bound from {@code site.*}.
 * Shell options override the path settings per command.
 */
@Data
@ConfigurationProperties(prefix = "site")
public class SiteProperties {

    private String gedcomPath = "data/tree.ged";
    private String outputDir = "site/content/profiles";

    /**
     * Optional; a missing directory means no biographies
     */
    private String biosDir;

    private boolean emitFamilies = false;
    private String peopleDir = "People";
    private String familiesDir = "Families";
    private List<String> bioExtensions = new ArrayList<>(List.of("md", "MD", "txt"));
    private int parallelism = 4;
    private boolean familyDiagram = true;

    private PlaceLinks placeLinks = new PlaceLinks();

    @Data
    public static class PlaceLinks {
        private boolean enabled = true;
        private String baseUrl = "https://en.wikipedia.org/wiki/";

        /**
         * Place text as written in the GEDCOM file -> article name
         */
        private Map<String, String> overrides = new LinkedHashMap<>();
    }
}
