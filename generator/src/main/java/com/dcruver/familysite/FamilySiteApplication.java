package com.dcruver.familysite;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the family site generator.
 *
 * Reads a GEDCOM genealogy file and writes cross-linked Markdown profiles
 * for the static site. Run interactively, or pass a command such as
 * {@code generate --gedcom tree.ged --output content} to run it once.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class FamilySiteApplication {

    public static void main(String[] args) {
        log.info("Starting family site generator...");
        SpringApplication.run(FamilySiteApplication.class, args);
    }
}
