package com.dcruver.familysite.emit;

import com.dcruver.familysite.config.SiteProperties;
import com.dcruver.familysite.graph.Individual;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders the listing pages next to the profiles.
 */
@Component
@RequiredArgsConstructor
public class IndexRenderer {

    static final String INDEX_FILE = "index.md";
    static final String BIOS_FILE = "bios.md";

    private static final Comparator<Individual> BY_NAME = Comparator
        .comparing(Individual::getDisplayName, String.CASE_INSENSITIVE_ORDER)
        .thenComparing(Individual::getDisplayName)
        .thenComparing(Individual::getId);

    private final SiteProperties properties;
    private final FrontmatterWriter frontmatterWriter;

    /**
     * All profiles, sorted by display name then id
     */
    public SiteDocument renderIndex(Collection<Individual> individuals) {
        StringBuilder sb = new StringBuilder();
        sb.append(frontmatterWriter.write(fields("All People")));
        sb.append('\n');
        sb.append("# All People\n\n");
        if (individuals.isEmpty()) {
            sb.append("*No profiles.*\n");
        }
        for (Individual individual : sorted(individuals)) {
            sb.append("- ").append(DocumentNaming.wikiLink(individual.getId(), individual.getDisplayName())).append('\n');
        }
        return new SiteDocument(indexPath(), sb.toString());
    }

    /**
     * Profiles that received a biography in this run
     */
    public SiteDocument renderBiographies(Collection<Individual> individuals, Set<String> withBiography) {
        List<Individual> listed = sorted(individuals).stream()
            .filter(individual -> withBiography.contains(individual.getId()))
            .toList();

        StringBuilder sb = new StringBuilder();
        sb.append(frontmatterWriter.write(fields("Profiles with Biographies")));
        sb.append('\n');
        sb.append("# Profiles with Biographies\n\n");
        sb.append("This page lists all family members who have biographical information.\n\n");
        if (listed.isEmpty()) {
            sb.append("*No biographical information available yet.*\n");
        }
        for (Individual individual : listed) {
            sb.append("- ").append(DocumentNaming.wikiLink(individual.getId(), individual.getDisplayName())).append('\n');
        }
        return new SiteDocument(biosPath(), sb.toString());
    }

    public String indexPath() {
        return properties.getPeopleDir() + "/" + INDEX_FILE;
    }

    public String biosPath() {
        return properties.getPeopleDir() + "/" + BIOS_FILE;
    }

    private static List<Individual> sorted(Collection<Individual> individuals) {
        return individuals.stream().sorted(BY_NAME).toList();
    }

    private static Map<String, Object> fields(String title) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("title", title);
        fields.put("type", "index");
        return fields;
    }
}
