package com.dcruver.familysite.emit;

import com.dcruver.familysite.bio.BiographyRecord;
import com.dcruver.familysite.config.SiteProperties;
import com.dcruver.familysite.graph.EventKind;
import com.dcruver.familysite.graph.FamilyGraph;
import com.dcruver.familysite.graph.Individual;
import com.dcruver.familysite.graph.RelationshipView;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Renders the profile document of one individual.
 * <p>
 * The output is a pure function of the graph and the biography, so
 * regenerating an unchanged tree yields byte-identical files.
 */
@Component
@RequiredArgsConstructor
public class ProfileRenderer {

    static final String NO_BIOGRAPHY = "_No biography available._";

    private final SiteProperties properties;
    private final FrontmatterWriter frontmatterWriter;
    private final EventFormatter eventFormatter;
    private final FamilyDiagramRenderer diagramRenderer;

    /**
     * @param linkFamilies add a section linking the family documents of this run
     */
    public SiteDocument render(Individual individual, FamilyGraph graph, Optional<BiographyRecord> biography,
                               boolean linkFamilies) {
        RelationshipView relatives = graph.relationships(individual.getId());

        StringBuilder sb = new StringBuilder();
        sb.append(frontmatterWriter.write(frontmatter(individual)));
        sb.append('\n');
        sb.append("# ").append(individual.getDisplayName()).append("\n\n");

        sb.append("- **Birth**: ").append(eventFormatter.describe(individual.birth())).append('\n');
        sb.append("- **Death**: ").append(eventFormatter.describe(individual.death())).append('\n');
        individual.getEvents().stream()
            .filter(event -> event.getKind() == EventKind.OTHER)
            .forEach(event -> sb.append("- **").append(EventFormatter.label(event)).append("**: ")
                .append(eventFormatter.describe(Optional.of(event))).append('\n'));
        sb.append("- **Occupation**: ").append(individual.getOccupation() != null ? individual.getOccupation() : EventFormatter.NONE)
            .append("\n\n");

        if (properties.isFamilyDiagram()) {
            String diagram = diagramRenderer.render(individual, graph);
            if (!diagram.isEmpty()) {
                sb.append(diagram).append('\n');
            }
        }

        section(sb, "Parents", relatives.getParents());
        section(sb, "Spouses", relatives.getSpouses());
        section(sb, "Children", relatives.getChildren());
        section(sb, "Siblings", relatives.getSiblings());

        if (linkFamilies) {
            sb.append("## Families\n\n");
            if (individual.getFamiliesAsChild().isEmpty() && individual.getFamiliesAsSpouse().isEmpty()) {
                sb.append(EventFormatter.NONE).append("\n");
            }
            for (String familyId : individual.getFamiliesAsChild()) {
                sb.append("- ").append(FamilyRenderer.link(graph.family(familyId), graph)).append(" (as child)\n");
            }
            for (String familyId : individual.getFamiliesAsSpouse()) {
                sb.append("- ").append(FamilyRenderer.link(graph.family(familyId), graph)).append(" (as spouse)\n");
            }
            sb.append('\n');
        }

        if (!individual.getNotes().isEmpty()) {
            sb.append("## Notes\n\n");
            for (String note : individual.getNotes()) {
                sb.append(note.strip()).append("\n\n");
            }
        }

        sb.append("## Biography\n\n");
        sb.append(biography.map(BiographyRecord::getText).orElse(NO_BIOGRAPHY)).append("\n\n");

        sb.append("---\n\n");
        sb.append("**GEDCOM ID**: ").append(individual.getId()).append('\n');

        return new SiteDocument(path(individual), sb.toString());
    }

    public String path(Individual individual) {
        return properties.getPeopleDir() + "/" + DocumentNaming.fileName(individual.getId());
    }

    private Map<String, Object> frontmatter(Individual individual) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("title", individual.getDisplayName());
        fields.put("type", "profile");
        fields.put("id", individual.getId());
        fields.put("sex", individual.getSex().name().toLowerCase(Locale.ROOT));
        individual.birth().map(EventFormatter::fields).ifPresent(f -> fields.put("birth", f));
        individual.death().map(EventFormatter::fields).ifPresent(f -> fields.put("death", f));
        if (individual.getOccupation() != null) {
            fields.put("occupation", individual.getOccupation());
        }
        List<String> aliases = individual.getAliases();
        if (!aliases.isEmpty()) {
            fields.put("aliases", aliases);
        }
        fields.put("tags", List.of("person"));
        return fields;
    }

    private void section(StringBuilder sb, String title, List<Individual> members) {
        sb.append("## ").append(title).append("\n\n");
        if (members.isEmpty()) {
            sb.append(EventFormatter.NONE).append("\n\n");
            return;
        }
        for (Individual member : members) {
            sb.append("- ").append(DocumentNaming.wikiLink(member.getId(), member.getDisplayName())).append('\n');
        }
        sb.append('\n');
    }
}
