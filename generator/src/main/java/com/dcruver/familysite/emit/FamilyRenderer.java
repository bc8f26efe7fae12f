package com.dcruver.familysite.emit;

import com.dcruver.familysite.config.SiteProperties;
import com.dcruver.familysite.graph.Event;
import com.dcruver.familysite.graph.EventKind;
import com.dcruver.familysite.graph.Family;
import com.dcruver.familysite.graph.FamilyGraph;
import com.dcruver.familysite.graph.Individual;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Renders the optional family documents, one per FAM record.
 */
@Component
@RequiredArgsConstructor
public class FamilyRenderer {

    private final SiteProperties properties;
    private final FrontmatterWriter frontmatterWriter;
    private final EventFormatter eventFormatter;

    public SiteDocument render(Family family, FamilyGraph graph) {
        String title = title(family, graph);

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("title", title);
        fields.put("type", "family");
        fields.put("id", family.getId());
        family.marriage().map(EventFormatter::fields).ifPresent(f -> fields.put("marriage", f));
        fields.put("tags", List.of("family"));

        StringBuilder sb = new StringBuilder();
        sb.append(frontmatterWriter.write(fields));
        sb.append('\n');
        sb.append("# ").append(title).append("\n\n");

        sb.append("- **Marriage**: ").append(eventFormatter.describe(family.marriage())).append('\n');
        for (Event event : family.getEvents()) {
            if (event.getKind() == EventKind.OTHER) {
                sb.append("- **").append(EventFormatter.label(event)).append("**: ")
                    .append(eventFormatter.describe(Optional.of(event))).append('\n');
            }
        }
        sb.append('\n');

        members(sb, "Spouses", family.getSpouseIds(), graph);
        members(sb, "Children", family.getChildIds(), graph);

        sb.append("---\n\n");
        sb.append("**GEDCOM ID**: ").append(family.getId()).append('\n');

        return new SiteDocument(path(family), sb.toString());
    }

    public String path(Family family) {
        return properties.getFamiliesDir() + "/" + DocumentNaming.fileName(family.getId());
    }

    /**
     * Link to a family document, labelled with the spouses' names
     */
    public static String link(Family family, FamilyGraph graph) {
        return DocumentNaming.wikiLink(family.getId(), title(family, graph));
    }

    static String title(Family family, FamilyGraph graph) {
        if (family.getSpouseIds().isEmpty()) {
            return family.getId();
        }
        return family.getSpouseIds().stream()
            .map(id -> graph.individual(id).getDisplayName())
            .collect(Collectors.joining(" & "));
    }

    private void members(StringBuilder sb, String title, List<String> ids, FamilyGraph graph) {
        sb.append("## ").append(title).append("\n\n");
        if (ids.isEmpty()) {
            sb.append(EventFormatter.NONE).append("\n\n");
            return;
        }
        for (String id : ids) {
            Individual member = graph.individual(id);
            sb.append("- ").append(DocumentNaming.wikiLink(member.getId(), member.getDisplayName())).append('\n');
        }
        sb.append('\n');
    }
}
