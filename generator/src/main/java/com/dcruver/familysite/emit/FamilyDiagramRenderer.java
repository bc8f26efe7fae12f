package com.dcruver.familysite.emit;

import com.dcruver.familysite.graph.Family;
import com.dcruver.familysite.graph.FamilyGraph;
import com.dcruver.familysite.graph.Individual;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Draws a person's immediate family as a Mermaid flowchart:
 * parents joined through a marriage node above, spouses and children below.
 */
@Component
public class FamilyDiagramRenderer {

    public String render(Individual subject, FamilyGraph graph) {
        if (subject.getFamiliesAsChild().isEmpty() && subject.getFamiliesAsSpouse().isEmpty()) {
            return "";
        }

        Diagram diagram = new Diagram();
        String self = diagram.node(subject);

        for (String familyId : subject.getFamiliesAsChild()) {
            Family family = graph.family(familyId);
            List<String> parents = new ArrayList<>();
            for (String parentId : family.getSpouseIds()) {
                parents.add(diagram.node(graph.individual(parentId)));
            }
            if (parents.size() == 2) {
                String union = diagram.union(family);
                diagram.edge(parents.get(0), "---", union);
                diagram.edge(parents.get(1), "---", union);
                diagram.edge(union, "-->", self);
            } else if (parents.size() == 1) {
                diagram.edge(parents.get(0), "-->", self);
            }
        }

        for (String familyId : subject.getFamiliesAsSpouse()) {
            Family family = graph.family(familyId);
            String spouse = family.getSpouseIds().stream()
                .filter(id -> !id.equals(subject.getId()))
                .findFirst()
                .map(id -> diagram.node(graph.individual(id)))
                .orElse(null);

            String from = self;
            if (spouse != null) {
                String union = diagram.union(family);
                diagram.edge(self, "---", union);
                diagram.edge(spouse, "---", union);
                from = union;
            }
            for (String childId : family.getChildIds()) {
                if (!childId.equals(subject.getId())) {
                    diagram.edge(from, "-->", diagram.node(graph.individual(childId)));
                }
            }
        }

        return diagram.toMermaid();
    }

    private static final class Diagram {
        private final Map<String, String> nodes = new LinkedHashMap<>();
        private final Map<String, String> unions = new LinkedHashMap<>();
        private final List<String> lines = new ArrayList<>();

        private String node(Individual individual) {
            String existing = nodes.get(individual.getId());
            if (existing != null) {
                return existing;
            }
            String node = "p" + nodes.size();
            nodes.put(individual.getId(), node);
            lines.add(node + "[\"" + individual.getDisplayName().replace('"', '\'') + "\"]");
            lines.add("class " + node + " internal-link");
            return node;
        }

        private String union(Family family) {
            String existing = unions.get(family.getId());
            if (existing != null) {
                return existing;
            }
            String node = "u" + unions.size();
            unions.put(family.getId(), node);
            lines.add(node + "((\" \"))");
            return node;
        }

        private void edge(String from, String arrow, String to) {
            String line = from + " " + arrow + " " + to;
            if (!lines.contains(line)) {
                lines.add(line);
            }
        }

        private String toMermaid() {
            StringBuilder sb = new StringBuilder();
            sb.append("```mermaid\n");
            sb.append("flowchart TD\n");
            sb.append("classDef internal-link fill:#e1f5fe,stroke:#0277bd,stroke-width:2px;\n");
            for (String line : lines) {
                sb.append(line).append('\n');
            }
            sb.append("```\n");
            return sb.toString();
        }
    }
}
