package com.dcruver.familysite.graph;

import com.dcruver.familysite.gedcom.RawRecord;
import com.dcruver.familysite.gedcom.RecordTree;
import com.dcruver.familysite.gedcom.RecordType;
import com.dcruver.familysite.gedcom.StructuralException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resolves a {@link RecordTree} into a {@link FamilyGraph}.
 * <p>
 * Works in two passes because GEDCOM allows forward references: the first pass
 * collects every INDI and FAM record with its pointers as plain strings, the
 * second resolves them against the complete id maps. Membership is made
 * symmetric while resolving, so a CHIL line without a matching FAMC (or the
 * reverse) still yields a consistent parent/child view.
 */
@Slf4j
public class GraphBuilder {

    private static final Pattern POINTER = Pattern.compile("@[^@\\s]+@");
    private static final int MAX_SPOUSES = 2;

    public FamilyGraph build(RecordTree tree) {
        Map<String, PendingIndividual> pendingIndividuals = new LinkedHashMap<>();
        Map<String, PendingFamily> pendingFamilies = new LinkedHashMap<>();
        Map<String, String> noteRecords = new HashMap<>();
        Set<String> seenIds = new LinkedHashSet<>();

        // Pass 1: collect
        for (RawRecord root : tree.getRoots()) {
            if (root.getPointer() != null && !seenIds.add(root.getPointer())) {
                throw new StructuralException(root.getLineNumber(), "duplicate record id " + root.getPointer());
            }
            RecordType type = root.getType();
            if (type == RecordType.OTHER) {
                if ("NOTE".equals(root.getTag()) && root.getPointer() != null) {
                    noteRecords.put(root.getPointer(), root.getValue() != null ? root.getValue() : "");
                }
                continue;
            }
            if (root.getPointer() == null) {
                throw new StructuralException(root.getLineNumber(), root.getTag() + " record without an id");
            }
            if (type == RecordType.INDIVIDUAL) {
                pendingIndividuals.put(root.getPointer(), collectIndividual(root));
            } else {
                pendingFamilies.put(root.getPointer(), collectFamily(root));
            }
        }
        log.debug("Collected {} individuals and {} families", pendingIndividuals.size(), pendingFamilies.size());

        // Pass 2: resolve
        Map<String, Set<String>> childOf = new HashMap<>();
        Map<String, Set<String>> spouseOf = new HashMap<>();
        Map<String, Set<String>> familyChildren = new HashMap<>();
        Map<String, Set<String>> familySpouses = new HashMap<>();

        for (PendingIndividual individual : pendingIndividuals.values()) {
            for (String familyId : individual.familiesAsChild) {
                requireFamily(familyId, individual.id, pendingFamilies);
            }
            for (String familyId : individual.familiesAsSpouse) {
                requireFamily(familyId, individual.id, pendingFamilies);
            }
            for (String noteId : individual.noteRefs) {
                if (!noteRecords.containsKey(noteId)) {
                    throw new DanglingReferenceException(noteId, individual.id, "note");
                }
            }
            childOf.put(individual.id, new LinkedHashSet<>(individual.familiesAsChild));
            spouseOf.put(individual.id, new LinkedHashSet<>(individual.familiesAsSpouse));
        }

        for (PendingFamily family : pendingFamilies.values()) {
            for (String spouseId : family.spouseIds) {
                requireIndividual(spouseId, family.id, pendingIndividuals);
            }
            for (String childId : family.childIds) {
                requireIndividual(childId, family.id, pendingIndividuals);
            }
            familySpouses.put(family.id, new LinkedHashSet<>(family.spouseIds));
            familyChildren.put(family.id, new LinkedHashSet<>(family.childIds));
        }

        // Mirror family-side links onto individuals, then individual-side links onto families
        for (PendingFamily family : pendingFamilies.values()) {
            family.spouseIds.forEach(id -> spouseOf.get(id).add(family.id));
            family.childIds.forEach(id -> childOf.get(id).add(family.id));
        }
        for (PendingIndividual individual : pendingIndividuals.values()) {
            individual.familiesAsSpouse.forEach(id -> familySpouses.get(id).add(individual.id));
            individual.familiesAsChild.forEach(id -> familyChildren.get(id).add(individual.id));
        }

        Map<String, Family> families = new LinkedHashMap<>();
        for (PendingFamily family : pendingFamilies.values()) {
            Set<String> spouses = familySpouses.get(family.id);
            if (spouses.size() > MAX_SPOUSES) {
                throw new StructuralException(family.lineNumber,
                    "family " + family.id + " has more than two spouses: " + spouses);
            }
            families.put(family.id, Family.builder()
                .id(family.id)
                .spouseIds(List.copyOf(spouses))
                .childIds(List.copyOf(familyChildren.get(family.id)))
                .events(List.copyOf(family.events))
                .build());
        }

        Map<String, Individual> individuals = new LinkedHashMap<>();
        for (PendingIndividual individual : pendingIndividuals.values()) {
            List<String> notes = new ArrayList<>(individual.notes);
            individual.noteRefs.forEach(ref -> notes.add(noteRecords.get(ref)));
            individuals.put(individual.id, Individual.builder()
                .id(individual.id)
                .names(List.copyOf(individual.names))
                .sex(individual.sex)
                .events(List.copyOf(individual.events))
                .familiesAsChild(Collections.unmodifiableSet(childOf.get(individual.id)))
                .familiesAsSpouse(Collections.unmodifiableSet(spouseOf.get(individual.id)))
                .occupation(individual.occupation)
                .notes(notes.stream().filter(n -> !n.isBlank()).toList())
                .build());
        }

        log.info("Resolved graph: {} individuals, {} families", individuals.size(), families.size());
        return new FamilyGraph(individuals, families);
    }

    private PendingIndividual collectIndividual(RawRecord root) {
        PendingIndividual individual = new PendingIndividual(root.getPointer());
        for (RawRecord child : root.getChildren()) {
            String tag = child.getTag();
            switch (tag) {
                case "NAME" -> individual.names.add(PersonName.parse(child.getValue()));
                case "SEX" -> individual.sex = Sex.fromGedcom(child.getValue());
                case "FAMC" -> individual.familiesAsChild.add(pointer(child));
                case "FAMS" -> individual.familiesAsSpouse.add(pointer(child));
                case "OCCU" -> {
                    if (individual.occupation == null) {
                        individual.occupation = child.value().map(String::trim).orElse(null);
                    }
                }
                case "NOTE" -> {
                    String value = child.getValue() != null ? child.getValue().trim() : "";
                    if (POINTER.matcher(value).matches()) {
                        individual.noteRefs.add(value);
                    } else {
                        individual.notes.add(value);
                    }
                }
                default -> {
                    if (EventKind.INDIVIDUAL_TAGS.contains(tag)) {
                        individual.events.add(toEvent(child));
                    }
                }
            }
        }
        return individual;
    }

    private PendingFamily collectFamily(RawRecord root) {
        PendingFamily family = new PendingFamily(root.getPointer(), root.getLineNumber());
        for (RawRecord child : root.getChildren()) {
            String tag = child.getTag();
            switch (tag) {
                case "HUSB" -> family.husbands.add(pointer(child));
                case "WIFE" -> family.wives.add(pointer(child));
                case "CHIL" -> family.childIds.add(pointer(child));
                default -> {
                    if (EventKind.FAMILY_TAGS.contains(tag)) {
                        family.events.add(toEvent(child));
                    }
                }
            }
        }
        // HUSB before WIFE regardless of source order
        family.spouseIds.addAll(family.husbands);
        family.spouseIds.addAll(family.wives);
        return family;
    }

    private Event toEvent(RawRecord record) {
        return Event.builder()
            .kind(EventKind.fromTag(record.getTag()))
            .tag(record.getTag())
            .date(record.childValue("DATE").map(DateParser::parse).orElse(null))
            .place(record.childValue("PLAC").map(String::trim).orElse(null))
            .build();
    }

    private String pointer(RawRecord record) {
        String value = record.getValue() != null ? record.getValue().trim() : "";
        if (value.isEmpty()) {
            throw new StructuralException(record.getLineNumber(), record.getTag() + " without a pointer");
        }
        return value;
    }

    private void requireFamily(String id, String referrer, Map<String, PendingFamily> families) {
        if (!families.containsKey(id)) {
            throw new DanglingReferenceException(id, referrer, "family");
        }
    }

    private void requireIndividual(String id, String referrer, Map<String, PendingIndividual> individuals) {
        if (!individuals.containsKey(id)) {
            throw new DanglingReferenceException(id, referrer, "individual");
        }
    }

    private static final class PendingIndividual {
        private final String id;
        private final List<PersonName> names = new ArrayList<>();
        private final List<Event> events = new ArrayList<>();
        private final List<String> familiesAsChild = new ArrayList<>();
        private final List<String> familiesAsSpouse = new ArrayList<>();
        private final List<String> notes = new ArrayList<>();
        private final List<String> noteRefs = new ArrayList<>();
        private Sex sex = Sex.UNKNOWN;
        private String occupation;

        private PendingIndividual(String id) {
            this.id = id;
        }
    }

    private static final class PendingFamily {
        private final String id;
        private final int lineNumber;
        private final List<String> husbands = new ArrayList<>();
        private final List<String> wives = new ArrayList<>();
        private final List<String> spouseIds = new ArrayList<>();
        private final List<String> childIds = new ArrayList<>();
        private final List<Event> events = new ArrayList<>();

        private PendingFamily(String id, int lineNumber) {
            this.id = id;
            this.lineNumber = lineNumber;
        }
    }
}
