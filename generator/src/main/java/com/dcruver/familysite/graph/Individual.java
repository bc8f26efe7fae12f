package com.dcruver.familysite.graph;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A person in the resolved graph. Identity is the source pointer, e.g. {@code @I1@}.
 */
@Value
@Builder
public class Individual {
    String id;
    List<PersonName> names;
    Sex sex;
    List<Event> events;
    Set<String> familiesAsChild;   // insertion ordered
    Set<String> familiesAsSpouse;  // insertion ordered
    String occupation;
    List<String> notes;

    public Optional<PersonName> primaryName() {
        return names.stream().filter(n -> !n.isEmpty()).findFirst();
    }

    /**
     * Display name, falling back to the id for unnamed individuals
     */
    public String getDisplayName() {
        return primaryName().map(PersonName::getDisplay).orElse(id);
    }

    /**
     * Names after the primary one
     */
    public List<String> getAliases() {
        String primary = getDisplayName();
        return names.stream()
            .filter(n -> !n.isEmpty())
            .map(PersonName::getDisplay)
            .filter(n -> !n.equals(primary))
            .distinct()
            .toList();
    }

    public Optional<Event> firstEvent(EventKind kind) {
        return events.stream().filter(e -> e.getKind() == kind).findFirst();
    }

    public Optional<Event> birth() {
        return firstEvent(EventKind.BIRTH);
    }

    public Optional<Event> death() {
        return firstEvent(EventKind.DEATH);
    }
}
