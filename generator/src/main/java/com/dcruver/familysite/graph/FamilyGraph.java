package com.dcruver.familysite.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Read-only graph of individuals and families, closed under pointer references.
 * <p>
 * Relationship queries only follow the fixed child-of and spouse-of relations,
 * so they terminate for any input.
 */
public class FamilyGraph {

    private final Map<String, Individual> individuals;
    private final Map<String, Family> families;

    FamilyGraph(Map<String, Individual> individuals, Map<String, Family> families) {
        this.individuals = Collections.unmodifiableMap(new LinkedHashMap<>(individuals));
        this.families = Collections.unmodifiableMap(new LinkedHashMap<>(families));
    }

    /**
     * Individuals in source order
     */
    public Collection<Individual> individuals() {
        return individuals.values();
    }

    /**
     * Families in source order
     */
    public Collection<Family> families() {
        return families.values();
    }

    public Optional<Individual> findIndividual(String id) {
        return Optional.ofNullable(individuals.get(id));
    }

    public Optional<Family> findFamily(String id) {
        return Optional.ofNullable(families.get(id));
    }

    public Individual individual(String id) {
        return findIndividual(id).orElseThrow(() -> new NoSuchElementException("No individual " + id));
    }

    public Family family(String id) {
        return findFamily(id).orElseThrow(() -> new NoSuchElementException("No family " + id));
    }

    public List<Individual> parentsOf(String id) {
        Individual subject = individual(id);
        return collect(subject, subject.getFamiliesAsChild(), Family::getSpouseIds);
    }

    public List<Individual> childrenOf(String id) {
        Individual subject = individual(id);
        return collect(subject, subject.getFamiliesAsSpouse(), Family::getChildIds);
    }

    public List<Individual> spousesOf(String id) {
        Individual subject = individual(id);
        return collect(subject, subject.getFamiliesAsSpouse(), Family::getSpouseIds);
    }

    public List<Individual> siblingsOf(String id) {
        Individual subject = individual(id);
        return collect(subject, subject.getFamiliesAsChild(), Family::getChildIds);
    }

    public RelationshipView relationships(String id) {
        return new RelationshipView(individual(id), parentsOf(id), spousesOf(id), childrenOf(id), siblingsOf(id));
    }

    public int eventCount() {
        int count = 0;
        for (Individual individual : individuals.values()) {
            count += individual.getEvents().size();
        }
        for (Family family : families.values()) {
            count += family.getEvents().size();
        }
        return count;
    }

    /**
     * Members of the given families, in family order, without duplicates or the subject
     */
    private List<Individual> collect(Individual subject, Set<String> familyIds,
                                     Function<Family, List<String>> members) {
        Set<String> ids = new LinkedHashSet<>();
        for (String familyId : familyIds) {
            ids.addAll(members.apply(family(familyId)));
        }
        ids.remove(subject.getId());

        List<Individual> result = new ArrayList<>(ids.size());
        for (String memberId : ids) {
            result.add(individual(memberId));
        }
        return result;
    }
}
