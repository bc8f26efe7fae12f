package com.dcruver.familysite.graph;

import lombok.Value;

import java.util.List;

/**
 * Immediate relatives of one individual, derived from family membership.
 * Never stored on the graph; see {@link FamilyGraph#relationships(String)}.
 */
@Value
public class RelationshipView {
    Individual subject;
    List<Individual> parents;
    List<Individual> spouses;
    List<Individual> children;
    List<Individual> siblings;

    public boolean isEmpty() {
        return parents.isEmpty() && spouses.isEmpty() && children.isEmpty() && siblings.isEmpty();
    }
}
