package com.dcruver.familysite.graph;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Links at most two spouses and their children.
 */
@Value
@Builder
public class Family {
    String id;
    List<String> spouseIds;  // husband first, then wife
    List<String> childIds;
    List<Event> events;

    public Optional<Event> marriage() {
        return events.stream().filter(e -> e.getKind() == EventKind.MARRIAGE).findFirst();
    }
}
