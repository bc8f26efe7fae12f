package com.dcruver.familysite.graph;

import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Counts over a resolved graph, used by the shell's stats and places commands.
 */
@Value
public class GraphStatistics {
    int individuals;
    int families;
    int events;
    Map<DateFidelity, Integer> dateFidelity;  // every fidelity present, zero included

    public static GraphStatistics of(FamilyGraph graph) {
        Map<DateFidelity, Integer> histogram = new EnumMap<>(DateFidelity.class);
        for (DateFidelity fidelity : DateFidelity.values()) {
            histogram.put(fidelity, 0);
        }
        allEvents(graph)
            .filter(Event::hasDate)
            .forEach(event -> histogram.merge(event.getDate().getFidelity(), 1, Integer::sum));
        return new GraphStatistics(graph.individuals().size(), graph.families().size(),
            graph.eventCount(), histogram);
    }

    /**
     * Distinct event places with their number of occurrences,
     * most frequent first, ties by name.
     */
    public static List<PlaceCount> places(FamilyGraph graph) {
        Map<String, Integer> counts = new HashMap<>();
        allEvents(graph)
            .filter(Event::hasPlace)
            .forEach(event -> counts.merge(event.getPlace().trim(), 1, Integer::sum));

        List<PlaceCount> places = new ArrayList<>();
        counts.forEach((place, count) -> places.add(new PlaceCount(place, count)));
        places.sort(Comparator.comparingInt(PlaceCount::getCount).reversed()
            .thenComparing(PlaceCount::getPlace));
        return places;
    }

    private static Stream<Event> allEvents(FamilyGraph graph) {
        return Stream.concat(
            graph.individuals().stream().flatMap(i -> i.getEvents().stream()),
            graph.families().stream().flatMap(f -> f.getEvents().stream()));
    }
}
