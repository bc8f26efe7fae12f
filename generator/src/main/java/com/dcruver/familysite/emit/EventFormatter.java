package com.dcruver.familysite.emit;

import com.dcruver.familysite.graph.Event;
import com.dcruver.familysite.graph.GenealogyDate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Shared rendering of events for profile and family documents.
 */
@Component
@RequiredArgsConstructor
public class EventFormatter {

    static final String NONE = "—";

    private static final Map<String, String> LABELS = Map.of(
        "BIRT", "Birth",
        "DEAT", "Death",
        "BURI", "Burial",
        "CHR", "Christening",
        "BAPM", "Baptism",
        "RESI", "Residence",
        "MARR", "Marriage",
        "DIV", "Divorce",
        "ENGA", "Engagement"
    );

    private final PlaceLinker placeLinker;

    /**
     * Body text: the date as written in the source, then the linked place
     */
    public String describe(Optional<Event> event) {
        if (event.isEmpty() || (!event.get().hasDate() && !event.get().hasPlace())) {
            return NONE;
        }
        Event e = event.get();
        StringBuilder sb = new StringBuilder();
        if (e.hasDate()) {
            sb.append(e.getDate().getOriginal());
        }
        if (e.hasPlace()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append("at ").append(placeLinker.render(e.getPlace()));
        }
        return sb.toString();
    }

    /**
     * Frontmatter block: normalized date, fidelity, source text and place
     */
    public static Map<String, Object> fields(Event event) {
        Map<String, Object> fields = new LinkedHashMap<>();
        GenealogyDate date = event.getDate();
        if (date != null) {
            fields.put("date", date.getNormalized());
            fields.put("fidelity", date.getFidelity().name().toLowerCase(Locale.ROOT));
            fields.put("original", date.getOriginal());
        }
        if (event.hasPlace()) {
            fields.put("place", event.getPlace());
        }
        return fields;
    }

    public static String label(Event event) {
        return LABELS.getOrDefault(event.getTag(), event.getTag());
    }
}
