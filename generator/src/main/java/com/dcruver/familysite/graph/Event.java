package com.dcruver.familysite.graph;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Event {
    EventKind kind;
    String tag;
    GenealogyDate date;
    String place;

    public boolean hasDate() {
        return date != null;
    }

    public boolean hasPlace() {
        return place != null && !place.isBlank();
    }
}
