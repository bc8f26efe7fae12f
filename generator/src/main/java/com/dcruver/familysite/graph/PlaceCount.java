package com.dcruver.familysite.graph;

import lombok.Value;

@Value
public class PlaceCount {
    String place;
    int count;
}
