package com.dcruver.familysite.bio;

import lombok.Value;

import java.nio.file.Path;

@Value
public class BiographyRecord {
    String individualId;
    String text;
    Path source;
    boolean matchedById;
}
