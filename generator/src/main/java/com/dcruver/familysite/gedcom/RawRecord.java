package com.dcruver.familysite.gedcom;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Immutable node of the GEDCOM record tree.
 * A child's level is always its parent's level + 1.
 */
@Value
@Builder
public class RawRecord {
    int lineNumber;
    int level;
    String tag;
    String pointer;
    String value;
    List<RawRecord> children;

    public RecordType getType() {
        return RecordType.fromTag(tag);
    }

    public Optional<String> value() {
        return Optional.ofNullable(value).filter(v -> !v.isBlank());
    }

    /**
     * First child with the given tag
     */
    public Optional<RawRecord> child(String childTag) {
        return children.stream()
            .filter(c -> c.getTag().equals(childTag))
            .findFirst();
    }

    public Optional<String> childValue(String childTag) {
        return child(childTag).flatMap(RawRecord::value);
    }
}
