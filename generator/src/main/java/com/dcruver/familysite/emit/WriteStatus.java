package com.dcruver.familysite.emit;

public enum WriteStatus {
    CREATED,
    UPDATED,
    UNCHANGED
}
