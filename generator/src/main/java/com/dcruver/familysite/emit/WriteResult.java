package com.dcruver.familysite.emit;

import lombok.Value;

/**
 * Outcome of writing one document. The diff is only filled in dry runs.
 */
@Value
public class WriteResult {
    String relativePath;
    WriteStatus status;
    String diff;

    public boolean isChanged() {
        return status != WriteStatus.UNCHANGED;
    }
}
