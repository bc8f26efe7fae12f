package com.dcruver.familysite.emit;

import lombok.Value;

/**
 * A rendered document and its path relative to the output directory.
 */
@Value
public class SiteDocument {
    String relativePath;  // always '/'-separated
    String content;
}
