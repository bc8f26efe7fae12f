package com.dcruver.familysite.graph;

import lombok.Value;

/**
 * A source date together with its normalized form.
 * The original text is never discarded, whatever the fidelity.
 */
@Value
public class GenealogyDate {
    String original;
    DateFidelity fidelity;
    String normalized;  // 1900-03-04, 1900-03, 1900, ~1900, <1900, >1900, 1900..1910

    public static GenealogyDate unparsed(String original) {
        String text = original.trim();
        return new GenealogyDate(text, DateFidelity.UNPARSED, text);
    }

    public boolean isParsed() {
        return fidelity != DateFidelity.UNPARSED;
    }
}
