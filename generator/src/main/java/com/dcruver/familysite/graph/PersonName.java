package com.dcruver.familysite.graph;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A personal name split by the GEDCOM {@code Given /Surname/ Suffix} convention.
 */
@Value
public class PersonName {

    private static final Pattern SLASHED = Pattern.compile("^([^/]*)/([^/]*)/([^/]*)$");

    String raw;
    List<String> parts;
    String surname;  // null when the name had no /surname/ delimiters

    /**
     * Split a NAME value. A value without a well-formed slash pair is kept
     * whole as the only part.
     */
    public static PersonName parse(String raw) {
        String value = raw == null ? "" : raw.trim();
        Matcher m = SLASHED.matcher(value);
        if (!m.matches()) {
            List<String> parts = value.isEmpty() ? List.of() : List.of(collapse(value));
            return new PersonName(value, parts, null);
        }

        List<String> parts = new ArrayList<>();
        for (int group = 1; group <= 3; group++) {
            String part = collapse(m.group(group));
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        String surname = collapse(m.group(2));
        return new PersonName(value, List.copyOf(parts), surname.isEmpty() ? null : surname);
    }

    public boolean isEmpty() {
        return parts.isEmpty();
    }

    public String getDisplay() {
        return String.join(" ", parts);
    }

    /**
     * Lower-case slug of the display name; letters and digits of any script survive.
     */
    public String getSlug() {
        StringBuilder sb = new StringBuilder();
        boolean dash = false;
        for (int cp : getDisplay().codePoints().toArray()) {
            if (Character.isLetterOrDigit(cp)) {
                sb.appendCodePoint(Character.toLowerCase(cp));
                dash = false;
            } else if (!dash && sb.length() > 0) {
                sb.append('-');
                dash = true;
            }
        }
        int end = sb.length();
        if (end > 0 && sb.charAt(end - 1) == '-') {
            sb.setLength(end - 1);
        }
        return sb.toString();
    }

    private static String collapse(String text) {
        return text.trim().replaceAll("\\s+", " ");
    }
}
