package com.dcruver.familysite.graph;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes GEDCOM date values.
 * <p>
 * Recognized forms: {@code D MON YYYY}, {@code MON YYYY}, {@code YYYY}, each
 * optionally qualified by ABT/CAL/EST/BEF/AFT, and the ranges
 * {@code BET x AND y}, {@code FROM x TO y}, {@code FROM x}, {@code TO x}.
 * Anything else is returned as {@link DateFidelity#UNPARSED}.
 */
public final class DateParser {

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
        Map.entry("JAN", 1), Map.entry("FEB", 2), Map.entry("MAR", 3),
        Map.entry("APR", 4), Map.entry("MAY", 5), Map.entry("JUN", 6),
        Map.entry("JUL", 7), Map.entry("AUG", 8), Map.entry("SEP", 9),
        Map.entry("OCT", 10), Map.entry("NOV", 11), Map.entry("DEC", 12)
    );

    private static final List<String> APPROXIMATE = List.of("ABT", "CAL", "EST");
    private static final Pattern BETWEEN = Pattern.compile("^BET\\s+(.+?)\\s+AND\\s+(.+)$");
    private static final Pattern FROM_TO = Pattern.compile("^FROM\\s+(.+?)\\s+TO\\s+(.+)$");
    private static final Pattern YEAR = Pattern.compile("\\d{1,4}");
    private static final Pattern DAY = Pattern.compile("\\d{1,2}");

    private DateParser() {
    }

    public static GenealogyDate parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String clean = text.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");

        Matcher range = BETWEEN.matcher(clean);
        if (!range.matches()) {
            range = FROM_TO.matcher(clean);
        }
        if (range.matches()) {
            Optional<Simple> from = parseSimple(range.group(1));
            Optional<Simple> to = parseSimple(range.group(2));
            if (from.isPresent() && to.isPresent()) {
                return range(text, from.get().iso + ".." + to.get().iso);
            }
            return GenealogyDate.unparsed(text);
        }

        String[] head = clean.split(" ", 2);
        if (head.length == 2) {
            String qualifier = head[0];
            Optional<Simple> rest = parseSimple(head[1]);
            if (rest.isPresent()) {
                String iso = rest.get().iso;
                if (APPROXIMATE.contains(qualifier)) {
                    return approximate(text, "~" + iso);
                } else if ("BEF".equals(qualifier)) {
                    return approximate(text, "<" + iso);
                } else if ("AFT".equals(qualifier)) {
                    return approximate(text, ">" + iso);
                } else if ("FROM".equals(qualifier)) {
                    return range(text, iso + "..");
                } else if ("TO".equals(qualifier)) {
                    return range(text, ".." + iso);
                }
            }
        }

        return parseSimple(clean)
            .map(simple -> new GenealogyDate(text.trim(),
                simple.exact ? DateFidelity.EXACT : DateFidelity.YEAR_ONLY, simple.iso))
            .orElseGet(() -> GenealogyDate.unparsed(text));
    }

    private static GenealogyDate approximate(String text, String normalized) {
        return new GenealogyDate(text.trim(), DateFidelity.APPROXIMATE, normalized);
    }

    private static GenealogyDate range(String text, String normalized) {
        return new GenealogyDate(text.trim(), DateFidelity.RANGE, normalized);
    }

    /**
     * Parse an unqualified calendar date
     */
    private static Optional<Simple> parseSimple(String text) {
        String[] parts = text.trim().split(" ");
        try {
            if (parts.length == 3 && DAY.matcher(parts[0]).matches()
                && MONTHS.containsKey(parts[1]) && YEAR.matcher(parts[2]).matches()) {
                LocalDate date = LocalDate.of(Integer.parseInt(parts[2]), MONTHS.get(parts[1]),
                    Integer.parseInt(parts[0]));
                return Optional.of(new Simple(String.format(Locale.ROOT, "%04d-%02d-%02d",
                    date.getYear(), date.getMonthValue(), date.getDayOfMonth()), true));
            }
            if (parts.length == 2 && MONTHS.containsKey(parts[0]) && YEAR.matcher(parts[1]).matches()) {
                return Optional.of(new Simple(String.format(Locale.ROOT, "%04d-%02d",
                    Integer.parseInt(parts[1]), MONTHS.get(parts[0])), false));
            }
            if (parts.length == 1 && YEAR.matcher(parts[0]).matches()) {
                return Optional.of(new Simple(String.format(Locale.ROOT, "%04d", Integer.parseInt(parts[0])), false));
            }
        } catch (DateTimeException e) {
            // 31 FEB 1900 and friends fall through to unparsed
            return Optional.empty();
        }
        return Optional.empty();
    }

    private record Simple(String iso, boolean exact) {}
}
