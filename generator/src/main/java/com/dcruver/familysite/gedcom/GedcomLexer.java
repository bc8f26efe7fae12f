package com.dcruver.familysite.gedcom;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

/**
 * Splits GEDCOM text into {@link GedcomLine} tokens.
 * <p>
 * The sequence is lazy and restartable: every call to {@link #iterator()}
 * starts again from the first line. Blank lines are skipped; any other line
 * that does not tokenize aborts iteration with a {@link MalformedLineException}.
 */
public class GedcomLexer implements Iterable<GedcomLine> {

    private static final char BOM = '\uFEFF';
    private static final Pattern LEVEL = Pattern.compile("\\d{1,2}");
    private static final Pattern POINTER = Pattern.compile("@[^@\\s]+@");
    private static final Pattern TAG = Pattern.compile("_?[A-Za-z0-9_]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final String text;

    public GedcomLexer(String text) {
        this.text = text;
    }

    /**
     * Read a file as strict UTF-8.
     */
    public static GedcomLexer fromPath(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
            return new GedcomLexer(text);
        } catch (CharacterCodingException e) {
            throw new MalformedLineException(0, "file is not valid UTF-8: " + path, e);
        }
    }

    @Override
    public Iterator<GedcomLine> iterator() {
        return new LineIterator(text.lines().iterator());
    }

    /**
     * Tokenize a single physical line. Returns null for a blank line.
     * Trailing whitespace belongs to the value, since CONC continuations
     * are joined without a separator.
     */
    static GedcomLine tokenize(String raw, int lineNumber) {
        String line = raw;
        if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == BOM) {
            line = line.substring(1);
        }
        line = line.stripLeading();
        if (line.isBlank()) {
            return null;
        }

        String[] head = WHITESPACE.split(line, 2);
        if (!LEVEL.matcher(head[0]).matches()) {
            throw new MalformedLineException(lineNumber, "level is not a number: '" + head[0] + "'");
        }
        int level = Integer.parseInt(head[0]);
        if (head.length < 2 || head[1].isBlank()) {
            throw new MalformedLineException(lineNumber, "missing tag");
        }

        String rest = head[1];
        String pointer = null;
        if (rest.startsWith("@")) {
            String[] parts = WHITESPACE.split(rest, 2);
            if (!POINTER.matcher(parts[0]).matches()) {
                throw new MalformedLineException(lineNumber, "malformed pointer: '" + parts[0] + "'");
            }
            pointer = parts[0];
            if (parts.length < 2 || parts[1].isBlank()) {
                throw new MalformedLineException(lineNumber, "missing tag after pointer " + pointer);
            }
            rest = parts[1];
        }

        int end = 0;
        while (end < rest.length() && !Character.isWhitespace(rest.charAt(end))) {
            end++;
        }
        String tag = rest.substring(0, end);
        if (!TAG.matcher(tag).matches()) {
            throw new MalformedLineException(lineNumber, "malformed tag: '" + tag + "'");
        }

        // one delimiter after the tag; everything else, trailing spaces included, is value
        String value = end + 1 < rest.length() ? rest.substring(end + 1) : null;

        return new GedcomLine(lineNumber, level, pointer, tag.toUpperCase(Locale.ROOT), value);
    }

    private static final class LineIterator implements Iterator<GedcomLine> {

        private final Iterator<String> lines;
        private int lineNumber;
        private GedcomLine next;

        private LineIterator(Iterator<String> lines) {
            this.lines = lines;
        }

        @Override
        public boolean hasNext() {
            while (next == null && lines.hasNext()) {
                lineNumber++;
                next = tokenize(lines.next(), lineNumber);
            }
            return next != null;
        }

        @Override
        public GedcomLine next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            GedcomLine current = next;
            next = null;
            return current;
        }
    }
}
