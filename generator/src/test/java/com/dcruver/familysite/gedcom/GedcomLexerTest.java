package com.dcruver.familysite.gedcom;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class GedcomLexerTest {

    @TempDir
    Path tempDir;

    @Test
    void testTokenizesPointerTagAndValue() {
        GedcomLine line = GedcomLexer.tokenize("0 @I1@ INDI", 1);

        assertEquals(0, line.getLevel());
        assertEquals("@I1@", line.getPointer());
        assertEquals("INDI", line.getTag());
        assertNull(line.getValue());

        GedcomLine name = GedcomLexer.tokenize("1 NAME John /Smith/", 2);
        assertEquals(1, name.getLevel());
        assertFalse(name.hasPointer());
        assertEquals("NAME", name.getTag());
        assertEquals("John /Smith/", name.getValue());
    }

    @Test
    void testToleratesLineEndingsBomAndBlankLines() {
        String text = "\uFEFF0 HEAD\r\n1 CHAR UTF-8\r\n\r\n   \n0 TRLR\r\n\r\n\n";

        List<GedcomLine> lines = collect(new GedcomLexer(text));

        assertEquals(3, lines.size());
        assertEquals("HEAD", lines.get(0).getTag());
        assertEquals("UTF-8", lines.get(1).getValue());
        assertEquals("TRLR", lines.get(2).getTag());
        assertEquals(5, lines.get(2).getLineNumber(), "Blank lines still count towards line numbers");
    }

    @Test
    void testBareCarriageReturnsSplitLines() {
        List<GedcomLine> lines = collect(new GedcomLexer("0 HEAD\r0 TRLR\r"));

        assertEquals(2, lines.size());
        assertEquals("TRLR", lines.get(1).getTag());
    }

    @Test
    void testIterationIsRestartable() {
        GedcomLexer lexer = new GedcomLexer("0 HEAD\n0 TRLR\n");

        assertEquals(2, collect(lexer).size());
        assertEquals(2, collect(lexer).size());
    }

    @Test
    void testNonNumericLevelReportsLineNumber() {
        GedcomLexer lexer = new GedcomLexer("0 HEAD\n1 CHAR UTF-8\nX NAME Bad\n");

        MalformedLineException e = assertThrows(MalformedLineException.class, () -> collect(lexer));
        assertEquals(3, e.getLineNumber());
        assertTrue(e.getMessage().startsWith("Line 3:"));
    }

    @Test
    void testTrailingSpacesStayInTheValue() {
        assertEquals("He worked as a ", GedcomLexer.tokenize("1 NOTE He worked as a ", 2).getValue());
        assertNull(GedcomLexer.tokenize("0 HEAD ", 1).getValue());
        assertEquals("TRLR", GedcomLexer.tokenize("0 TRLR\t", 9).getTag());
    }

    @Test
    void testTagsAreUpperCasedIndependentlyOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals("INDI", GedcomLexer.tokenize("0 @I1@ indi", 1).getTag());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void testMissingTagIsMalformed() {
        assertThrows(MalformedLineException.class, () -> GedcomLexer.tokenize("1", 7));
        assertThrows(MalformedLineException.class, () -> GedcomLexer.tokenize("0 @I1@", 7));
    }

    @Test
    void testInvalidUtf8IsReported() throws Exception {
        Path file = tempDir.resolve("broken.ged");
        Files.write(file, new byte[]{'0', ' ', 'H', 'E', 'A', 'D', '\n', (byte) 0xC3, (byte) 0x28});

        MalformedLineException e = assertThrows(MalformedLineException.class, () -> GedcomLexer.fromPath(file));
        assertEquals(0, e.getLineNumber());
    }

    private static List<GedcomLine> collect(GedcomLexer lexer) {
        List<GedcomLine> lines = new ArrayList<>();
        lexer.forEach(lines::add);
        return lines;
    }
}
