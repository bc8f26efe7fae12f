package com.dcruver.familysite.emit;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DocumentNamingTest {

    @Test
    void testPlainIdsKeepTheirCharacters() {
        assertEquals("I1", DocumentNaming.fileStem("@I1@"));
        assertEquals("F-12", DocumentNaming.fileStem("@F-12@"));
        assertEquals("I1.md", DocumentNaming.fileName("@I1@"));
    }

    @Test
    void testOtherCharactersAreHexEncoded() {
        assertEquals("I_5F1", DocumentNaming.fileStem("@I_1@"));
        assertEquals("I_2E1", DocumentNaming.fileStem("@I.1@"));
        assertEquals("_C3_841", DocumentNaming.fileStem("@Ä1@"));
    }

    @Test
    void testLowerCaseLettersAreEncoded() {
        assertEquals("_691", DocumentNaming.fileStem("@i1@"));
        assertEquals("I_6E_64_65_78", DocumentNaming.fileStem("@Index@"));
    }

    @Test
    void testStemsDifferingOnlyByCaseStayDistinctWhenCaseFolded() {
        List<String> ids = List.of("@I1@", "@i1@", "@Fam@", "@FAM@", "@fAm@");
        Set<String> folded = new HashSet<>();
        for (String id : ids) {
            assertTrue(folded.add(DocumentNaming.fileStem(id).toLowerCase(Locale.ROOT)),
                "Stem of " + id + " clashes on a case-insensitive filesystem");
        }
    }

    @Test
    void testNamingIsInjective() {
        List<String> ids = List.of("@I1@", "@I_1@", "@I_5F1@", "@I.1@", "@I_2E1@", "@I-1@", "@I1_@", "@I15F@",
            "@i1@", "@_691@");
        Set<String> stems = new HashSet<>();
        for (String id : ids) {
            assertTrue(stems.add(DocumentNaming.fileStem(id)), "Stem of " + id + " is not unique");
        }
    }

    @Test
    void testWikiLinkEscapesLabel() {
        assertEquals("[[I1|John Smith]]", DocumentNaming.wikiLink("@I1@", "John Smith"));
        assertEquals("[[I2|A/B (c)]]", DocumentNaming.wikiLink("@I2@", "A|B [c]"));
    }

    @Test
    void testCaseOnlyDifferenceCollides() {
        WriteException e = assertThrows(WriteException.class,
            () -> DocumentNaming.checkCollisions(List.of("People/I1.md", "People/I2.md", "People/i1.md")));
        assertEquals("People/i1.md", e.getPath());
    }

    @Test
    void testFixedPageNameClashesAcrossFolders() {
        WriteException e = assertThrows(WriteException.class,
            () -> DocumentNaming.checkCollisions(List.of("People/I1.md", "Families/INDEX.md", "People/index.md")));
        assertEquals("People/index.md", e.getPath());
    }

    @Test
    void testDistinctPathsPass() {
        assertDoesNotThrow(() -> DocumentNaming.checkCollisions(List.of(
            "People/I1.md", "People/" + DocumentNaming.fileName("@i1@"), "Families/F1.md",
            "Families/" + DocumentNaming.fileName("@index@"), "People/index.md", "People/bios.md")));
    }
}
