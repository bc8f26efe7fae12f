package com.dcruver.familysite.gedcom;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordTreeBuilderTest {

    private RecordTreeBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new RecordTreeBuilder();
    }

    @Test
    void testNestsRecordsByLevel() {
        RecordTree tree = builder.build(new GedcomLexer("""
            0 HEAD
            1 SOUR Test
            0 @I1@ INDI
            1 NAME John /Smith/
            1 BIRT
            2 DATE 4 MAR 1900
            2 PLAC Boston
            1 SEX M
            0 @F1@ FAM
            0 TRLR
            """));

        assertEquals(4, tree.getRoots().size());

        RawRecord individual = tree.recordsOfType(RecordType.INDIVIDUAL).get(0);
        assertEquals("@I1@", individual.getPointer());
        assertEquals(List.of("NAME", "BIRT", "SEX"),
            individual.getChildren().stream().map(RawRecord::getTag).toList());

        RawRecord birth = individual.child("BIRT").orElseThrow();
        assertEquals("4 MAR 1900", birth.childValue("DATE").orElseThrow());
        assertEquals("Boston", birth.childValue("PLAC").orElseThrow());

        assertEquals(1, tree.recordsOfType(RecordType.FAMILY).size());
        assertEquals(2, tree.recordsOfType(RecordType.OTHER).size());
    }

    @Test
    void testLevelJumpIsStructuralError() {
        StructuralException e = assertThrows(StructuralException.class, () -> builder.build(new GedcomLexer("""
            0 @I1@ INDI
            1 BIRT
            3 DATE 1900
            """)));
        assertEquals(3, e.getLineNumber());
    }

    @Test
    void testFirstRecordMustBeLevelZero() {
        assertThrows(StructuralException.class, () -> builder.build(new GedcomLexer("1 NAME Orphan\n")));
    }

    @Test
    void testContAndConcFoldIntoParentValue() {
        RecordTree tree = builder.build(new GedcomLexer("""
            0 @I1@ INDI
            1 NOTE First line
            2 CONT second li
            2 CONC ne
            2 CONT
            2 CONT after blank
            """));

        RawRecord note = tree.getRoots().get(0).child("NOTE").orElseThrow();
        assertEquals("First line\nsecond line\n\nafter blank", note.getValue());
        assertTrue(note.getChildren().isEmpty(), "CONT/CONC never appear as children");
    }

    @Test
    void testConcKeepsSpaceAtEndOfPreviousLine() {
        RecordTree tree = builder.build(new GedcomLexer(
            "0 @I1@ INDI\n1 NOTE He worked as a \n2 CONC carpenter.\n"));

        assertEquals("He worked as a carpenter.", tree.getRoots().get(0).childValue("NOTE").orElseThrow());
    }

    @Test
    void testEmptyInputYieldsEmptyTree() {
        assertTrue(builder.build(new GedcomLexer("\n\n")).getRoots().isEmpty());
    }
}
