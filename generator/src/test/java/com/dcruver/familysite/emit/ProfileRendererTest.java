package com.dcruver.familysite.emit;

import com.dcruver.familysite.bio.BiographyRecord;
import com.dcruver.familysite.config.SiteProperties;
import com.dcruver.familysite.gedcom.GedcomLexer;
import com.dcruver.familysite.graph.FamilyGraph;
import com.dcruver.familysite.graph.GraphLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ProfileRendererTest {

    private static final String TREE = """
        0 @I1@ INDI
        1 NAME John /Smith/
        1 SEX M
        1 BIRT
        2 DATE 4 MAR 1870
        2 PLAC Boston, Massachusetts
        1 BURI
        2 PLAC Salem
        1 OCCU Carpenter
        1 FAMS @F1@
        0 @I2@ INDI
        1 NAME Mary /Jones/
        1 NAME Mary /Smith/
        1 SEX F
        1 FAMS @F1@
        0 @I3@ INDI
        1 NAME Carol /Smith/
        1 FAMC @F1@
        0 @I4@ INDI
        1 NAME Dan /Smith/
        1 FAMC @F1@
        0 @F1@ FAM
        1 HUSB @I1@
        1 WIFE @I2@
        1 CHIL @I3@
        1 CHIL @I4@
        1 MARR
        2 DATE BET 1895 AND 1896
        0 @I9@ INDI
        1 NOTE Arrived alone.
        """;

    private SiteProperties properties;
    private ProfileRenderer renderer;
    private FamilyGraph graph;

    @BeforeEach
    void setUp() {
        properties = new SiteProperties();
        FrontmatterWriter frontmatter = new FrontmatterWriter();
        EventFormatter events = new EventFormatter(new PlaceLinker(properties));
        renderer = new ProfileRenderer(properties, frontmatter, events, new FamilyDiagramRenderer());
        graph = new GraphLoader().load(new GedcomLexer(TREE));
    }

    @Test
    void testFrontmatterFields() {
        String content = renderer.render(graph.individual("@I1@"), graph, Optional.empty(), false).getContent();

        assertTrue(content.startsWith("---\ntitle: \"John Smith\"\ntype: \"profile\"\nid: \"@I1@\"\nsex: \"male\"\n"));
        assertTrue(content.contains("  date: \"1870-03-04\"\n  fidelity: \"exact\"\n  original: \"4 MAR 1870\"\n"));
        assertTrue(content.contains("occupation: \"Carpenter\""));
        assertTrue(content.contains("\"person\""));
        assertFalse(content.contains("death:"), "Unknown events are left out of the frontmatter");
    }

    @Test
    void testFactsAndPlaceLinks() {
        String content = renderer.render(graph.individual("@I1@"), graph, Optional.empty(), false).getContent();

        assertTrue(content.contains("# John Smith\n"));
        assertTrue(content.contains("- **Birth**: 4 MAR 1870 at "
            + "[Boston, Massachusetts](<https://en.wikipedia.org/wiki/Boston,_Massachusetts>)\n"));
        assertTrue(content.contains("- **Death**: —\n"));
        assertTrue(content.contains("- **Burial**: at [Salem](<https://en.wikipedia.org/wiki/Salem>)\n"));
        assertTrue(content.contains("- **Occupation**: Carpenter\n"));
    }

    @Test
    void testPlaceOverridesAndDisabledLinks() {
        properties.getPlaceLinks().getOverrides().put("Boston, Massachusetts", "Boston");
        String linked = renderer.render(graph.individual("@I1@"), graph, Optional.empty(), false).getContent();
        assertTrue(linked.contains("(<https://en.wikipedia.org/wiki/Boston>)"));

        properties.getPlaceLinks().setEnabled(false);
        String plain = renderer.render(graph.individual("@I1@"), graph, Optional.empty(), false).getContent();
        assertTrue(plain.contains("- **Birth**: 4 MAR 1870 at Boston, Massachusetts\n"));
    }

    @Test
    void testRelationshipSections() {
        String content = renderer.render(graph.individual("@I3@"), graph, Optional.empty(), false).getContent();

        assertTrue(content.contains("## Parents\n\n- [[I1|John Smith]]\n- [[I2|Mary Jones]]\n\n"));
        assertTrue(content.contains("## Spouses\n\n—\n\n"));
        assertTrue(content.contains("## Children\n\n—\n\n"));
        assertTrue(content.contains("## Siblings\n\n- [[I4|Dan Smith]]\n\n"));
        assertTrue(content.indexOf("## Parents") < content.indexOf("## Spouses"));
        assertTrue(content.indexOf("## Children") < content.indexOf("## Siblings"));
    }

    @Test
    void testBiographyOrPlaceholder() {
        String without = renderer.render(graph.individual("@I2@"), graph, Optional.empty(), false).getContent();
        assertTrue(without.contains("## Biography\n\n_No biography available._\n"));
        assertTrue(without.contains("aliases:"));
        assertTrue(without.contains("\"Mary Smith\""));

        BiographyRecord bio = new BiographyRecord("@I2@", "Mary kept bees.", Path.of("I2.md"), true);
        String with = renderer.render(graph.individual("@I2@"), graph, Optional.of(bio), false).getContent();
        assertTrue(with.contains("## Biography\n\nMary kept bees.\n"));
        assertTrue(with.endsWith("---\n\n**GEDCOM ID**: @I2@\n"));
    }

    @Test
    void testUnnamedIndividualUsesIdAndHasNoDiagram() {
        String content = renderer.render(graph.individual("@I9@"), graph, Optional.empty(), false).getContent();

        assertTrue(content.contains("# @I9@\n"));
        assertTrue(content.contains("## Notes\n\nArrived alone.\n"));
        assertFalse(content.contains("```mermaid"));
    }

    @Test
    void testFamilyDiagram() {
        String content = renderer.render(graph.individual("@I3@"), graph, Optional.empty(), false).getContent();

        assertTrue(content.contains("```mermaid\nflowchart TD\n"));
        assertTrue(content.contains("p0[\"Carol Smith\"]"));
        assertTrue(content.contains("u0 --> p0"));

        properties.setFamilyDiagram(false);
        assertFalse(renderer.render(graph.individual("@I3@"), graph, Optional.empty(), false)
            .getContent().contains("```mermaid"));
    }

    @Test
    void testFamilyLinksWhenFamiliesAreEmitted() {
        String content = renderer.render(graph.individual("@I3@"), graph, Optional.empty(), true).getContent();

        assertTrue(content.contains("## Families\n\n- [[F1|John Smith & Mary Jones]] (as child)\n"));
    }

    @Test
    void testOutputDoesNotDependOnDefaultLocale() {
        FamilyGraph approximate = new GraphLoader().load(new GedcomLexer("""
            0 @I1@ INDI
            1 NAME Ivan /Ilic/
            1 SEX M
            1 BIRT
            2 DATE ABT 1900
            """));

        Locale previous = Locale.getDefault();
        String expected;
        String turkish;
        try {
            Locale.setDefault(Locale.ROOT);
            expected = renderer.render(approximate.individual("@I1@"), approximate, Optional.empty(), false).getContent();
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            turkish = renderer.render(approximate.individual("@I1@"), approximate, Optional.empty(), false).getContent();
        } finally {
            Locale.setDefault(previous);
        }

        assertEquals(expected, turkish);
        assertTrue(turkish.contains("fidelity: \"approximate\""));
        assertTrue(turkish.contains("sex: \"male\""));
    }

    @Test
    void testPathAndDeterminism() {
        SiteDocument first = renderer.render(graph.individual("@I1@"), graph, Optional.empty(), false);
        SiteDocument second = renderer.render(graph.individual("@I1@"), graph, Optional.empty(), false);

        assertEquals("People/I1.md", first.getRelativePath());
        assertEquals(first, second);
    }
}
