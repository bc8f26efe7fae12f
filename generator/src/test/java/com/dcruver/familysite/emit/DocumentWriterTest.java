package com.dcruver.familysite.emit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DocumentWriterTest {

    private DocumentWriter writer;

    @TempDir
    Path outputDir;

    @BeforeEach
    void setUp() {
        writer = new DocumentWriter();
    }

    @Test
    void testCreatesThenSkipsUnchangedDocument() throws Exception {
        SiteDocument document = new SiteDocument("People/I1.md", "# John\n");

        WriteResult first = writer.write(outputDir, document, false);
        assertEquals(WriteStatus.CREATED, first.getStatus());
        assertEquals("# John\n", Files.readString(outputDir.resolve("People/I1.md")));

        WriteResult second = writer.write(outputDir, document, false);
        assertEquals(WriteStatus.UNCHANGED, second.getStatus());
        assertFalse(second.isChanged());
    }

    @Test
    void testUpdatesChangedDocument() throws Exception {
        writer.write(outputDir, new SiteDocument("People/I1.md", "# John\n"), false);

        WriteResult result = writer.write(outputDir, new SiteDocument("People/I1.md", "# John Smith\n"), false);

        assertEquals(WriteStatus.UPDATED, result.getStatus());
        assertEquals("# John Smith\n", Files.readString(outputDir.resolve("People/I1.md")));
    }

    @Test
    void testDryRunWritesNothingAndReturnsDiff() throws Exception {
        writer.write(outputDir, new SiteDocument("People/I1.md", "# John\nborn 1870\n"), false);

        WriteResult result = writer.write(outputDir,
            new SiteDocument("People/I1.md", "# John Smith\nborn 1870\n"), true);

        assertEquals(WriteStatus.UPDATED, result.getStatus());
        assertTrue(result.getDiff().contains("--- a/People/I1.md"));
        assertTrue(result.getDiff().contains("-# John"));
        assertTrue(result.getDiff().contains("+# John Smith"));
        assertEquals("# John\nborn 1870\n", Files.readString(outputDir.resolve("People/I1.md")));

        WriteResult created = writer.write(outputDir, new SiteDocument("People/I2.md", "# Mary\n"), true);
        assertEquals(WriteStatus.CREATED, created.getStatus());
        assertFalse(Files.exists(outputDir.resolve("People/I2.md")));
    }

    @Test
    void testFindsStaleDocuments() throws Exception {
        Files.createDirectories(outputDir.resolve("People"));
        Files.writeString(outputDir.resolve("People/I1.md"), "current");
        Files.writeString(outputDir.resolve("People/I8.md"), "removed from the tree");
        Files.writeString(outputDir.resolve("People/notes.txt"), "not a document");

        List<String> stale = writer.findStale(outputDir, List.of("People", "Families"), Set.of("People/I1.md"));

        assertEquals(List.of("People/I8.md"), stale);
        assertTrue(Files.exists(outputDir.resolve("People/I8.md")), "Stale documents are never deleted");
    }

    @Test
    void testPathOutsideOutputDirectoryIsRejected() {
        assertThrows(WriteException.class,
            () -> writer.write(outputDir, new SiteDocument("../escape.md", "x"), false));
    }
}
