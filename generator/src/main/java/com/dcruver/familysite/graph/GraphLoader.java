package com.dcruver.familysite.graph;

import com.dcruver.familysite.gedcom.GedcomLexer;
import com.dcruver.familysite.gedcom.RecordTree;
import com.dcruver.familysite.gedcom.RecordTreeBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads a GEDCOM file into a resolved {@link FamilyGraph}.
 * Any lexical, structural or reference error aborts the load.
 */
@Component
@Slf4j
public class GraphLoader {

    public FamilyGraph load(Path gedcomPath) throws IOException {
        log.info("Reading GEDCOM file {}", gedcomPath);
        GedcomLexer lexer = GedcomLexer.fromPath(gedcomPath);
        return load(lexer);
    }

    public FamilyGraph load(GedcomLexer lexer) {
        RecordTree tree = new RecordTreeBuilder().build(lexer);
        log.debug("Built record tree with {} root records", tree.getRoots().size());
        return new GraphBuilder().build(tree);
    }
}
