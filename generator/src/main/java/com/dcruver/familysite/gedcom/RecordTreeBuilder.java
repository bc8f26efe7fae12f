package com.dcruver.familysite.gedcom;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Nests a token stream into a {@link RecordTree} using level numbers as depth.
 * <p>
 * CONT and CONC lines are folded into their parent's value (newline and direct
 * concatenation respectively) and never appear as children.
 */
public class RecordTreeBuilder {

    private static final String CONT = "CONT";
    private static final String CONC = "CONC";

    public RecordTree build(Iterable<GedcomLine> lines) {
        List<OpenRecord> roots = new ArrayList<>();
        Deque<OpenRecord> stack = new ArrayDeque<>();

        for (GedcomLine line : lines) {
            while (!stack.isEmpty() && stack.peek().level >= line.getLevel()) {
                stack.pop();
            }

            int expected = stack.isEmpty() ? 0 : stack.peek().level + 1;
            if (stack.isEmpty() && line.getLevel() != 0) {
                throw new StructuralException(line.getLineNumber(),
                    "expected a level 0 record but found level " + line.getLevel());
            }
            if (line.getLevel() != expected) {
                throw new StructuralException(line.getLineNumber(), String.format(
                    "level %d cannot follow level %d (child level must increase by exactly one)",
                    line.getLevel(), expected - 1));
            }

            if (stack.isEmpty()) {
                OpenRecord root = new OpenRecord(line);
                roots.add(root);
                stack.push(root);
                continue;
            }

            OpenRecord parent = stack.peek();
            if (CONT.equals(line.getTag())) {
                parent.append("\n", line.getValue());
            } else if (CONC.equals(line.getTag())) {
                parent.append("", line.getValue());
            } else {
                OpenRecord child = new OpenRecord(line);
                parent.children.add(child);
                stack.push(child);
            }
        }

        return new RecordTree(roots.stream().map(OpenRecord::freeze).toList());
    }

    /**
     * Mutable record while its subtree is still being read
     */
    private static final class OpenRecord {
        private final GedcomLine line;
        private final int level;
        private final List<OpenRecord> children = new ArrayList<>();
        private StringBuilder value;

        private OpenRecord(GedcomLine line) {
            this.line = line;
            this.level = line.getLevel();
            if (line.getValue() != null) {
                this.value = new StringBuilder(line.getValue());
            }
        }

        private void append(String separator, String text) {
            if (value == null) {
                value = new StringBuilder();
            }
            value.append(separator);
            if (text != null) {
                value.append(text);
            }
        }

        private RawRecord freeze() {
            return RawRecord.builder()
                .lineNumber(line.getLineNumber())
                .level(level)
                .tag(line.getTag())
                .pointer(line.getPointer())
                .value(value != null ? value.toString() : null)
                .children(children.stream().map(OpenRecord::freeze).toList())
                .build();
        }
    }
}
