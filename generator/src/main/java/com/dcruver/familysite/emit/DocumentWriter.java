package com.dcruver.familysite.emit;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Writes rendered documents below an output directory.
 * <p>
 * A document whose bytes already match the file on disk is left alone, so
 * regenerating an unchanged tree touches nothing. In a dry run nothing is
 * written and each changed document carries a unified diff instead.
 */
@Component
@Slf4j
public class DocumentWriter {

    private static final int CONTEXT_LINES = 3;

    public WriteResult write(Path outputDir, SiteDocument document, boolean dryRun) {
        Path target = resolve(outputDir, document.getRelativePath());
        byte[] content = document.getContent().getBytes(StandardCharsets.UTF_8);

        try {
            byte[] existing = Files.isRegularFile(target) ? Files.readAllBytes(target) : null;
            if (existing != null && Arrays.equals(existing, content)) {
                log.debug("Unchanged: {}", document.getRelativePath());
                return new WriteResult(document.getRelativePath(), WriteStatus.UNCHANGED, null);
            }

            WriteStatus status = existing == null ? WriteStatus.CREATED : WriteStatus.UPDATED;
            if (dryRun) {
                String original = existing == null ? "" : new String(existing, StandardCharsets.UTF_8);
                return new WriteResult(document.getRelativePath(), status,
                    generateDiff(original, document.getContent(), document.getRelativePath()));
            }

            Files.createDirectories(target.getParent());
            Files.write(target, content);
            log.debug("{}: {}", status, document.getRelativePath());
            return new WriteResult(document.getRelativePath(), status, null);
        } catch (IOException e) {
            throw new WriteException(target.toString(), "Cannot write document", e);
        }
    }

    /**
     * Markdown files in the given subdirectories that this run did not emit.
     * They are reported, never deleted.
     */
    public List<String> findStale(Path outputDir, Collection<String> subdirectories, Set<String> emitted) {
        List<String> stale = new ArrayList<>();
        for (String subdirectory : subdirectories) {
            Path dir = outputDir.resolve(subdirectory);
            if (!Files.isDirectory(dir)) {
                continue;
            }
            try (Stream<Path> files = Files.list(dir)) {
                files.filter(Files::isRegularFile)
                    .map(file -> subdirectory + "/" + file.getFileName())
                    .filter(path -> path.endsWith(".md"))
                    .filter(path -> !emitted.contains(path))
                    .sorted()
                    .forEach(stale::add);
            } catch (IOException e) {
                throw new WriteException(dir.toString(), "Cannot list output directory", e);
            }
        }
        return stale;
    }

    /**
     * Generate a unified diff between the file on disk and the new rendering
     */
    String generateDiff(String original, String revised, String relativePath) {
        List<String> originalLines = original.lines().toList();
        List<String> revisedLines = revised.lines().toList();

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
            "a/" + relativePath,
            "b/" + relativePath,
            originalLines,
            patch,
            CONTEXT_LINES
        );
        return String.join("\n", unifiedDiff);
    }

    private static Path resolve(Path outputDir, String relativePath) {
        Path target = outputDir.resolve(relativePath).normalize();
        if (!target.startsWith(outputDir.normalize())) {
            throw new WriteException(relativePath, "Document path escapes the output directory");
        }
        return target;
    }
}
