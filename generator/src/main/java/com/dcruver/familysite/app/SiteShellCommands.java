package com.dcruver.familysite.app;

import com.dcruver.familysite.config.SiteProperties;
import com.dcruver.familysite.emit.GenerationReport;
import com.dcruver.familysite.emit.GenerationRequest;
import com.dcruver.familysite.emit.SiteGenerator;
import com.dcruver.familysite.emit.WriteResult;
import com.dcruver.familysite.graph.DateFidelity;
import com.dcruver.familysite.graph.FamilyGraph;
import com.dcruver.familysite.graph.GraphLoader;
import com.dcruver.familysite.graph.GraphStatistics;
import com.dcruver.familysite.graph.PlaceCount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Spring Shell commands for building the family site.
 * Options left out fall back to the {@code site.*} settings.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class SiteShellCommands {

    private final SiteProperties properties;
    private final SiteGenerator siteGenerator;
    private final GraphLoader graphLoader;

    @ShellMethod(key = {"generate", "build"}, value = "Generate profile documents from a GEDCOM file")
    public String generate(
        @ShellOption(value = "--gedcom", defaultValue = ShellOption.NULL, help = "GEDCOM file") String gedcom,
        @ShellOption(value = "--output", defaultValue = ShellOption.NULL, help = "Output directory") String output,
        @ShellOption(value = "--bios", defaultValue = ShellOption.NULL, help = "Biography directory") String bios,
        @ShellOption(value = "--families", defaultValue = "false", help = "Also emit family documents") boolean families
    ) {
        log.info("Generating site...");

        try {
            GenerationReport report = siteGenerator.generate(request(gedcom, output, bios, families, false));
            return report.summary();
        } catch (Exception e) {
            log.error("Generation failed", e);
            return "Generation failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = {"preview", "dry-run"}, value = "Show which documents a generation would change")
    public String preview(
        @ShellOption(value = "--gedcom", defaultValue = ShellOption.NULL, help = "GEDCOM file") String gedcom,
        @ShellOption(value = "--output", defaultValue = ShellOption.NULL, help = "Output directory") String output,
        @ShellOption(value = "--bios", defaultValue = ShellOption.NULL, help = "Biography directory") String bios,
        @ShellOption(value = "--families", defaultValue = "false", help = "Also emit family documents") boolean families,
        @ShellOption(value = "--diff", defaultValue = "false", help = "Print unified diffs") boolean showDiff
    ) {
        log.info("Previewing site generation...");

        try {
            GenerationReport report = siteGenerator.generate(request(gedcom, output, bios, families, true));

            StringBuilder sb = new StringBuilder(report.summary());
            List<WriteResult> changed = report.changed();
            if (changed.isEmpty()) {
                sb.append("\nNothing to change - site is up to date.\n");
                return sb.toString();
            }

            sb.append("\nChanged documents:\n");
            for (WriteResult result : changed) {
                sb.append(String.format("  [%s] %s\n", result.getStatus(), result.getRelativePath()));
            }
            if (showDiff) {
                for (WriteResult result : changed) {
                    sb.append('\n').append(result.getDiff()).append('\n');
                }
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Preview failed", e);
            return "Preview failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "places", value = "List event places with their number of occurrences")
    public String places(
        @ShellOption(value = "--gedcom", defaultValue = ShellOption.NULL, help = "GEDCOM file") String gedcom,
        @ShellOption(value = "--limit", defaultValue = "0", help = "Show only the most frequent places") int limit
    ) {
        try {
            FamilyGraph graph = graphLoader.load(gedcomPath(gedcom));
            List<PlaceCount> places = GraphStatistics.places(graph);
            if (places.isEmpty()) {
                return "No places recorded.";
            }

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Unique places: %d\n\n", places.size()));
            places.stream()
                .limit(limit > 0 ? limit : places.size())
                .forEach(p -> sb.append(String.format("%5d  %s\n", p.getCount(), p.getPlace())));
            return sb.toString();
        } catch (Exception e) {
            log.error("Failed to list places", e);
            return "Failed to list places: " + e.getMessage();
        }
    }

    @ShellMethod(key = {"stats", "status"}, value = "Parse and resolve a GEDCOM file and print counts")
    public String stats(
        @ShellOption(value = "--gedcom", defaultValue = ShellOption.NULL, help = "GEDCOM file") String gedcom
    ) {
        try {
            FamilyGraph graph = graphLoader.load(gedcomPath(gedcom));
            GraphStatistics stats = GraphStatistics.of(graph);

            StringBuilder sb = new StringBuilder();
            sb.append("GEDCOM Statistics:\n");
            sb.append(String.format("- Individuals: %d\n", stats.getIndividuals()));
            sb.append(String.format("- Families: %d\n", stats.getFamilies()));
            sb.append(String.format("- Events: %d\n", stats.getEvents()));
            sb.append("\nDate fidelity:\n");
            for (Map.Entry<DateFidelity, Integer> entry : stats.getDateFidelity().entrySet()) {
                sb.append(String.format("- %s: %d\n", entry.getKey().name().toLowerCase(Locale.ROOT), entry.getValue()));
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Failed to compute statistics", e);
            return "Failed to compute statistics: " + e.getMessage();
        }
    }

    private GenerationRequest request(String gedcom, String output, String bios, boolean families, boolean dryRun) {
        GenerationRequest defaults = GenerationRequest.from(properties);
        return defaults.toBuilder()
            .gedcomPath(gedcomPath(gedcom))
            .outputDir(output != null ? Path.of(output) : defaults.getOutputDir())
            .biosDir(bios != null ? Path.of(bios) : defaults.getBiosDir())
            .emitFamilies(families || defaults.isEmitFamilies())
            .dryRun(dryRun)
            .build();
    }

    private Path gedcomPath(String gedcom) {
        return Path.of(gedcom != null ? gedcom : properties.getGedcomPath());
    }
}
