package com.dcruver.familysite.emit;

import com.dcruver.familysite.GenealogyException;
import com.dcruver.familysite.bio.AmbiguousBiographyMatchException;
import com.dcruver.familysite.bio.BiographyReadException;
import com.dcruver.familysite.bio.BiographyRecord;
import com.dcruver.familysite.bio.BiographyStore;
import com.dcruver.familysite.config.SiteProperties;
import com.dcruver.familysite.graph.Family;
import com.dcruver.familysite.graph.FamilyGraph;
import com.dcruver.familysite.graph.GraphLoader;
import com.dcruver.familysite.graph.Individual;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs a full generation: load, resolve, check names, then render and write
 * every profile on a fixed pool, followed by family documents and index pages.
 * <p>
 * Nothing is written unless the whole file parses and resolves and all
 * document names are distinct.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SiteGenerator {

    private final SiteProperties properties;
    private final GraphLoader graphLoader;
    private final ProfileRenderer profileRenderer;
    private final FamilyRenderer familyRenderer;
    private final IndexRenderer indexRenderer;
    private final DocumentWriter documentWriter;

    public GenerationReport generate(GenerationRequest request) throws IOException {
        FamilyGraph graph = graphLoader.load(request.getGedcomPath());
        BiographyStore biographies = BiographyStore.open(request.getBiosDir(), properties.getBioExtensions(), graph);
        return generate(graph, biographies, request);
    }

    GenerationReport generate(FamilyGraph graph, BiographyStore biographies, GenerationRequest request) {
        List<String> paths = new ArrayList<>();
        graph.individuals().forEach(individual -> paths.add(profileRenderer.path(individual)));
        if (request.isEmitFamilies()) {
            graph.families().forEach(family -> paths.add(familyRenderer.path(family)));
        }
        paths.add(indexRenderer.indexPath());
        paths.add(indexRenderer.biosPath());
        DocumentNaming.checkCollisions(paths);

        log.info("Rendering {} profiles to {}{}", graph.individuals().size(), request.getOutputDir(),
            request.isDryRun() ? " (dry run)" : "");

        List<ProfileOutcome> outcomes = renderProfiles(graph, biographies, request);

        List<WriteResult> results = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Set<String> withBiography = new HashSet<>();
        for (ProfileOutcome outcome : outcomes) {
            results.add(outcome.result());
            if (outcome.warning() != null) {
                warnings.add(outcome.warning());
            }
            if (outcome.biography()) {
                withBiography.add(outcome.individualId());
            }
        }

        if (request.isEmitFamilies()) {
            for (Family family : graph.families()) {
                results.add(documentWriter.write(request.getOutputDir(), familyRenderer.render(family, graph),
                    request.isDryRun()));
            }
        }
        results.add(documentWriter.write(request.getOutputDir(),
            indexRenderer.renderIndex(graph.individuals()), request.isDryRun()));
        results.add(documentWriter.write(request.getOutputDir(),
            indexRenderer.renderBiographies(graph.individuals(), withBiography), request.isDryRun()));

        results.sort(Comparator.comparing(WriteResult::getRelativePath));
        warnings.sort(Comparator.naturalOrder());

        List<String> directories = new ArrayList<>();
        directories.add(properties.getPeopleDir());
        if (request.isEmitFamilies()) {
            directories.add(properties.getFamiliesDir());
        }
        List<String> stale = documentWriter.findStale(request.getOutputDir(), directories, new HashSet<>(paths));
        stale.forEach(path -> log.warn("Stale document left in place: {}", path));

        GenerationReport report = GenerationReport.builder()
            .individuals(graph.individuals().size())
            .families(graph.families().size())
            .biographies(withBiography.size())
            .dryRun(request.isDryRun())
            .results(List.copyOf(results))
            .warnings(List.copyOf(warnings))
            .stale(stale)
            .build();

        log.info("Generation finished: {} created, {} updated, {} unchanged",
            report.count(WriteStatus.CREATED), report.count(WriteStatus.UPDATED), report.count(WriteStatus.UNCHANGED));
        return report;
    }

    private List<ProfileOutcome> renderProfiles(FamilyGraph graph, BiographyStore biographies,
                                                GenerationRequest request) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, properties.getParallelism()));
        try {
            List<CompletableFuture<ProfileOutcome>> futures = graph.individuals().stream()
                .map(individual -> CompletableFuture.supplyAsync(
                    () -> emitProfile(individual, graph, biographies, request), executor))
                .toList();

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            return futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new GenealogyException("Profile generation failed", e.getCause());
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private ProfileOutcome emitProfile(Individual individual, FamilyGraph graph, BiographyStore biographies,
                                       GenerationRequest request) {
        Optional<BiographyRecord> biography = Optional.empty();
        String warning = null;
        try {
            biography = biographies.find(individual);
        } catch (AmbiguousBiographyMatchException e) {
            log.warn("Skipping biography: {}", e.getMessage());
            warning = e.getMessage();
        } catch (BiographyReadException e) {
            log.warn("Skipping unreadable biography for {}: {}", individual.getId(), e.getMessage());
            warning = individual.getId() + ": " + e.getMessage();
        }

        SiteDocument document = profileRenderer.render(individual, graph, biography, request.isEmitFamilies());
        WriteResult result = documentWriter.write(request.getOutputDir(), document, request.isDryRun());
        return new ProfileOutcome(individual.getId(), result, biography.isPresent(), warning);
    }

    private record ProfileOutcome(String individualId, WriteResult result, boolean biography, String warning) {
    }
}
