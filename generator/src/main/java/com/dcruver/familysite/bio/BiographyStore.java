package com.dcruver.familysite.bio;

import com.dcruver.familysite.graph.FamilyGraph;
import com.dcruver.familysite.graph.Individual;
import com.dcruver.familysite.graph.PersonName;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Read-only index of biography files, keyed by individual id and by name slug.
 * <p>
 * Lookup order: a file named after the id (without the {@code @} delimiters)
 * always wins; otherwise a file named after the individual's name slug is used,
 * unless that slug is shared by several individuals or matched by several files.
 */
@Slf4j
public class BiographyStore {

    private static final BiographyStore EMPTY = new BiographyStore(Map.of(), Map.of(), Set.of());

    private final Map<String, List<Path>> filesByName;
    private final Map<String, Integer> slugOwners;
    private final Set<String> idKeys;

    private BiographyStore(Map<String, List<Path>> filesByName, Map<String, Integer> slugOwners,
                           Set<String> idKeys) {
        this.filesByName = filesByName;
        this.slugOwners = slugOwners;
        this.idKeys = idKeys;
    }

    /**
     * Index a biography directory. A null or missing directory yields an empty store.
     */
    public static BiographyStore open(Path directory, List<String> extensions, FamilyGraph graph) throws IOException {
        if (directory == null) {
            log.debug("No biography directory configured");
            return EMPTY;
        }
        if (!Files.isDirectory(directory)) {
            log.info("Biography directory does not exist, continuing without biographies: {}", directory);
            return EMPTY;
        }

        Map<String, List<Path>> filesByName = new HashMap<>();
        try (Stream<Path> paths = Files.list(directory)) {
            List<Path> files = paths
                .filter(Files::isRegularFile)
                .filter(p -> extensionRank(p, extensions) >= 0)
                .sorted(Comparator.<Path>comparingInt(p -> extensionRank(p, extensions))
                    .thenComparing(p -> p.getFileName().toString()))
                .toList();
            for (Path file : files) {
                filesByName.computeIfAbsent(baseName(file), k -> new ArrayList<>()).add(file);
            }
            log.info("Indexed {} biography files in {}", files.size(), directory);
        }

        Map<String, Integer> slugOwners = new HashMap<>();
        Set<String> idKeys = new HashSet<>();
        for (Individual individual : graph.individuals()) {
            idKeys.add(idKey(individual.getId()));
            individual.primaryName()
                .map(PersonName::getSlug)
                .filter(slug -> !slug.isEmpty())
                .ifPresent(slug -> slugOwners.merge(slug, 1, Integer::sum));
        }

        return new BiographyStore(filesByName, slugOwners, idKeys);
    }

    public boolean isEmpty() {
        return filesByName.isEmpty();
    }

    /**
     * Find the biography for an individual.
     *
     * @throws AmbiguousBiographyMatchException when only ambiguous name-slug matches exist
     * @throws BiographyReadException when the matched file cannot be read
     */
    public Optional<BiographyRecord> find(Individual individual) {
        if (filesByName.isEmpty()) {
            return Optional.empty();
        }

        List<Path> byId = filesByName.getOrDefault(idKey(individual.getId()), List.of());
        if (!byId.isEmpty()) {
            if (byId.size() > 1) {
                log.debug("Several id-keyed biographies for {}, using {}", individual.getId(), byId.get(0));
            }
            return read(individual, byId.get(0), true);
        }

        String slug = individual.primaryName().map(PersonName::getSlug).orElse("");
        if (slug.isEmpty() || idKeys.contains(slug)) {
            return Optional.empty();
        }
        List<Path> bySlug = filesByName.getOrDefault(slug, List.of());
        if (bySlug.isEmpty()) {
            return Optional.empty();
        }

        int owners = slugOwners.getOrDefault(slug, 0);
        if (owners > 1) {
            throw new AmbiguousBiographyMatchException(individual.getId(),
                "name slug '" + slug + "' is shared by " + owners + " individuals", bySlug);
        }
        if (bySlug.size() > 1) {
            throw new AmbiguousBiographyMatchException(individual.getId(),
                "several files match name slug '" + slug + "'", bySlug);
        }
        return read(individual, bySlug.get(0), false);
    }

    private Optional<BiographyRecord> read(Individual individual, Path file, boolean byId) {
        String text;
        try {
            text = Files.readString(file).replace("\r", "").strip();
        } catch (IOException e) {
            throw new BiographyReadException(file, e);
        }
        if (text.isEmpty()) {
            log.debug("Ignoring empty biography {}", file);
            return Optional.empty();
        }
        log.debug("Found biography for {} at {}", individual.getId(), file);
        return Optional.of(new BiographyRecord(individual.getId(), text, file, byId));
    }

    static String idKey(String id) {
        return id.replace("@", "");
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.lastIndexOf('.'));
    }

    private static int extensionRank(Path file, List<String> extensions) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return -1;
        }
        return extensions.indexOf(name.substring(dot + 1));
    }
}
