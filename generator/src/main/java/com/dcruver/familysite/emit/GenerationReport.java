package com.dcruver.familysite.emit;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Summary of a generation run. Results are sorted by path.
 */
@Value
@Builder
public class GenerationReport {
    int individuals;
    int families;
    int biographies;
    boolean dryRun;
    List<WriteResult> results;
    List<String> warnings;
    List<String> stale;

    public long count(WriteStatus status) {
        return results.stream().filter(r -> r.getStatus() == status).count();
    }

    public List<WriteResult> changed() {
        return results.stream().filter(WriteResult::isChanged).toList();
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(dryRun ? "Dry run completed.\n\n" : "Generation completed.\n\n");
        sb.append(String.format("- Individuals: %d\n", individuals));
        sb.append(String.format("- Families: %d\n", families));
        sb.append(String.format("- Biographies merged: %d\n", biographies));
        sb.append(String.format("- Documents %s: %d\n", dryRun ? "to create" : "created", count(WriteStatus.CREATED)));
        sb.append(String.format("- Documents %s: %d\n", dryRun ? "to update" : "updated", count(WriteStatus.UPDATED)));
        sb.append(String.format("- Documents unchanged: %d\n", count(WriteStatus.UNCHANGED)));
        if (!warnings.isEmpty()) {
            sb.append("\nWarnings:\n");
            warnings.forEach(w -> sb.append("  ").append(w).append('\n'));
        }
        if (!stale.isEmpty()) {
            sb.append("\nStale documents (not removed):\n");
            stale.forEach(s -> sb.append("  ").append(s).append('\n'));
        }
        return sb.toString();
    }
}
