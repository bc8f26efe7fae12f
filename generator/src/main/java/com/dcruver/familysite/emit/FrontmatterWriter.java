package com.dcruver.familysite.emit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Writes the {@code ---} delimited YAML block the site tool reads titles and metadata from.
 * Key order follows the map's iteration order.
 */
@Component
public class FrontmatterWriter {

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .disable(YAMLGenerator.Feature.SPLIT_LINES));

    public String write(Map<String, Object> fields) {
        try {
            return "---\n" + yaml.writeValueAsString(fields) + "---\n";
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize frontmatter", e);
        }
    }
}
