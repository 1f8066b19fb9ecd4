package work.lcod.scoring.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.scoring.api.OutputNames;
import work.lcod.scoring.model.FeatureKind;
import work.lcod.scoring.model.ImputationEntry;
import work.lcod.scoring.model.ImputationTable;

/**
 * Program text installed into the session: the model artifact wrapped by the scoring routine template.
 */
public final class ScoringProgram {
    static final String TEMPLATE_RESOURCE = "/work/lcod/scoring/scoring-program.js.tmpl";
    private static final ObjectMapper JSON = new ObjectMapper();

    private final String routineName;
    private final String text;

    private ScoringProgram(String routineName, String text) {
        this.routineName = routineName;
        this.text = text;
    }

    public static ScoringProgram fromArtifact(
        Path artifact,
        String moduleId,
        String routineName,
        ImputationTable table,
        OutputNames outputs
    ) {
        Objects.requireNonNull(artifact, "artifact");
        String source;
        try {
            source = Files.readString(artifact, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read model artifact " + artifact, ex);
        }
        return render(source, moduleId, routineName, table, outputs);
    }

    public static ScoringProgram render(
        String artifactSource,
        String moduleId,
        String routineName,
        ImputationTable table,
        OutputNames outputs
    ) {
        Objects.requireNonNull(artifactSource, "artifactSource");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(outputs, "outputs");
        if (routineName == null || routineName.isBlank()) {
            throw new IllegalArgumentException("Routine name is required");
        }
        String rendered = loadTemplate()
            .replace("{{moduleId}}", literal(moduleId))
            .replace("{{routine}}", literal(routineName))
            .replace("{{signature}}", literal(signature(table)))
            .replace("{{classification}}", literal(outputs.classification()))
            .replace("{{probability}}", literal(outputs.probability()))
            .replace("{{artifact}}", artifactSource);
        return new ScoringProgram(routineName, rendered);
    }

    public String routineName() {
        return routineName;
    }

    public String text() {
        return text;
    }

    public List<String> lines() {
        return text.lines().toList();
    }

    private static Map<String, Object> signature(ImputationTable table) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        for (ImputationEntry entry : table.entries()) {
            Map<String, Object> declaration = new LinkedHashMap<>();
            if (entry.kind() == FeatureKind.NUMERIC) {
                declaration.put("kind", "numeric");
            } else {
                declaration.put("kind", "text");
                declaration.put("length", entry.maxLength());
            }
            parameters.put(entry.name(), declaration);
        }
        return parameters;
    }

    // JSON literals are valid JavaScript expressions.
    private static String literal(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Unable to encode program parameter: " + ex.getMessage(), ex);
        }
    }

    private static String loadTemplate() {
        try (InputStream in = ScoringProgram.class.getResourceAsStream(TEMPLATE_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing scoring program template " + TEMPLATE_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read scoring program template", ex);
        }
    }
}
