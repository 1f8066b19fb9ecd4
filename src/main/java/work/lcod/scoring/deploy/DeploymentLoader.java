package work.lcod.scoring.deploy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.scoring.api.OutputNames;
import work.lcod.scoring.model.FeatureKind;
import work.lcod.scoring.model.ImputationEntry;
import work.lcod.scoring.model.ImputationTable;

/**
 * Reads deployment descriptors from TOML, YAML or JSON files.
 */
public final class DeploymentLoader {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private DeploymentLoader() {}

    public static DeploymentDescriptor load(Path path) {
        Path file = path.toAbsolutePath().normalize();
        if (!Files.isRegularFile(file)) {
            throw new UncheckedIOException(new IOException("Deployment descriptor not found: " + file));
        }
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        Map<String, Object> raw;
        try {
            if (name.endsWith(".toml")) {
                raw = readToml(file);
            } else if (name.endsWith(".yaml") || name.endsWith(".yml")) {
                raw = YAML.readValue(file.toFile(), MAP_REF);
            } else if (name.endsWith(".json")) {
                raw = JSON.readValue(file.toFile(), MAP_REF);
            } else {
                throw new IllegalArgumentException("Unsupported descriptor format: " + file.getFileName());
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read deployment descriptor " + file, ex);
        }
        Path baseDir = file.getParent();
        return fromMap(raw == null ? Map.of() : raw, baseDir);
    }

    static DeploymentDescriptor fromMap(Map<String, Object> raw, Path baseDir) {
        Map<String, Object> deployment = asObject(raw.get("deployment"));
        String artifact = requireString(deployment, "artifact", "deployment");
        Path artifactPath = Path.of(artifact);
        if (!artifactPath.isAbsolute() && baseDir != null) {
            artifactPath = baseDir.resolve(artifactPath);
        }

        Map<String, Object> outputs = asObject(raw.get("outputs"));
        OutputNames outputNames = new OutputNames(
            stringOr(outputs.get("classification"), OutputNames.DEFAULT.classification()),
            stringOr(outputs.get("probability"), OutputNames.DEFAULT.probability())
        );

        return DeploymentDescriptor.builder()
            .moduleId(requireString(deployment, "module", "deployment"))
            .routineName(requireString(deployment, "routine", "deployment"))
            .artifact(artifactPath.normalize())
            .outputNames(outputNames)
            .imputationTable(readFeatures(raw.get("features")))
            .build();
    }

    private static ImputationTable readFeatures(Object rawFeatures) {
        if (!(rawFeatures instanceof List<?> list) || list.isEmpty()) {
            throw new IllegalArgumentException("Deployment descriptor must declare at least one feature");
        }
        List<ImputationEntry> entries = new ArrayList<>();
        for (Object item : list) {
            Map<String, Object> feature = asObject(item);
            String name = requireString(feature, "name", "features");
            FeatureKind kind = FeatureKind.from(requireString(feature, "kind", "feature " + name));
            if (kind == FeatureKind.NUMERIC) {
                Object value = feature.get("default");
                if (!(value instanceof Number number)) {
                    throw new IllegalArgumentException("Numeric feature " + name + " requires a numeric default");
                }
                entries.add(ImputationEntry.numeric(name, number.doubleValue()));
            } else {
                Object length = feature.get("length");
                int maxLength = length instanceof Number number ? number.intValue() : ImputationEntry.DEFAULT_TEXT_LENGTH;
                Object fallback = feature.get("default");
                if (fallback != null && !"".equals(fallback)) {
                    throw new IllegalArgumentException("Text feature " + name + " must default to the empty string");
                }
                entries.add(ImputationEntry.text(name, maxLength));
            }
        }
        return ImputationTable.of(entries);
    }

    private static Map<String, Object> readToml(Path file) throws IOException {
        TomlParseResult result = Toml.parse(file);
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid TOML in " + file.getFileName() + ": " + errors);
        }
        return tableToMap(result);
    }

    private static Map<String, Object> tableToMap(TomlTable table) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : table.keySet()) {
            map.put(key, tomlValue(table.get(List.of(key))));
        }
        return map;
    }

    private static Object tomlValue(Object value) {
        if (value instanceof TomlTable table) {
            return tableToMap(table);
        }
        if (value instanceof TomlArray array) {
            List<Object> list = new ArrayList<>();
            for (int i = 0; i < array.size(); i++) {
                list.add(tomlValue(array.get(i)));
            }
            return list;
        }
        return value;
    }

    private static String requireString(Map<String, Object> map, String key, String section) {
        Object value = map.get(key);
        if (!(value instanceof String str) || str.isBlank()) {
            throw new IllegalArgumentException("Missing '" + key + "' in " + section);
        }
        return str.trim();
    }

    private static String stringOr(Object value, String fallback) {
        return value instanceof String str && !str.isBlank() ? str.trim() : fallback;
    }

    private static Map<String, Object> asObject(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, entry) -> copy.put(String.valueOf(key), entry));
        return copy;
    }
}
