package work.lcod.scoring.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fully populated, ordered feature row: every value is a {@link Double} or a {@link String}.
 */
public final class FeatureRecord {
    private final Map<String, Object> values;

    FeatureRecord(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static FeatureRecord of(ImputationTable table, Map<String, Object> values) {
        Objects.requireNonNull(table, "table");
        Map<String, Object> ordered = new LinkedHashMap<>();
        for (ImputationEntry entry : table.entries()) {
            Object value = values.get(entry.name());
            if (entry.kind() == FeatureKind.NUMERIC && !(value instanceof Double)) {
                throw new IllegalArgumentException("Feature " + entry.name() + " must be a double, got " + value);
            }
            if (entry.kind() == FeatureKind.TEXT && !(value instanceof String)) {
                throw new IllegalArgumentException("Feature " + entry.name() + " must be a string, got " + value);
            }
            ordered.put(entry.name(), value);
        }
        return new FeatureRecord(ordered);
    }

    public double numeric(String name) {
        return (Double) require(name);
    }

    public String text(String name) {
        return (String) require(name);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public List<String> names() {
        return List.copyOf(values.keySet());
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private Object require(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Unknown feature " + name);
        }
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof FeatureRecord record)) return false;
        return values.equals(record.values) && names().equals(record.names());
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureRecord" + values;
    }
}
