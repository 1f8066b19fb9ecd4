package work.lcod.scoring.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only, ordered feature table of a deployed model. Its order is the order in which features are normalized
 * and bound into the scoring session.
 */
public final class ImputationTable {
    private final Map<String, ImputationEntry> entries;

    private ImputationTable(Map<String, ImputationEntry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static ImputationTable of(List<ImputationEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("Imputation table requires at least one feature");
        }
        Map<String, ImputationEntry> ordered = new LinkedHashMap<>();
        for (ImputationEntry entry : entries) {
            if (ordered.putIfAbsent(entry.name(), entry) != null) {
                throw new IllegalArgumentException("Duplicate feature: " + entry.name());
            }
        }
        return new ImputationTable(ordered);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ImputationEntry lookup(String featureName) {
        ImputationEntry entry = entries.get(featureName);
        if (entry == null) {
            throw new IllegalArgumentException("No imputation entry for feature " + featureName);
        }
        return entry;
    }

    public boolean contains(String featureName) {
        return entries.containsKey(featureName);
    }

    public List<String> featureNames() {
        return List.copyOf(entries.keySet());
    }

    public List<ImputationEntry> entries() {
        return List.copyOf(entries.values());
    }

    public int size() {
        return entries.size();
    }

    public static final class Builder {
        private final List<ImputationEntry> entries = new ArrayList<>();

        public Builder numeric(String name, double defaultValue) {
            entries.add(ImputationEntry.numeric(name, defaultValue));
            return this;
        }

        public Builder text(String name) {
            entries.add(ImputationEntry.text(name));
            return this;
        }

        public Builder text(String name, int maxLength) {
            entries.add(ImputationEntry.text(name, maxLength));
            return this;
        }

        public Builder add(ImputationEntry entry) {
            entries.add(entry);
            return this;
        }

        public ImputationTable build() {
            return ImputationTable.of(entries);
        }
    }
}
