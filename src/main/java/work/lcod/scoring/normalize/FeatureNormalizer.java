package work.lcod.scoring.normalize;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.scoring.model.FeatureKind;
import work.lcod.scoring.model.FeatureRecord;
import work.lcod.scoring.model.ImputationEntry;
import work.lcod.scoring.model.ImputationTable;

/**
 * Replaces missing or unusable input values with the frozen training defaults.
 *
 * <p>Normalization never fails: a value that cannot be used on its slot is imputed, not reported.
 */
public final class FeatureNormalizer {
    private final ImputationTable table;

    public FeatureNormalizer(ImputationTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public FeatureRecord normalize(Map<String, ?> rawRecord) {
        Map<String, ?> raw = rawRecord == null ? Map.of() : rawRecord;
        Map<String, Object> clean = new LinkedHashMap<>();
        for (ImputationEntry entry : table.entries()) {
            Object value = raw.get(entry.name());
            if (entry.kind() == FeatureKind.NUMERIC) {
                clean.put(entry.name(), numeric(entry, value));
            } else {
                clean.put(entry.name(), text(value));
            }
        }
        return FeatureRecord.of(table, clean);
    }

    public ImputationTable table() {
        return table;
    }

    static double numeric(ImputationEntry entry, Object raw) {
        if (!(raw instanceof Number number)) {
            return entry.numericDefault();
        }
        double value = number.doubleValue();
        if (Double.isNaN(value)) {
            return entry.numericDefault();
        }
        return value;
    }

    static String text(Object raw) {
        if (raw instanceof String str) {
            return str.strip();
        }
        if (raw instanceof CharSequence chars) {
            return chars.toString().strip();
        }
        return "";
    }
}
