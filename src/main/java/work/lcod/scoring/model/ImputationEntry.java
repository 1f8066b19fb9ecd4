package work.lcod.scoring.model;

import java.util.Objects;

/**
 * Frozen training-time default for one feature.
 *
 * <p>Numeric entries carry a finite default (typically the training mean). Text entries always default to the
 * empty string and declare the maximum length the scoring routine accepts.
 */
public record ImputationEntry(String name, FeatureKind kind, double numericDefault, int maxLength) {
    public static final int DEFAULT_TEXT_LENGTH = 100;

    public ImputationEntry {
        Objects.requireNonNull(kind, "kind");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Feature name is required");
        }
        if (kind == FeatureKind.NUMERIC && !Double.isFinite(numericDefault)) {
            throw new IllegalArgumentException("Numeric default for " + name + " must be finite");
        }
        if (kind == FeatureKind.TEXT && maxLength < 1) {
            throw new IllegalArgumentException("Text length for " + name + " must be positive");
        }
    }

    public static ImputationEntry numeric(String name, double defaultValue) {
        return new ImputationEntry(name, FeatureKind.NUMERIC, defaultValue, 0);
    }

    public static ImputationEntry text(String name) {
        return text(name, DEFAULT_TEXT_LENGTH);
    }

    public static ImputationEntry text(String name, int maxLength) {
        return new ImputationEntry(name, FeatureKind.TEXT, 0d, maxLength);
    }

    /** Default as a boxed value: a {@link Double} for numeric features, {@code ""} for text. */
    public Object defaultValue() {
        return kind == FeatureKind.NUMERIC ? Double.valueOf(numericDefault) : "";
    }
}
