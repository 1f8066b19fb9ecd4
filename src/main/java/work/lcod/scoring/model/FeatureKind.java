package work.lcod.scoring.model;

import java.util.Locale;

/**
 * Declared type of a model input, as the scoring routine expects it.
 */
public enum FeatureKind {
    NUMERIC,
    TEXT;

    public static FeatureKind from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Feature kind is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "numeric", "number", "double", "interval" -> NUMERIC;
            case "text", "string", "char", "varchar", "nominal" -> TEXT;
            default -> throw new IllegalArgumentException("Unsupported feature kind: " + value);
        };
    }
}
