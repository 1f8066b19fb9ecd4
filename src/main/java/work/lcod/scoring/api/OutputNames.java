package work.lcod.scoring.api;

/**
 * Names of the two fields the scoring routine produces.
 */
public record OutputNames(String classification, String probability) {
    public static final OutputNames DEFAULT = new OutputNames("EM_CLASSIFICATION", "EM_EVENTPROBABILITY");

    public OutputNames {
        if (classification == null || classification.isBlank()) {
            throw new IllegalArgumentException("Classification output name is required");
        }
        if (probability == null || probability.isBlank()) {
            throw new IllegalArgumentException("Probability output name is required");
        }
        if (classification.equals(probability)) {
            throw new IllegalArgumentException("Output names must differ: " + classification);
        }
    }
}
