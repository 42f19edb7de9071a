package in.liqmap.domain.zone;

/**
 * Refresh pipeline stages that can discard zones or skip detection.
 */
public enum FilterStage {
    /** Volatility gate skipped detection for a refresh. */
    ATR("atr"),

    /** Candidate origin candle lacked a volume spike. */
    VOLUME("volume"),

    /** Candidate too close to current price. */
    DISTANCE("distance"),

    /** Existing zone exceeded its maximum age. */
    AGE("age");

    private final String label;

    FilterStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
