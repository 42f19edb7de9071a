package in.liqmap.domain.zone;

/**
 * Zone strength classification, ordered weakest first.
 */
public enum ZoneStrength {
    WEAK(1),
    MODERATE(2),
    STRONG(3);

    private final int rank;

    ZoneStrength(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean isAtLeast(ZoneStrength other) {
        return rank >= other.rank;
    }

    /**
     * Map a normalized score (0..1) to a strength bucket.
     * Scores above 0.7 are strong, above 0.4 moderate.
     */
    public static ZoneStrength fromScore(double score) {
        if (score > 0.7) {
            return STRONG;
        } else if (score > 0.4) {
            return MODERATE;
        }
        return WEAK;
    }
}
