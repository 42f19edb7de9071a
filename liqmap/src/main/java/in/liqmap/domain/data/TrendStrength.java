package in.liqmap.domain.data;

/**
 * Strength component of a trend reading.
 *
 * Only the coarse bucket matters for parameter adaptation: {@link #isStrong()} and
 * {@link #isWeak()} decide whether the active timeframe config is tightened or loosened.
 */
public enum TrendStrength {
    VERY_WEAK,
    WEAK,
    MODERATE,
    STRONG,
    VERY_STRONG;

    public boolean isStrong() {
        return this == STRONG || this == VERY_STRONG;
    }

    public boolean isWeak() {
        return this == WEAK || this == VERY_WEAK;
    }
}
