package in.liqmap.domain.data;

import java.util.Objects;

/**
 * Trend reading supplied by an upstream trend detector.
 *
 * The liquidity map consumes it read-only to adapt detection parameters.
 */
public record TrendState(TrendDirection direction, TrendStrength strength) {
    public TrendState {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(strength, "strength");
    }

    public static TrendState of(TrendDirection direction, TrendStrength strength) {
        return new TrendState(direction, strength);
    }
}
