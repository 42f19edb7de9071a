package in.liqmap.domain.data;

/**
 * Direction component of a trend reading.
 */
public enum TrendDirection {
    UP,
    DOWN,
    RANGING
}
