package in.liqmap.service.indicator;

/**
 * Volatility regime relative to a historical ATR baseline.
 */
public enum Volatility {
    LOW,
    NORMAL,
    HIGH
}
