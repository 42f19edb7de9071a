package in.liqmap.domain.zone;

/**
 * Pattern that produced a liquidity zone.
 */
public enum ZoneKind {
    SUPPORT,
    RESISTANCE,
    ORDER_BLOCK,
    FAIR_VALUE_GAP,
    BREAKER_BLOCK,
    LIQUIDITY_LEVEL
}
