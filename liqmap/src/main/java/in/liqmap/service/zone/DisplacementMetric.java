package in.liqmap.service.zone;

/**
 * Ranking used to pick the strongest displacement.
 */
public enum DisplacementMetric {
    MOVE_PCT,
    VOLUME_SURGE,
    CANDLE_COUNT
}
