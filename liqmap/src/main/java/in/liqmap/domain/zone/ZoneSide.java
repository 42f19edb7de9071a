package in.liqmap.domain.zone;

/**
 * Which side of price a zone is expected to defend.
 */
public enum ZoneSide {
    /** Demand: expected to hold price from below. */
    SUPPORT,

    /** Supply: expected to cap price from above. */
    RESISTANCE
}
