package in.liqmap.domain.zone;

/**
 * Where a price sits inside the recent trading range.
 */
public enum PdPosition {
    /** Above the equilibrium band: expensive. */
    PREMIUM,

    /** Within the band around the 50% level. */
    EQUILIBRIUM,

    /** Below the equilibrium band: cheap. */
    DISCOUNT
}
