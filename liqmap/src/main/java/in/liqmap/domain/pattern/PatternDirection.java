package in.liqmap.domain.pattern;

import in.liqmap.domain.zone.ZoneSide;

/**
 * Polarity of a price-action pattern.
 */
public enum PatternDirection {
    BULLISH,
    BEARISH;

    public PatternDirection opposite() {
        return this == BULLISH ? BEARISH : BULLISH;
    }

    /**
     * Bullish patterns defend price from below, bearish ones from above.
     */
    public ZoneSide side() {
        return this == BULLISH ? ZoneSide.SUPPORT : ZoneSide.RESISTANCE;
    }
}
