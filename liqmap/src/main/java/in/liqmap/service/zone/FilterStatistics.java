package in.liqmap.service.zone;

/**
 * Cumulative filter counters of a liquidity map.
 *
 * @param atrFiltered       refreshes skipped by the volatility gate
 * @param volumeFiltered    candidates dropped for lacking a volume spike
 * @param distanceFiltered  candidates dropped for sitting too close to price
 * @param ageFiltered       zones removed for exceeding the maximum age
 * @param totalZonesCreated zones added to a zone set
 */
public record FilterStatistics(
    long atrFiltered,
    long volumeFiltered,
    long distanceFiltered,
    long ageFiltered,
    long totalZonesCreated
) {
    public static FilterStatistics empty() {
        return new FilterStatistics(0, 0, 0, 0, 0);
    }

    public long totalFiltered() {
        return atrFiltered + volumeFiltered + distanceFiltered + ageFiltered;
    }
}
