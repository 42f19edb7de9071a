package in.liqmap.service.candle;

import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.sync.GapRange;

/**
 * Receives gap ranges detected by a CandleSync.
 *
 * Implementations must return immediately; the fetch itself runs elsewhere.
 */
@FunctionalInterface
public interface BackfillTrigger {

    void requestBackfill(String symbol, Timeframe timeframe, GapRange gap);
}
