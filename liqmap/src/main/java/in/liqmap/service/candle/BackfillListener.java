package in.liqmap.service.candle;

import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.sync.GapRange;

import java.util.List;

/**
 * Notified when a backfill fetch returns candles inside a gap.
 */
@FunctionalInterface
public interface BackfillListener {

    /**
     * @param recovered candles inside the gap, ascending by openTs, possibly fewer than missing
     */
    void onBackfill(String symbol, Timeframe timeframe, GapRange gap, List<Candle> recovered);
}
