package in.liqmap.application.port.output;

import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;

import java.util.List;
import java.util.Optional;

/**
 * Port for historical candle access (exchange REST client and/or persisted store).
 */
public interface CandleHistorySource {

    /**
     * Fetch up to limit closed candles starting at startTimeInclusive (epoch seconds).
     *
     * @return candles in ascending openTs order, without duplicates
     */
    List<Candle> fetchCandles(String symbol, Timeframe timeframe, long startTimeInclusive, int limit);

    /**
     * Latest persisted candle, used once per symbol/timeframe at startup to seed sync state.
     */
    Optional<Candle> getLastCandle(String symbol, Timeframe timeframe);
}
