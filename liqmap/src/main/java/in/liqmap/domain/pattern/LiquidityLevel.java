package in.liqmap.domain.pattern;

import in.liqmap.domain.data.Timeframe;

import java.util.ArrayList;
import java.util.List;

/**
 * Resting liquidity at equal highs (BSL) or equal lows (SSL).
 *
 * @param touchTimestamps open timestamps of the candles that touched the level, oldest first
 */
public record LiquidityLevel(
    String id,
    Timeframe timeframe,
    LevelType type,
    double price,
    List<Long> touchTimestamps,
    long createdTs,
    boolean swept,
    Long sweepTs,
    double sweepPrice
) {
    /**
     * BSL sits above equal highs (buy stops), SSL below equal lows (sell stops).
     */
    public enum LevelType {
        BSL,
        SSL
    }

    public LiquidityLevel {
        touchTimestamps = List.copyOf(touchTimestamps);
    }

    public static LiquidityLevel detected(String id, Timeframe timeframe, LevelType type,
                                          double price, List<Long> touchTimestamps) {
        return new LiquidityLevel(id, timeframe, type, price, touchTimestamps,
            touchTimestamps.get(0), false, null, 0.0);
    }

    public int touchCount() {
        return touchTimestamps.size();
    }

    public boolean hasTouchAt(long ts) {
        return touchTimestamps.contains(ts);
    }

    public LiquidityLevel withTouch(long ts) {
        List<Long> touches = new ArrayList<>(touchTimestamps);
        touches.add(ts);
        return new LiquidityLevel(id, timeframe, type, price, touches, createdTs, swept, sweepTs, sweepPrice);
    }

    public LiquidityLevel sweptAt(long ts, double extremePrice) {
        return new LiquidityLevel(id, timeframe, type, price, touchTimestamps, createdTs,
            true, ts, extremePrice);
    }
}
