package in.liqmap.service.candle;

import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.sync.GapRange;
import in.liqmap.domain.sync.SyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * CandleSync - Sequence guard for one symbol/timeframe candle stream.
 *
 * Tracks the open timestamp of the last accepted candle and classifies every newly closed
 * candle as in-sequence, duplicate, gap or stale. On a gap it asks the backfill trigger for the
 * missing range, starting right after the last known-good candle, and keeps accepting live
 * candles without waiting for the fetch.
 *
 * {@link #seed(long)} is the only way out of the unseeded state; the first-candle bootstrap goes
 * through it too. Interior gaps already present in persisted history are not rescanned here.
 */
public final class CandleSync {
    private static final Logger log = LoggerFactory.getLogger(CandleSync.class);

    /** Largest gap accepted as real; anything wider is a timestamp unit mismatch. */
    static final long MAX_GAP_CANDLES = Integer.MAX_VALUE;

    private final String symbol;
    private final Timeframe timeframe;
    private final long intervalSeconds;
    private final BackfillTrigger backfillTrigger;

    // null until seeded
    private Long lastOpenTs;

    public CandleSync(String symbol, Timeframe timeframe, BackfillTrigger backfillTrigger) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.timeframe = Objects.requireNonNull(timeframe, "timeframe");
        this.intervalSeconds = timeframe.getIntervalSeconds();
        this.backfillTrigger = Objects.requireNonNull(backfillTrigger, "backfillTrigger");
    }

    /**
     * Set the last known-good open timestamp, normally from the latest persisted candle.
     *
     * Later candles must sit a whole number of intervals away from it.
     */
    public synchronized void seed(long openTs) {
        this.lastOpenTs = openTs;
        log.info("[SYNC] {} {} seeded at lastOpenTs={}", symbol, timeframe, openTs);
    }

    /**
     * Forget the sequence position. The next seed() or live candle re-initializes it.
     */
    public synchronized void resync() {
        log.info("[SYNC] {} {} resync requested (lastOpenTs was {})", symbol, timeframe, lastOpenTs);
        this.lastOpenTs = null;
    }

    /**
     * Classify a closed candle and update sequence state.
     *
     * Never throws for sequencing problems; the outcome is in the returned result.
     */
    public synchronized SyncResult onClosedCandle(Candle candle) {
        String invalid = validate(candle);
        if (invalid != null) {
            log.warn("[SYNC] {} {} rejected invalid candle: {}", symbol, timeframe, invalid);
            return SyncResult.invalid(candle, invalid);
        }

        long openTs = candle.openTs();

        if (lastOpenTs == null) {
            seed(openTs);
            return SyncResult.bootstrap(candle);
        }

        long last = lastOpenTs;
        long expectedNext = last + intervalSeconds;

        if ((openTs - last) % intervalSeconds != 0) {
            String reason = "openTs " + openTs + " is off the " + intervalSeconds + "s grid anchored at " + last;
            log.warn("[SYNC] {} {} rejected invalid candle: {}", symbol, timeframe, reason);
            return SyncResult.invalid(candle, reason);
        }

        if (openTs == expectedNext) {
            lastOpenTs = openTs;
            return SyncResult.inSequence(candle);
        }

        if (openTs == last) {
            log.debug("[SYNC] {} {} duplicate candle at {}", symbol, timeframe, openTs);
            return SyncResult.duplicate(candle);
        }

        if (openTs < last) {
            log.warn("[SYNC] {} {} rejected stale candle openTs={} (last accepted {})",
                symbol, timeframe, openTs, last);
            return SyncResult.stale(candle, last);
        }

        GapRange gap = new GapRange(expectedNext, openTs - intervalSeconds, intervalSeconds);
        if (gap.missingCount() > MAX_GAP_CANDLES) {
            String reason = "openTs " + openTs + " is " + gap.missingCount() + " intervals past " + last;
            log.warn("[SYNC] {} {} rejected invalid candle: {}", symbol, timeframe, reason);
            return SyncResult.invalid(candle, reason);
        }
        log.info("[SYNC] {} {} gap detected: {} missing candle(s) [{}, {}]",
            symbol, timeframe, gap.missingCount(), gap.startTs(), gap.endTs());
        lastOpenTs = openTs;
        requestBackfill(gap);
        return SyncResult.gap(candle, gap);
    }

    private void requestBackfill(GapRange gap) {
        try {
            backfillTrigger.requestBackfill(symbol, timeframe, gap);
        } catch (RuntimeException e) {
            log.error("[SYNC] {} {} failed to request backfill from {}: {}",
                symbol, timeframe, gap.startTs(), e.getMessage(), e);
        }
    }

    private String validate(Candle candle) {
        if (candle == null) {
            return "null candle";
        }
        if (!symbol.equals(candle.symbol())) {
            return "symbol " + candle.symbol() + " does not match " + symbol;
        }
        if (candle.timeframe() != timeframe) {
            return "timeframe " + candle.timeframe() + " does not match " + timeframe;
        }
        if (!candle.closed()) {
            return "candle at " + candle.openTs() + " is not closed";
        }
        return priceProblem(candle);
    }

    private static String priceProblem(Candle candle) {
        double o = candle.open();
        double h = candle.high();
        double l = candle.low();
        double c = candle.close();
        if (!Double.isFinite(o) || !Double.isFinite(h) || !Double.isFinite(l) || !Double.isFinite(c)
            || !Double.isFinite(candle.volume())) {
            return "candle at " + candle.openTs() + " has non-finite values";
        }
        if (h < l) {
            return "candle at " + candle.openTs() + " has high " + h + " below low " + l;
        }
        if (o < l || o > h || c < l || c > h) {
            return "candle at " + candle.openTs() + " has open/close outside [" + l + ", " + h + "]";
        }
        if (candle.volume() < 0) {
            return "candle at " + candle.openTs() + " has negative volume";
        }
        return null;
    }

    public synchronized OptionalLong lastOpenTs() {
        return lastOpenTs == null ? OptionalLong.empty() : OptionalLong.of(lastOpenTs);
    }

    public synchronized boolean isSeeded() {
        return lastOpenTs != null;
    }

    public String getSymbol() {
        return symbol;
    }

    public Timeframe getTimeframe() {
        return timeframe;
    }
}
