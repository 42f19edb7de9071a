package in.liqmap.service.candle;

import in.liqmap.domain.data.Candle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Rolling window of the most recent closed candles for one symbol/timeframe, ordered by openTs.
 *
 * A candle with an openTs already present replaces the stored one. Backfilled candles land in
 * their ordered position.
 */
public final class CandleWindow {

    private final int capacity;
    private final NavigableMap<Long, Candle> candles = new TreeMap<>();

    public CandleWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void add(Candle candle) {
        candles.put(candle.openTs(), candle);
        trim();
    }

    public synchronized void addAll(List<Candle> batch) {
        for (Candle c : batch) {
            candles.put(c.openTs(), c);
        }
        trim();
    }

    /**
     * Immutable copy, oldest first.
     */
    public synchronized List<Candle> snapshot() {
        return List.copyOf(new ArrayList<>(candles.values()));
    }

    /**
     * Newest run of candles with no missing interval between them, oldest first.
     */
    public synchronized List<Candle> contiguousTail() {
        List<Candle> tail = new ArrayList<>();
        Candle next = null;
        for (Candle c : candles.descendingMap().values()) {
            if (next != null && c.openTs() + c.timeframe().getIntervalSeconds() != next.openTs()) {
                break;
            }
            tail.add(c);
            next = c;
        }
        Collections.reverse(tail);
        return List.copyOf(tail);
    }

    public synchronized Candle latest() {
        Map.Entry<Long, Candle> last = candles.lastEntry();
        return last == null ? null : last.getValue();
    }

    public synchronized int size() {
        return candles.size();
    }

    private void trim() {
        while (candles.size() > capacity) {
            candles.pollFirstEntry();
        }
    }
}
