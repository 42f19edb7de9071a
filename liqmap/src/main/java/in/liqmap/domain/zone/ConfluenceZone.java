package in.liqmap.domain.zone;

import in.liqmap.domain.data.Timeframe;

import java.util.List;
import java.util.Set;

/**
 * Group of zones from several timeframes sitting at the same price.
 *
 * @param representative     best member; its confluenceWeight carries the group weight
 * @param confluenceWeight   sum of tf weights over distinct member timeframes
 * @param timeframes         distinct member timeframes
 * @param members            every zone in the group
 */
public record ConfluenceZone(
    LiquidityZone representative,
    int confluenceWeight,
    Set<Timeframe> timeframes,
    List<LiquidityZone> members
) {
    public ConfluenceZone {
        timeframes = Set.copyOf(timeframes);
        members = List.copyOf(members);
    }

    public int distinctTimeframes() {
        return timeframes.size();
    }
}
