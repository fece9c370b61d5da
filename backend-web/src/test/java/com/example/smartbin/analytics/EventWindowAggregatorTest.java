package com.example.smartbin.analytics;

import com.example.smartbin.EventFixtures;
import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.BinProfile;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class EventWindowAggregatorTest {

    private static final Instant T0 = EventFixtures.MONDAY.plus(Duration.ofHours(9));

    @Test
    public void testGroupByBinIsAnExactPartition() {
        BinEvent a1 = EventFixtures.at("a", T0);
        BinEvent b1 = EventFixtures.at("b", T0.plusSeconds(60));
        BinEvent a2 = EventFixtures.at("a", T0.plusSeconds(120));
        BinEvent c1 = EventFixtures.at("c", T0.plusSeconds(30));

        Map<String, List<BinEvent>> groups = EventWindowAggregator.groupByBin(List.of(a1, b1, a2, c1));

        assertEquals(List.of("a", "b", "c"), new ArrayList<>(groups.keySet()));
        assertEquals(List.of(a1, a2), groups.get("a"));
        assertEquals(List.of(b1), groups.get("b"));
        assertEquals(List.of(c1), groups.get("c"));
        assertEquals(4, groups.values().stream().mapToInt(List::size).sum());
    }

    @Test
    public void testBuildProfileFromFirstEvent() {
        BinEvent latest = EventFixtures.builder("bin-1", T0)
                .locationClass("residential")
                .ratedCapacityKg(80.0)
                .locationLabel("Block C")
                .build();
        BinEvent older = EventFixtures.builder("bin-1", T0.minusSeconds(600))
                .locationClass("commercial")
                .build();

        BinProfile profile = EventWindowAggregator.buildProfile(List.of(latest, older));

        assertEquals(new BinProfile("bin-1", "residential", 80.0, "Block C"), profile);
    }

    @Test
    public void testBuildProfileAppliesDefaults() {
        BinProfile profile = EventWindowAggregator.buildProfile(List.of(EventFixtures.at("bin-2", T0)));
        assertEquals(new BinProfile("bin-2", "unknown", 100.0, "Unknown"), profile);

        BinProfile empty = EventWindowAggregator.buildProfile(List.of());
        assertNull(empty.binId());
        assertEquals(100.0, empty.ratedCapacityKg());
    }

    @Test
    public void testSortedByTimeLeavesInputUntouched() {
        BinEvent late = EventFixtures.at("a", T0.plusSeconds(300));
        BinEvent early = EventFixtures.at("a", T0);
        List<BinEvent> input = List.of(late, early);

        assertEquals(List.of(early, late), EventWindowAggregator.sortedByTime(input));
        assertEquals(List.of(late, early), input);
    }

    @Test
    public void testHistogramsUseTheConfiguredZone() {
        // 23:30 UTC on Monday is 06:30 on Tuesday in Ho Chi Minh City
        BinEvent event = EventFixtures.at("a", EventFixtures.MONDAY.plus(Duration.ofMinutes(23 * 60 + 30)));

        int[] utcHours = EventWindowAggregator.hourlyHistogram(List.of(event), ZoneId.of("UTC"));
        int[] localHours = EventWindowAggregator.hourlyHistogram(List.of(event), ZoneId.of("Asia/Ho_Chi_Minh"));
        int[] localDays = EventWindowAggregator.weekdayHistogram(List.of(event), ZoneId.of("Asia/Ho_Chi_Minh"));

        assertEquals(1, utcHours[23]);
        assertEquals(1, localHours[6]);
        assertEquals(1, localDays[1]);
        assertEquals(1, EventWindowAggregator.monthlyHistogram(List.of(event), ZoneId.of("UTC"))[2]);
    }

    @Test
    public void testMaxAndMean() {
        int[] buckets = {0, 3, 1, 0};
        assertEquals(3, EventWindowAggregator.max(buckets));
        assertEquals(1.0, EventWindowAggregator.mean(buckets));
    }
}
