package com.example.smartbin.analytics;

import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.BinProfile;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions event batches per bin and derives the per-bin profile and histograms.
 * Stateless: every histogram is allocated per call.
 */
public final class EventWindowAggregator {

    private EventWindowAggregator() {
    }

    /**
     * Groups events by bin id, keeping the order in which bins and events were received.
     */
    public static Map<String, List<BinEvent>> groupByBin(Collection<BinEvent> events) {
        Map<String, List<BinEvent>> groups = new LinkedHashMap<>();
        for (BinEvent event : events) {
            groups.computeIfAbsent(event.binId(), k -> new ArrayList<>()).add(event);
        }
        return groups;
    }

    /**
     * Builds the profile from the first event's joined bin fields.
     */
    public static BinProfile buildProfile(List<BinEvent> eventsForBin) {
        if (eventsForBin.isEmpty()) {
            return BinProfile.defaults(null);
        }
        BinEvent first = eventsForBin.get(0);
        return BinProfile.of(first.binId(), first.locationClass(), first.ratedCapacityKg(), first.locationLabel());
    }

    public static List<BinEvent> sortedByTime(Collection<BinEvent> events) {
        List<BinEvent> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparing(BinEvent::timestamp));
        return sorted;
    }

    public static int[] hourlyHistogram(Collection<BinEvent> events, ZoneId zone) {
        int[] buckets = new int[24];
        for (BinEvent event : events) {
            buckets[event.timestamp().atZone(zone).getHour()]++;
        }
        return buckets;
    }

    /**
     * Seven buckets, Monday at index 0.
     */
    public static int[] weekdayHistogram(Collection<BinEvent> events, ZoneId zone) {
        int[] buckets = new int[7];
        for (BinEvent event : events) {
            buckets[event.timestamp().atZone(zone).getDayOfWeek().getValue() - 1]++;
        }
        return buckets;
    }

    public static int[] monthlyHistogram(Collection<BinEvent> events, ZoneId zone) {
        int[] buckets = new int[12];
        for (BinEvent event : events) {
            buckets[event.timestamp().atZone(zone).getMonthValue() - 1]++;
        }
        return buckets;
    }

    public static int max(int[] buckets) {
        int max = 0;
        for (int b : buckets) {
            max = Math.max(max, b);
        }
        return max;
    }

    public static double mean(int[] buckets) {
        long total = 0;
        for (int b : buckets) {
            total += b;
        }
        return buckets.length == 0 ? 0.0 : (double) total / buckets.length;
    }
}
