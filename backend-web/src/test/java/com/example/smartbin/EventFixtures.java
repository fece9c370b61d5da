package com.example.smartbin;

import com.example.smartbin.model.BinEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Event builders shared by the tests. {@link #MONDAY} is 2024-03-04T00:00Z.
 */
public final class EventFixtures {

    public static final Instant MONDAY = Instant.parse("2024-03-04T00:00:00Z");

    private EventFixtures() {
    }

    public static BinEvent.BinEventBuilder builder(String binId, Instant timestamp) {
        return BinEvent.builder().binId(binId).timestamp(timestamp);
    }

    public static BinEvent at(String binId, Instant timestamp) {
        return builder(binId, timestamp).build();
    }

    public static BinEvent weighed(String binId, Instant timestamp, double weightKg) {
        return builder(binId, timestamp).weightKg(weightKg).build();
    }

    /**
     * One event per weight, {@code step} apart, starting at {@code start}.
     */
    public static List<BinEvent> weightSeries(String binId, Instant start, Duration step, double... weights) {
        List<BinEvent> events = new ArrayList<>();
        for (int i = 0; i < weights.length; i++) {
            events.add(builder(binId, start.plus(step.multipliedBy(i)))
                    .eventId((long) i + 1)
                    .weightKg(weights[i])
                    .build());
        }
        return events;
    }
}
