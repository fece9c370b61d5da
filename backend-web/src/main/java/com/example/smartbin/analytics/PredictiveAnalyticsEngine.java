package com.example.smartbin.analytics;

import com.example.smartbin.ai.DelegatedInsightClient;
import com.example.smartbin.ai.PredictionContext;
import com.example.smartbin.config.AnalyticsProperties;
import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.BinProfile;
import com.example.smartbin.model.Severity;
import com.example.smartbin.model.prediction.BinPredictions;
import com.example.smartbin.model.prediction.CapacityForecast;
import com.example.smartbin.model.prediction.CollectionCadence;
import com.example.smartbin.model.prediction.CollectionPlan;
import com.example.smartbin.model.prediction.DayShare;
import com.example.smartbin.model.prediction.HourShare;
import com.example.smartbin.model.prediction.Horizon;
import com.example.smartbin.model.prediction.MaintenanceForecast;
import com.example.smartbin.model.prediction.MaintenanceRisk;
import com.example.smartbin.model.prediction.NarrativeInsight;
import com.example.smartbin.model.prediction.PredictionOptions;
import com.example.smartbin.model.prediction.PredictionStatus;
import com.example.smartbin.model.prediction.RevenueForecast;
import com.example.smartbin.model.prediction.Seasonality;
import com.example.smartbin.model.prediction.Trend;
import com.example.smartbin.model.prediction.UsageForecast;
import com.example.smartbin.service.EventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Multi-horizon forecasts for one bin, derived from its recent event history.
 * Always answers with a complete {@link BinPredictions}; failures degrade to the default object.
 */
@Slf4j
@Service
public class PredictiveAnalyticsEngine {

    static final double CAPACITY_BUFFER = 1.2;
    static final double PURITY_BONUS = 1.1;

    private static final long DAY_MILLIS = Duration.ofDays(1).toMillis();

    private final EventStore eventStore;
    private final DelegatedInsightClient insightClient;
    private final AnalyticsProperties properties;
    private final Clock clock;

    public PredictiveAnalyticsEngine(EventStore eventStore,
                                     DelegatedInsightClient insightClient,
                                     AnalyticsProperties properties,
                                     Clock clock) {
        this.eventStore = eventStore;
        this.insightClient = insightClient;
        this.properties = properties;
        this.clock = clock;
    }

    public BinPredictions predict(String binId) {
        return generatePredictions(binId, PredictionOptions.defaults());
    }

    public BinPredictions generatePredictions(String binId, PredictionOptions options) {
        Instant now = clock.instant();
        try {
            List<BinEvent> events = eventStore.fetchBinEvents(binId, now.minus(properties.predictionWindow()));
            if (events.isEmpty()) {
                log.info("No history for bin {}, returning default predictions", binId);
                return defaultPredictions(binId, now, PredictionStatus.NO_HISTORY, null, options.currentCadence());
            }
            BinProfile profile = eventStore.fetchBinProfile(binId)
                    .orElseGet(() -> EventWindowAggregator.buildProfile(events));
            return predictFrom(binId, events, profile, options, now);
        } catch (RuntimeException e) {
            log.error("Prediction failed for bin {}", binId, e);
            return defaultPredictions(binId, now, PredictionStatus.ERROR, e.getMessage(), options.currentCadence());
        }
    }

    BinPredictions predictFrom(String binId, List<BinEvent> events, BinProfile profile,
                               PredictionOptions options, Instant now) {
        double dailyAverage = dailyAverageWeight(events);
        List<HourShare> peakHours = peakHours(events);

        return new BinPredictions(
                binId,
                now,
                PredictionStatus.SUCCESS,
                null,
                events.size(),
                capacity(events, dailyAverage),
                usage(events, peakHours, now),
                collection(dailyAverage, profile, peakHours, options.currentCadence()),
                revenue(events, dailyAverage),
                maintenance(events, dailyAverage, profile, now),
                narrative(binId, events, profile, options)
        );
    }

    /**
     * Total weight divided by the number of distinct calendar days that saw at least one event.
     */
    double dailyAverageWeight(List<BinEvent> events) {
        Map<LocalDate, Double> perDay = new HashMap<>();
        for (BinEvent event : events) {
            perDay.merge(event.timestamp().atZone(properties.zone()).toLocalDate(), event.weightOrZero(), Double::sum);
        }
        if (perDay.isEmpty()) {
            return 0.0;
        }
        double total = perDay.values().stream().mapToDouble(Double::doubleValue).sum();
        return total / perDay.size();
    }

    /**
     * {@code min(0.95, n/100) * max(0.5, 1 - days/30) * horizonFactor}, two decimals.
     */
    static double confidence(List<BinEvent> events, Horizon horizon) {
        double base = Math.min(0.95, events.size() / 100.0);
        double recency = Math.max(0.5, 1 - daysSpanned(events) / 30.0);
        return round2(base * recency * horizon.confidenceFactor());
    }

    static long daysSpanned(List<BinEvent> events) {
        if (events.isEmpty()) {
            return 0;
        }
        Instant first = events.get(0).timestamp();
        Instant last = first;
        for (BinEvent event : events) {
            if (event.timestamp().isBefore(first)) {
                first = event.timestamp();
            }
            if (event.timestamp().isAfter(last)) {
                last = event.timestamp();
            }
        }
        long spanMillis = Duration.between(first, last).toMillis();
        return (spanMillis + DAY_MILLIS - 1) / DAY_MILLIS;
    }

    private Map<Horizon, CapacityForecast> capacity(List<BinEvent> events, double dailyAverage) {
        CapacityForecast.Factors factors = new CapacityForecast.Factors(
                round2(dailyAverage),
                trend(events),
                seasonality(events),
                (int) Math.round((CAPACITY_BUFFER - 1) * 100));
        Map<Horizon, CapacityForecast> forecasts = new EnumMap<>(Horizon.class);
        for (Horizon horizon : Horizon.values()) {
            forecasts.put(horizon, new CapacityForecast(
                    round2(dailyAverage * horizon.days() * CAPACITY_BUFFER),
                    confidence(events, horizon),
                    factors));
        }
        return forecasts;
    }

    /**
     * Mean weight of the latest seven events against the seven before them.
     */
    static Trend trend(List<BinEvent> events) {
        if (events.size() < 7) {
            return Trend.stable();
        }
        List<BinEvent> sorted = EventWindowAggregator.sortedByTime(events);
        int n = sorted.size();
        List<BinEvent> recent = sorted.subList(n - 7, n);
        List<BinEvent> older = sorted.subList(Math.max(0, n - 14), n - 7);
        if (older.isEmpty()) {
            return Trend.stable();
        }
        double slope = round2(meanWeight(recent) - meanWeight(older));
        String direction = slope > 0 ? "increasing" : slope < 0 ? "decreasing" : "stable";
        return new Trend(direction, slope);
    }

    Seasonality seasonality(List<BinEvent> events) {
        int[] weekly = EventWindowAggregator.weekdayHistogram(events, properties.zone());
        double avg = EventWindowAggregator.mean(weekly);
        double variance = 0;
        for (int count : weekly) {
            variance += (count - avg) * (count - avg);
        }
        variance /= weekly.length;
        double strength = avg > 0 ? Math.min(1.0, variance / avg) : 0.0;
        return new Seasonality(variance > avg * 0.5, round2(strength), Arrays.stream(weekly).boxed().toList());
    }

    private UsageForecast usage(List<BinEvent> events, List<HourShare> peakHours, Instant now) {
        long days = events.stream()
                .map(e -> e.timestamp().atZone(properties.zone()).toLocalDate())
                .distinct()
                .count();
        double eventsPerDay = (double) events.size() / days;
        double seasonal = seasonalRatio(events, now);

        return new UsageForecast(
                peakHours,
                peakDays(events),
                new UsageForecast.Projection(Math.round(eventsPerDay), confidence(events, Horizon.SHORT)),
                new UsageForecast.Projection(Math.round(eventsPerDay * 7), confidence(events, Horizon.MEDIUM)),
                new UsageForecast.Projection(Math.round(eventsPerDay * 30 * seasonal), confidence(events, Horizon.LONG)),
                round2(seasonal),
                userBehavior(events)
        );
    }

    /**
     * Top five hours holding more than 8% of the events, busiest first.
     */
    List<HourShare> peakHours(List<BinEvent> events) {
        int[] hourly = EventWindowAggregator.hourlyHistogram(events, properties.zone());
        int total = events.size();
        List<HourShare> shares = new ArrayList<>();
        for (int hour = 0; hour < hourly.length; hour++) {
            double percentage = 100.0 * hourly[hour] / total;
            if (percentage > 8) {
                shares.add(new HourShare(hour, hourly[hour], round2(percentage)));
            }
        }
        shares.sort(Comparator.comparingDouble(HourShare::percentage).reversed());
        return shares.size() > 5 ? List.copyOf(shares.subList(0, 5)) : List.copyOf(shares);
    }

    List<DayShare> peakDays(List<BinEvent> events) {
        int[] weekly = EventWindowAggregator.weekdayHistogram(events, properties.zone());
        int total = events.size();
        List<DayShare> shares = new ArrayList<>();
        for (int i = 0; i < weekly.length; i++) {
            shares.add(new DayShare(DayOfWeek.of(i + 1), weekly[i], round2(100.0 * weekly[i] / total)));
        }
        shares.sort(Comparator.comparingDouble(DayShare::percentage).reversed());
        return List.copyOf(shares);
    }

    /**
     * Events of the current month against the average month. 1.0 when there is nothing to compare.
     */
    double seasonalRatio(List<BinEvent> events, Instant now) {
        int[] monthly = EventWindowAggregator.monthlyHistogram(events, properties.zone());
        double avg = EventWindowAggregator.mean(monthly);
        if (avg <= 0) {
            return 1.0;
        }
        int currentMonth = now.atZone(properties.zone()).getMonthValue() - 1;
        return monthly[currentMonth] / avg;
    }

    static UsageForecast.UserBehavior userBehavior(List<BinEvent> events) {
        Map<String, int[]> counts = new LinkedHashMap<>();
        Map<String, Double> weights = new HashMap<>();
        for (BinEvent event : events) {
            if (event.userId() == null) {
                continue;
            }
            counts.computeIfAbsent(event.userId(), k -> new int[1])[0]++;
            weights.merge(event.userId(), event.weightOrZero(), Double::sum);
        }
        if (counts.isEmpty()) {
            return UsageForecast.UserBehavior.none();
        }
        int users = counts.size();
        double avgEvents = counts.values().stream().mapToInt(c -> c[0]).sum() / (double) users;
        double avgWeight = weights.values().stream().mapToDouble(Double::doubleValue).sum() / users;
        String engagement = avgEvents > 10 ? "high" : avgEvents > 5 ? "medium" : "low";
        return new UsageForecast.UserBehavior(users, round2(avgEvents), round2(avgWeight), engagement);
    }

    private static CollectionPlan collection(double dailyAverage, BinProfile profile,
                                             List<HourShare> peakHours, CollectionCadence current) {
        CollectionCadence recommended = CollectionCadence.forLoad(dailyAverage, profile.ratedCapacityKg());
        return CollectionPlan.of(current, recommended, peakHours.stream().map(HourShare::hour).toList());
    }

    private Map<Horizon, RevenueForecast> revenue(List<BinEvent> events, double dailyAverage) {
        double meanPurity = events.stream().mapToDouble(BinEvent::purityOrDefault).average().orElse(BinEvent.DEFAULT_PURITY);
        boolean bonus = meanPurity > 0.9;
        double dailyRevenue = dailyAverage * properties.revenuePerKg() * (bonus ? PURITY_BONUS : 1.0);

        Map<Horizon, RevenueForecast> forecasts = new EnumMap<>(Horizon.class);
        for (Horizon horizon : Horizon.values()) {
            forecasts.put(horizon, new RevenueForecast(
                    round2(dailyRevenue * horizon.days()),
                    confidence(events, horizon),
                    round2(dailyRevenue),
                    bonus));
        }
        return forecasts;
    }

    private MaintenanceForecast maintenance(List<BinEvent> events, double dailyAverage, BinProfile profile, Instant now) {
        double intensity = Math.min(1.0, dailyAverage / profile.ratedCapacityKg());
        int interval = intensity > 0.8 ? 14 : intensity > 0.5 ? 21 : 30;
        long lowPurity = events.stream().filter(e -> e.purityOrDefault() < 0.7).count();
        double contamination = (double) lowPurity / events.size();

        List<MaintenanceRisk> risks = new ArrayList<>();
        if (intensity > 0.9) {
            risks.add(new MaintenanceRisk("high_usage_risk", Severity.HIGH,
                    "Bin usage exceeds 90% capacity regularly",
                    "Consider additional bin placement or more frequent collection"));
        }
        if (contamination > 0.2) {
            risks.add(new MaintenanceRisk("high_contamination_risk", Severity.MEDIUM,
                    "Contamination rate exceeds 20%",
                    "Implement user education program"));
        }

        List<String> recommendations = new ArrayList<>();
        if (intensity > 0.8) {
            recommendations.add("Schedule preventive maintenance within 7 days");
        }
        long flagged = events.stream().filter(BinEvent::anomalyFlagged).count();
        if (flagged > events.size() * 0.1) {
            recommendations.add("Investigate sensor calibration and system health");
        }

        LocalDate next = now.atZone(properties.zone()).toLocalDate().plusDays(interval);
        return new MaintenanceForecast(round2(intensity), interval, next, round2(contamination),
                List.copyOf(risks), List.copyOf(recommendations));
    }

    private NarrativeInsight narrative(String binId, List<BinEvent> events, BinProfile profile, PredictionOptions options) {
        if (!options.includeDelegatedInsights() || !insightClient.isAvailable()) {
            return NarrativeInsight.fallback();
        }
        try {
            return insightClient.predict(binId, new PredictionContext(profile, events))
                    .orElseGet(NarrativeInsight::fallback);
        } catch (RuntimeException e) {
            log.warn("Delegated insights unavailable for bin {} from {}: {}", binId, insightClient.provider(), e.getMessage());
            return NarrativeInsight.fallback();
        }
    }

    /**
     * Placeholder object for bins without usable history. Every confidence is at most 0.5.
     */
    BinPredictions defaultPredictions(String binId, Instant now, PredictionStatus status, String error,
                                      CollectionCadence current) {
        double[] confidences = {0.5, 0.4, 0.3};
        double[] capacityKg = {25, 175, 750};
        long[] expectedEvents = {5, 35, 150};

        CapacityForecast.Factors factors = new CapacityForecast.Factors(0.0, Trend.stable(),
                new Seasonality(false, 0.0, List.of(0, 0, 0, 0, 0, 0, 0)), 20);
        Map<Horizon, CapacityForecast> capacity = new EnumMap<>(Horizon.class);
        Map<Horizon, RevenueForecast> revenue = new EnumMap<>(Horizon.class);
        for (Horizon horizon : Horizon.values()) {
            int i = horizon.ordinal();
            capacity.put(horizon, new CapacityForecast(capacityKg[i], confidences[i], factors));
            revenue.put(horizon, new RevenueForecast(0.0, confidences[i], 0.0, false));
        }

        UsageForecast usage = new UsageForecast(
                List.of(),
                List.of(),
                new UsageForecast.Projection(expectedEvents[0], confidences[0]),
                new UsageForecast.Projection(expectedEvents[1], confidences[1]),
                new UsageForecast.Projection(expectedEvents[2], confidences[2]),
                1.0,
                UsageForecast.UserBehavior.none());
        MaintenanceForecast maintenance = new MaintenanceForecast(0.0, 30,
                now.atZone(properties.zone()).toLocalDate().plusDays(30), 0.0, List.of(), List.of());

        return new BinPredictions(binId, now, status, error, 0, capacity, usage,
                CollectionPlan.of(current, current, List.of()), revenue, maintenance, NarrativeInsight.noHistory());
    }

    private static double meanWeight(List<BinEvent> events) {
        return events.stream().mapToDouble(BinEvent::weightOrZero).average().orElse(0.0);
    }

    static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
