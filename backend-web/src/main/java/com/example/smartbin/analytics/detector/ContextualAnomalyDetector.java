package com.example.smartbin.analytics.detector;

import com.example.smartbin.config.AnalyticsProperties;
import com.example.smartbin.model.Anomaly;
import com.example.smartbin.model.AnomalyTypes;
import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.BinProfile;
import com.example.smartbin.model.Severity;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Location, time-of-day and per-user checks.
 */
@Order(3)
@Component
public class ContextualAnomalyDetector implements AnomalyDetector {

    static final int RESIDENTIAL_EVENT_LIMIT = 50;
    static final double NIGHT_SHARE_LIMIT = 0.3;
    static final int NIGHT_STARTS_AT = 22;
    static final int NIGHT_ENDS_BEFORE = 6;
    static final int USER_EVENT_LIMIT = 20;

    private final AnalyticsProperties properties;

    public ContextualAnomalyDetector(AnalyticsProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return "contextual";
    }

    @Override
    public List<Anomaly> detect(List<BinEvent> events, BinProfile profile) {
        List<Anomaly> anomalies = new ArrayList<>();
        if (events.isEmpty()) {
            return anomalies;
        }

        if (profile.isResidential() && events.size() > RESIDENTIAL_EVENT_LIMIT) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("location_class", profile.locationClass());
            details.put("location", profile.locationLabel());
            details.put("event_count", events.size());
            details.put("threshold", RESIDENTIAL_EVENT_LIMIT);
            anomalies.add(Anomaly.of(AnomalyTypes.HIGH_USAGE_RESIDENTIAL_AREA, Severity.LOW, 0.6, details, name()));
        }

        long nightEvents = events.stream().filter(this::isNight).count();
        double nightShare = (double) nightEvents / events.size();
        if (nightShare > NIGHT_SHARE_LIMIT) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("night_events", nightEvents);
            details.put("night_percentage", nightShare * 100);
            details.put("night_hours", NIGHT_STARTS_AT + ":00-0" + NIGHT_ENDS_BEFORE + ":00");
            anomalies.add(Anomaly.of(AnomalyTypes.UNUSUAL_NIGHT_USAGE, Severity.MEDIUM, 0.7, details, name()));
        }

        Map<String, Integer> perUser = new LinkedHashMap<>();
        for (BinEvent event : events) {
            if (event.userId() != null) {
                perUser.merge(event.userId(), 1, Integer::sum);
            }
        }
        perUser.forEach((userId, count) -> {
            if (count > USER_EVENT_LIMIT) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("user_id", userId);
                details.put("event_count", count);
                details.put("threshold", USER_EVENT_LIMIT);
                anomalies.add(Anomaly.of(AnomalyTypes.HIGH_FREQUENCY_USER, Severity.LOW, 0.6, details, name()));
            }
        });
        return anomalies;
    }

    private boolean isNight(BinEvent event) {
        int hour = event.timestamp().atZone(properties.zone()).getHour();
        return hour >= NIGHT_STARTS_AT || hour < NIGHT_ENDS_BEFORE;
    }
}
