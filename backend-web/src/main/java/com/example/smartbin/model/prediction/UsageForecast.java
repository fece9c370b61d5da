package com.example.smartbin.model.prediction;

import java.util.List;

public record UsageForecast(
        List<HourShare> peakHours,
        List<DayShare> peakDays,
        Projection next24h,
        Projection nextWeek,
        Projection nextMonth,
        double seasonalAdjustment,
        UserBehavior userBehavior
) {

    public record Projection(long expectedEvents, double confidence) {
    }

    public record UserBehavior(
            int totalUsers,
            double averageEventsPerUser,
            double averageWeightPerUser,
            String engagementLevel
    ) {

        public static UserBehavior none() {
            return new UserBehavior(0, 0.0, 0.0, "low");
        }
    }
}
