package com.example.smartbin.model.prediction;

import java.util.List;

public record CollectionPlan(
        CollectionCadence currentCadence,
        CollectionCadence recommendedCadence,
        double currentCostPerDay,
        double recommendedCostPerDay,
        double savingsPerDay,
        List<Integer> recommendedHours
) {

    public static CollectionPlan of(CollectionCadence current, CollectionCadence recommended, List<Integer> hours) {
        return new CollectionPlan(
                current,
                recommended,
                current.costPerDay(),
                recommended.costPerDay(),
                current.costPerDay() - recommended.costPerDay(),
                List.copyOf(hours)
        );
    }
}
