package com.example.smartbin.model.prediction;

import java.time.LocalDate;
import java.util.List;

public record MaintenanceForecast(
        double usageIntensity,
        int maintenanceIntervalDays,
        LocalDate nextMaintenanceDate,
        double contaminationRate,
        List<MaintenanceRisk> risks,
        List<String> recommendations
) {
}
