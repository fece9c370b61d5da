package com.example.smartbin.model.prediction;

import com.example.smartbin.model.Severity;

public record MaintenanceRisk(
        String type,
        Severity severity,
        String description,
        String recommendation
) {
}
