package com.example.smartbin.model.prediction;

import java.time.DayOfWeek;

public record DayShare(DayOfWeek day, int count, double percentage) {
}
