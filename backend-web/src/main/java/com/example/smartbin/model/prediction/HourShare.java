package com.example.smartbin.model.prediction;

public record HourShare(int hour, int count, double percentage) {
}
