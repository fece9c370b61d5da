package com.example.smartbin.model.prediction;

public record Trend(String direction, double slope) {

    public static Trend stable() {
        return new Trend("stable", 0.0);
    }
}
