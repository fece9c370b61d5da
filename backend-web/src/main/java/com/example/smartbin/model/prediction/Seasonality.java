package com.example.smartbin.model.prediction;

import java.util.List;

/**
 * Weekly seasonality. {@code pattern} holds event counts Monday first.
 */
public record Seasonality(boolean hasSeasonality, double strength, List<Integer> pattern) {
}
