package com.example.smartbin.model.prediction;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PredictionStatus {
    SUCCESS,
    NO_HISTORY,
    ERROR;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
