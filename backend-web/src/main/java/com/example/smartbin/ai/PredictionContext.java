package com.example.smartbin.ai;

import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.BinProfile;

import java.util.List;

public record PredictionContext(BinProfile profile, List<BinEvent> recentEvents) {
}
