package com.example.smartbin.analytics.detector;

import com.example.smartbin.model.Anomaly;
import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.BinProfile;

import java.util.List;

/**
 * One detection algorithm run over the events of a single bin.
 * Implementations return an empty list when there is too little data for them.
 */
public interface AnomalyDetector {

    String name();

    List<Anomaly> detect(List<BinEvent> events, BinProfile profile);
}
