package com.example.smartbin.service;

import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.BinProfile;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the event history. Events come back newest first, joined with the bin fields.
 * Implementations raise {@link com.example.smartbin.exception.UpstreamUnavailableException}
 * when the backing store cannot be reached.
 */
public interface EventStore {

    List<BinEvent> fetchRecentEvents(Instant since);

    List<BinEvent> fetchBinEvents(String binId, Instant since);

    Optional<BinProfile> fetchBinProfile(String binId);
}
