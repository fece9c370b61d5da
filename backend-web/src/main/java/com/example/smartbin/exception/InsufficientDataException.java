package com.example.smartbin.exception;

/**
 * Raised when a computation gets fewer data points than it needs.
 * Detectors treat it as "skip me", never as a batch failure.
 */
public class InsufficientDataException extends AnalyticsException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
