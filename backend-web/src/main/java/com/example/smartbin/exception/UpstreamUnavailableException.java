package com.example.smartbin.exception;

/**
 * The data store or the delegated insight backend could not be reached or answered garbage.
 */
public class UpstreamUnavailableException extends AnalyticsException {

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
