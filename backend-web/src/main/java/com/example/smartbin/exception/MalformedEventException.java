package com.example.smartbin.exception;

public class MalformedEventException extends AnalyticsException {

    public MalformedEventException(String message) {
        super(message);
    }
}
