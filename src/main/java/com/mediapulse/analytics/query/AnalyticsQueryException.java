package com.mediapulse.analytics.query;

public class AnalyticsQueryException extends RuntimeException {
    private final String operation;

    public AnalyticsQueryException(String operation, Throwable cause) {
        super(operation + ": " + describe(cause), cause);
        this.operation = operation;
    }

    public AnalyticsQueryException(String operation, String message) {
        super(operation + ": " + message);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }

    private static String describe(Throwable cause) {
        if (cause == null) return "unknown failure";
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
