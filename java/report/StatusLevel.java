package qg.java.report;

/**
 * Operator-facing quota health, bucketed by percentage of the hourly quota used.
 */
public enum StatusLevel {
    /** Under 50% used. */
    HEALTHY("Plenty of API quota available"),

    /** 50% to under 80% used. */
    WARNING("API quota is being consumed - consider spacing out requests"),

    /** 80% or more used. */
    CRITICAL("API quota is low - limit requests to essential operations");

    private final String message;

    StatusLevel(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }

    public static StatusLevel forPercentUsed(long percentUsed) {
        if (percentUsed < 50) return HEALTHY;
        if (percentUsed < 80) return WARNING;
        return CRITICAL;
    }
}
