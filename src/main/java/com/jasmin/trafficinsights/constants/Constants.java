package com.jasmin.trafficinsights.constants;

public class Constants {
    // trend labels
    public static final String TREND_INCREASING = "increasing";
    public static final String TREND_DECREASING = "decreasing";
    public static final String TREND_STABLE = "stable";

    // anomaly types
    public static final String ANOMALY_SPIKE = "spike";
    public static final String ANOMALY_DIP = "dip";

    // bot reasons, in the order they are checked
    public static final String HIGH_REQUEST_VOLUME = "High Request Volume";
    public static final String ABNORMAL_REQUEST_RATE = "Abnormal Request Rate";
    public static final String SUSPICIOUS_USER_AGENT = "Suspicious User Agent";
    public static final String UNUSUAL_PATTERN = "Unusual Pattern";
    public static final String REASON_SEPARATOR = ", ";

    // insufficient data messages
    public static final String NO_DATA_AVAILABLE = "No data available";
    public static final String FORECAST_NOT_ENOUGH_DATA = "Not enough data. Need at least %d days of history.";
    public static final String ANOMALY_NOT_ENOUGH_DATA = "Not enough data. Need at least %d days of history.";
    public static final String BOT_NOT_ENOUGH_DATA = "Not enough data for bot detection (need > %d visitors)";

    private Constants() {
    }
}
