package com.jasmin.trafficinsights.repository;

public class KeyManager {

    private KeyManager() {
    }

    /** {@code <prefix>:site:<siteId>:daily} -> hash of ISO date -> counters JSON */
    public static String getDailyStatsKey(String prefix, String siteId) {
        return prefix + ":site:" + siteId + ":daily";
    }

    /** {@code <prefix>:site:<siteId>:visitors} -> hash of identifier hash -> session JSON */
    public static String getVisitorsKey(String prefix, String siteId) {
        return prefix + ":site:" + siteId + ":visitors";
    }
}
