package com.jasmin.trafficinsights.repository;

import com.jasmin.trafficinsights.models.DailyStat;
import com.jasmin.trafficinsights.models.VisitorActivitySession;

import java.util.List;

/**
 * Read access to the records stored for a site. Implementations acquire and release
 * whatever connection they need within each call.
 */
public interface SiteDataAccess {

    /** Daily counters sorted ascending by date; empty when the site has none. */
    List<DailyStat> fetchDailyStats(String siteId);

    /** One session per hashed visitor identifier, in no particular order. */
    List<VisitorActivitySession> fetchVisitorActivity(String siteId);
}
