package com.jasmin.trafficinsights.services;

import com.jasmin.trafficinsights.detectors.botdetector.BotDetector;
import com.jasmin.trafficinsights.detectors.trafficanomalydetector.TrafficAnomalyDetector;
import com.jasmin.trafficinsights.models.AnomalyResult;
import com.jasmin.trafficinsights.models.BotResult;
import com.jasmin.trafficinsights.models.DailyStat;
import com.jasmin.trafficinsights.models.ForecastResult;
import com.jasmin.trafficinsights.models.SummaryResult;
import com.jasmin.trafficinsights.models.VisitorActivitySession;
import com.jasmin.trafficinsights.repository.SiteDataAccess;
import com.jasmin.trafficinsights.services.forecast.TrendForecaster;
import com.jasmin.trafficinsights.services.summary.TrafficSummarizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for callers: each operation loads the site's records and computes a
 * fresh result from them. Nothing is kept between calls.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrafficInsightsService {

    private final SiteDataAccess dataAccess;
    private final TrendForecaster forecaster;
    private final TrafficSummarizer summarizer;
    private final TrafficAnomalyDetector trafficAnomalyDetector;
    private final BotDetector botDetector;

    public ForecastResult forecast(String siteId) {
        List<DailyStat> stats = dataAccess.fetchDailyStats(siteId);
        log.info("Forecast requested: site={} history={} days", siteId, stats.size());
        return forecaster.forecast(stats);
    }

    public ForecastResult forecast(String siteId, int days) {
        List<DailyStat> stats = dataAccess.fetchDailyStats(siteId);
        log.info("Forecast requested: site={} history={} days horizon={}", siteId, stats.size(), days);
        return forecaster.forecast(stats, days);
    }

    public SummaryResult summary(String siteId) {
        List<DailyStat> stats = dataAccess.fetchDailyStats(siteId);
        log.info("Summary requested: site={} days={}", siteId, stats.size());
        return summarizer.summarize(stats);
    }

    public AnomalyResult trafficAnomalies(String siteId) {
        List<DailyStat> stats = dataAccess.fetchDailyStats(siteId);
        log.info("Traffic anomaly scan requested: site={} days={}", siteId, stats.size());
        return trafficAnomalyDetector.detect(stats);
    }

    public BotResult detectBots(String siteId) {
        List<VisitorActivitySession> sessions = dataAccess.fetchVisitorActivity(siteId);
        log.info("Bot detection requested: site={} visitors={}", siteId, sessions.size());
        return botDetector.detect(sessions);
    }
}
