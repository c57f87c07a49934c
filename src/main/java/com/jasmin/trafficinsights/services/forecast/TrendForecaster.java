package com.jasmin.trafficinsights.services.forecast;

import com.jasmin.trafficinsights.constants.Constants;
import com.jasmin.trafficinsights.detectors.DetectorUtils;
import com.jasmin.trafficinsights.models.DailyStat;
import com.jasmin.trafficinsights.models.ForecastPoint;
import com.jasmin.trafficinsights.models.ForecastResult;
import com.jasmin.trafficinsights.utils.StatsUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Fits a least-squares line of daily visits against the epoch day and extends it over
 * the following calendar days.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TrendForecaster {

    // keeps predictions that sit on an integer from truncating one below it
    private static final double TRUNCATION_TOLERANCE = 1e-9;

    private final ForecastProperties cfg;

    public ForecastResult forecast(List<DailyStat> stats) {
        return forecast(stats, cfg.getDefaultHorizonDays());
    }

    public ForecastResult forecast(List<DailyStat> stats, int days) {
        DetectorUtils.requireRecords(stats);
        if (days <= 0) {
            throw new IllegalArgumentException("Forecast horizon must be positive, got " + days);
        }
        if (stats.size() < cfg.getMinHistoryDays()) {
            log.debug("Not forecasting: {} days of history < {}", stats.size(), cfg.getMinHistoryDays());
            return ForecastResult.notEnoughData(String.format(Constants.FORECAST_NOT_ENOUGH_DATA, cfg.getMinHistoryDays()));
        }

        int n = stats.size();
        double[] x = new double[n];
        double[] y = new double[n];
        LocalDate lastDate = stats.get(0).getDate();
        for (int i = 0; i < n; i++) {
            DailyStat day = stats.get(i);
            x[i] = day.getDate().toEpochDay();
            y[i] = day.getTotalVisits();
            if (day.getDate().isAfter(lastDate)) lastDate = day.getDate();
        }

        double meanX = StatsUtils.mean(x);
        double meanY = StatsUtils.mean(y);
        double sxx = 0.0;
        double sxy = 0.0;
        for (int i = 0; i < n; i++) {
            sxx += (x[i] - meanX) * (x[i] - meanX);
            sxy += (x[i] - meanX) * (y[i] - meanY);
        }
        // every row on the same day: flat line through the mean
        double slope = sxx == 0.0 ? 0.0 : sxy / sxx;

        List<ForecastPoint> forecast = new ArrayList<>(days);
        for (int i = 1; i <= days; i++) {
            LocalDate date = lastDate.plusDays(i);
            double predicted = meanY + slope * (date.toEpochDay() - meanX);
            long visits = (long) Math.floor(Math.max(0.0, predicted) + TRUNCATION_TOLERANCE);
            forecast.add(new ForecastPoint(DetectorUtils.formatDate(date), visits));
        }

        log.debug("Forecast over {} days of history: slope={}, horizon={}", n, slope, days);
        return ForecastResult.builder()
                .canForecast(true)
                .forecast(forecast)
                .trend(trend(slope))
                .slope(StatsUtils.round(slope, 2))
                .build();
    }

    private String trend(double slope) {
        if (slope > cfg.getStableSlopeBand()) return Constants.TREND_INCREASING;
        if (slope < -cfg.getStableSlopeBand()) return Constants.TREND_DECREASING;
        return Constants.TREND_STABLE;
    }
}
