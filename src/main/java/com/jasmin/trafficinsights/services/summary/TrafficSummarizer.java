package com.jasmin.trafficinsights.services.summary;

import com.jasmin.trafficinsights.constants.Constants;
import com.jasmin.trafficinsights.detectors.DetectorUtils;
import com.jasmin.trafficinsights.models.DailyStat;
import com.jasmin.trafficinsights.models.SummaryResult;
import com.jasmin.trafficinsights.utils.StatsUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

@Service
@Slf4j
public class TrafficSummarizer {

    static final int WEEK = 7;

    public SummaryResult summarize(List<DailyStat> stats) {
        DetectorUtils.requireRecords(stats);
        if (stats.isEmpty()) {
            return SummaryResult.error(Constants.NO_DATA_AVAILABLE);
        }

        long[] visits = stats.stream().mapToLong(DailyStat::getTotalVisits).toArray();
        long[] unique = stats.stream().mapToLong(DailyStat::getUniqueVisitors).toArray();

        SummaryResult summary = SummaryResult.builder()
                .averageDailyVisits(StatsUtils.round(StatsUtils.mean(visits), 1))
                .averageDailyUnique(StatsUtils.round(StatsUtils.mean(unique), 1))
                .busiestDayOfWeek(busiestDayOfWeek(stats))
                .weeklyGrowth(weeklyGrowth(visits))
                .build();

        log.debug("Summarized {} days: {}", stats.size(), summary);
        return summary;
    }

    /**
     * Weekday with the highest mean visits. Weekdays are compared by English name in
     * alphabetical order and the first maximum wins, so ties resolve alphabetically.
     */
    String busiestDayOfWeek(List<DailyStat> stats) {
        Map<String, long[]> sumAndCount = new TreeMap<>();
        for (DailyStat day : stats) {
            String name = day.getDate().getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
            long[] acc = sumAndCount.computeIfAbsent(name, k -> new long[2]);
            acc[0] += day.getTotalVisits();
            acc[1]++;
        }

        String busiest = null;
        double best = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, long[]> e : sumAndCount.entrySet()) {
            double mean = (double) e.getValue()[0] / e.getValue()[1];
            if (mean > best) {
                best = mean;
                busiest = e.getKey();
            }
        }
        return busiest;
    }

    /** Last seven rows against the seven before them, by row order rather than calendar. */
    SummaryResult.WeeklyGrowth weeklyGrowth(long[] visits) {
        if (visits.length < 2 * WEEK) {
            return SummaryResult.WeeklyGrowth.NONE;
        }
        int n = visits.length;
        long current = 0L;
        long previous = 0L;
        for (int i = n - WEEK; i < n; i++) current += visits[i];
        for (int i = n - 2 * WEEK; i < n - WEEK; i++) previous += visits[i];

        double growth = previous > 0 ? (double) (current - previous) / previous * 100.0 : 0.0;
        return new SummaryResult.WeeklyGrowth(current, previous, StatsUtils.round(growth, 1));
    }
}
