package com.jasmin.trafficinsights.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Descriptive statistics of a site's daily traffic. Only {@code error} is set when
 * there was nothing to summarize.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SummaryResult {
    String error;
    Double averageDailyVisits;
    Double averageDailyUnique;
    String busiestDayOfWeek;
    WeeklyGrowth weeklyGrowth;

    public static SummaryResult error(String error) {
        return SummaryResult.builder().error(error).build();
    }

    @Value
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class WeeklyGrowth {
        public static final WeeklyGrowth NONE = new WeeklyGrowth(0L, 0L, 0.0);

        long currentWeekVisits;
        long previousWeekVisits;
        double growthRatePercent;
    }
}
