package com.jasmin.trafficinsights.models;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Traffic counters of one site for one calendar day.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DailyStat {
    LocalDate date;
    long totalVisits;
    long uniqueVisitors;
}
