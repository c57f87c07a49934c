package com.jasmin.trafficinsights.models;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnomalyRecord {
    String date;
    long visits;
    /** {@code spike} or {@code dip}. */
    String type;
}
