package com.jasmin.trafficinsights.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnomalyResult {
    boolean hasAnomalies;
    String message;
    List<AnomalyRecord> anomalies;

    public static AnomalyResult notEnoughData(String message) {
        return AnomalyResult.builder()
                .hasAnomalies(false)
                .message(message)
                .anomalies(List.of())
                .build();
    }

    public static AnomalyResult of(List<AnomalyRecord> anomalies) {
        return AnomalyResult.builder()
                .hasAnomalies(!anomalies.isEmpty())
                .anomalies(List.copyOf(anomalies))
                .build();
    }
}
