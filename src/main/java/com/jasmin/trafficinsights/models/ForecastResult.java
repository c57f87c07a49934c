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
public class ForecastResult {
    boolean canForecast;
    String message;
    List<ForecastPoint> forecast;
    String trend;
    Double slope;

    public static ForecastResult notEnoughData(String message) {
        return ForecastResult.builder()
                .canForecast(false)
                .message(message)
                .build();
    }
}
