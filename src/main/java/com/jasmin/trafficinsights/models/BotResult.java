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
public class BotResult {
    String message;
    int detectedBotsCount;
    List<BotRecord> bots;

    public static BotResult notEnoughData(String message) {
        return BotResult.builder()
                .message(message)
                .detectedBotsCount(0)
                .bots(List.of())
                .build();
    }

    public static BotResult of(List<BotRecord> bots) {
        return BotResult.builder()
                .detectedBotsCount(bots.size())
                .bots(List.copyOf(bots))
                .build();
    }
}
