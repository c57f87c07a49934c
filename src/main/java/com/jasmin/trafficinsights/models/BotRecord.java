package com.jasmin.trafficinsights.models;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BotRecord {
    String identifierHash;
    long requestCount;
    /** Reason codes joined in the order they were checked. */
    String reason;
}
