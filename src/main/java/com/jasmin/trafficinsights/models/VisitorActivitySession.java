package com.jasmin.trafficinsights.models;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Activity of one visitor, keyed by the already hashed identifier.
 * {@code uaScore} is {@code null} when the user agent was never scored.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class VisitorActivitySession {
    String identifierHash;
    Instant firstSeen;
    Instant lastSeen;
    long requestCount;
    Double uaScore;
}
