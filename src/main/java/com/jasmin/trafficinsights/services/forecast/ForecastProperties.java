package com.jasmin.trafficinsights.services.forecast;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "analytics.forecast")
public class ForecastProperties {

    /** Days of history needed to fit a trend line. */
    @Min(2) private int minHistoryDays = 3;

    /** Horizon used when the caller does not pass one. */
    @Min(1) private int defaultHorizonDays = 7;

    /** Slopes within +/- this many visits per day are reported as stable. */
    @DecimalMin("0.0") private double stableSlopeBand = 0.5;
}
