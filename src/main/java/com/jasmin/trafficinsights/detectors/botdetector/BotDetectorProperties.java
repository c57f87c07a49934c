package com.jasmin.trafficinsights.detectors.botdetector;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "detectors.bot")
public class BotDetectorProperties {

    /** Detection runs only with strictly more visitors than this. */
    @Min(1) private int minRows = 10;

    /** Share of visitors assumed to be bots. */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("0.5")
    private double contamination = 0.05;

    /** A count or rate this many times the site mean is called out as a reason. */
    @DecimalMin(value = "1.0")
    private double meanMultiplier = 2.0;

    /** User agent scores above this are suspicious. */
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double uaScoreThreshold = 0.8;
}
