package com.jasmin.trafficinsights.engine;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "engine.outlier")
public class OutlierEngineProperties {

    /** Seed of the tree randomness. Same seed and input give the same scores. */
    private long seed = 42L;

    /** Number of isolation trees in the ensemble. */
    @Min(1) private int trees = 100;

    /** Upper bound of the rows each tree is grown on. */
    @Min(2) private int maxSamples = 256;
}
