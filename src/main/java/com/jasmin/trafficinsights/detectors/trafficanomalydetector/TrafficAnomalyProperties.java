package com.jasmin.trafficinsights.detectors.trafficanomalydetector;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "detectors.traffic-anomaly")
public class TrafficAnomalyProperties {

    /** Days of history required before scanning for anomalies. */
    @Min(2) private int minRows = 5;
}
