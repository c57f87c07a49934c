package com.jasmin.trafficinsights.detectors.trafficanomalydetector;

import com.jasmin.trafficinsights.constants.Constants;
import com.jasmin.trafficinsights.detectors.Detector;
import com.jasmin.trafficinsights.detectors.DetectorUtils;
import com.jasmin.trafficinsights.engine.OutlierEngine;
import com.jasmin.trafficinsights.engine.OutlierScores;
import com.jasmin.trafficinsights.engine.ThresholdMode;
import com.jasmin.trafficinsights.models.AnomalyRecord;
import com.jasmin.trafficinsights.models.AnomalyResult;
import com.jasmin.trafficinsights.models.DailyStat;
import com.jasmin.trafficinsights.utils.StatsUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags days whose visit count the outlier engine isolates unusually fast.
 * Days above the overall mean are spikes, the rest dips.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TrafficAnomalyDetector implements Detector<DailyStat, AnomalyResult> {

    private final OutlierEngine engine;
    private final TrafficAnomalyProperties cfg;

    @Override
    public AnomalyResult detect(List<DailyStat> stats) {
        DetectorUtils.requireRecords(stats);
        if (stats.size() < cfg.getMinRows()) {
            log.debug("Skipping anomaly scan: {} days < {}", stats.size(), cfg.getMinRows());
            return AnomalyResult.notEnoughData(String.format(Constants.ANOMALY_NOT_ENOUGH_DATA, cfg.getMinRows()));
        }

        double[][] features = new double[stats.size()][];
        for (int i = 0; i < stats.size(); i++) {
            features[i] = new double[] { stats.get(i).getTotalVisits() };
        }

        OutlierScores scores = engine.score(features, ThresholdMode.auto());
        double meanVisits = StatsUtils.mean(DetectorUtils.column(features, 0));

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (int row : scores.outlierRows()) {
            DailyStat day = stats.get(row);
            String type = day.getTotalVisits() > meanVisits ? Constants.ANOMALY_SPIKE : Constants.ANOMALY_DIP;
            anomalies.add(new AnomalyRecord(DetectorUtils.formatDate(day.getDate()), day.getTotalVisits(), type));
        }

        log.debug("Traffic anomaly scan: {} of {} days flagged (mean={})", anomalies.size(), stats.size(), meanVisits);
        return AnomalyResult.of(anomalies);
    }
}
