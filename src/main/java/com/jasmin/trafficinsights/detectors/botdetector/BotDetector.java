package com.jasmin.trafficinsights.detectors.botdetector;

import com.jasmin.trafficinsights.constants.Constants;
import com.jasmin.trafficinsights.detectors.Detector;
import com.jasmin.trafficinsights.detectors.DetectorUtils;
import com.jasmin.trafficinsights.engine.OutlierEngine;
import com.jasmin.trafficinsights.engine.OutlierScores;
import com.jasmin.trafficinsights.engine.ThresholdMode;
import com.jasmin.trafficinsights.models.BotRecord;
import com.jasmin.trafficinsights.models.BotResult;
import com.jasmin.trafficinsights.models.VisitorActivitySession;
import com.jasmin.trafficinsights.utils.StatsUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores visitor sessions on request volume, request rate and user agent score and
 * reports the most isolated share of them as likely bots, with the reasons that make
 * each one stand out.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BotDetector implements Detector<VisitorActivitySession, BotResult> {

    static final int REQUEST_COUNT = 0;
    static final int REQUEST_RATE = 1;
    static final int UA_SCORE = 2;

    private final OutlierEngine engine;
    private final BotDetectorProperties cfg;

    @Override
    public BotResult detect(List<VisitorActivitySession> sessions) {
        DetectorUtils.requireRecords(sessions);
        if (sessions.size() <= cfg.getMinRows()) {
            log.debug("Skipping bot detection: {} visitors <= {}", sessions.size(), cfg.getMinRows());
            return BotResult.notEnoughData(String.format(Constants.BOT_NOT_ENOUGH_DATA, cfg.getMinRows()));
        }

        double[][] features = new double[sessions.size()][];
        for (int i = 0; i < sessions.size(); i++) {
            features[i] = features(sessions.get(i));
        }

        OutlierScores scores = engine.score(features, ThresholdMode.contamination(cfg.getContamination()));
        double meanCount = StatsUtils.mean(DetectorUtils.column(features, REQUEST_COUNT));
        double meanRate = StatsUtils.mean(DetectorUtils.column(features, REQUEST_RATE));

        List<BotRecord> bots = new ArrayList<>();
        for (int row : scores.outlierRows()) {
            VisitorActivitySession s = sessions.get(row);
            String reason = String.join(Constants.REASON_SEPARATOR, reasons(features[row], meanCount, meanRate));
            bots.add(new BotRecord(s.getIdentifierHash(), s.getRequestCount(), reason));
        }

        log.debug("Bot detection: {} of {} visitors flagged (threshold={})",
                bots.size(), sessions.size(), scores.getThreshold());
        return BotResult.of(bots);
    }

    /** {@code [request_count, request_rate, ua_score]} of one session. */
    static double[] features(VisitorActivitySession s) {
        double duration = DetectorUtils.durationSeconds(s.getFirstSeen(), s.getLastSeen());
        return new double[] {
                s.getRequestCount(),
                s.getRequestCount() / duration,
                DetectorUtils.orZero(s.getUaScore())
        };
    }

    /** Checks run independently and keep their order; no hit means "Unusual Pattern". */
    List<String> reasons(double[] row, double meanCount, double meanRate) {
        List<String> reasons = new ArrayList<>();
        if (row[REQUEST_COUNT] > meanCount * cfg.getMeanMultiplier()) {
            reasons.add(Constants.HIGH_REQUEST_VOLUME);
        }
        if (row[REQUEST_RATE] > meanRate * cfg.getMeanMultiplier()) {
            reasons.add(Constants.ABNORMAL_REQUEST_RATE);
        }
        if (row[UA_SCORE] > cfg.getUaScoreThreshold()) {
            reasons.add(Constants.SUSPICIOUS_USER_AGENT);
        }
        if (reasons.isEmpty()) {
            reasons.add(Constants.UNUSUAL_PATTERN);
        }
        return reasons;
    }
}
