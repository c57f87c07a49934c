package com.jasmin.trafficinsights.detectors.botdetector;

import com.jasmin.trafficinsights.engine.OutlierEngine;
import com.jasmin.trafficinsights.engine.OutlierEngineProperties;
import com.jasmin.trafficinsights.models.BotRecord;
import com.jasmin.trafficinsights.models.BotResult;
import com.jasmin.trafficinsights.models.VisitorActivitySession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("BotDetector")
class BotDetectorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private BotDetector detector;

    @BeforeEach
    void setUp() {
        detector = new BotDetector(new OutlierEngine(new OutlierEngineProperties()), new BotDetectorProperties());
    }

    private static VisitorActivitySession session(String hash, long requests, long seconds, Double uaScore) {
        return VisitorActivitySession.builder()
                .identifierHash(hash)
                .firstSeen(T0)
                .lastSeen(T0.plusSeconds(seconds))
                .requestCount(requests)
                .uaScore(uaScore)
                .build();
    }

    private static List<VisitorActivitySession> humans(int n) {
        List<VisitorActivitySession> sessions = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            sessions.add(session("visitor-" + i,
                    10 + (i * 7) % 30,
                    300 + (i * 37) % 600,
                    0.1 + (i % 5) * 0.05));
        }
        return sessions;
    }

    @Nested
    @DisplayName("insufficient data")
    class InsufficientData {

        @Test
        @DisplayName("Should need more than ten visitors")
        void shouldNeedMoreThanTenVisitors() {
            BotResult result = detector.detect(humans(10));

            assertThat(result.getMessage()).isEqualTo("Not enough data for bot detection (need > 10 visitors)");
            assertThat(result.getDetectedBotsCount()).isZero();
            assertThat(result.getBots()).isEmpty();
        }

        @Test
        @DisplayName("Should run with eleven visitors")
        void shouldRunWithElevenVisitors() {
            BotResult result = detector.detect(humans(11));

            assertThat(result.getMessage()).isNull();
            assertThat(result.getDetectedBotsCount()).isEqualTo(1);
            assertThat(result.getBots()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("detection")
    class Detection {

        @Test
        @DisplayName("Should flag a high volume scripted visitor with every reason")
        void shouldFlagObviousBot() {
            List<VisitorActivitySession> sessions = humans(39);
            sessions.add(session("bot", 5000, 10, 0.95));

            BotResult result = detector.detect(sessions);

            assertThat(result.getDetectedBotsCount()).isEqualTo(2);
            assertThat(result.getBots()).hasSize(2);
            assertThat(result.getBots())
                    .contains(new BotRecord("bot", 5000,
                            "High Request Volume, Abnormal Request Rate, Suspicious User Agent"));
        }

        @Test
        @DisplayName("Should report an unusual pattern when no single criterion applies")
        void shouldReportUnusualPattern() {
            List<VisitorActivitySession> sessions = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                sessions.add(session("v" + i, 10, 60, 0.2));
            }
            sessions.add(session("odd", 10, 60, 0.7));
            for (int i = 10; i < 20; i++) {
                sessions.add(session("v" + i, 10, 60, 0.2));
            }

            BotResult result = detector.detect(sessions);

            assertThat(result.getDetectedBotsCount()).isEqualTo(1);
            assertThat(result.getBots()).containsExactly(new BotRecord("odd", 10, "Unusual Pattern"));
        }

        @Test
        @DisplayName("Should flag the rounded contamination share")
        void shouldFlagContaminationShare() {
            assertThat(detector.detect(humans(60)).getDetectedBotsCount()).isEqualTo(3);
            assertThat(detector.detect(humans(30)).getDetectedBotsCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should flag nobody when all sessions look the same")
        void shouldFlagNobodyForIdenticalSessions() {
            List<VisitorActivitySession> sessions = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                sessions.add(session("v" + i, 12, 60, 0.2));
            }

            BotResult result = detector.detect(sessions);

            assertThat(result.getDetectedBotsCount()).isZero();
            assertThat(result.getBots()).isEmpty();
        }

        @Test
        @DisplayName("Should report bots in input order")
        void shouldReportInInputOrder() {
            List<VisitorActivitySession> sessions = humans(60);

            List<String> hashes = detector.detect(sessions).getBots().stream()
                    .map(BotRecord::getIdentifierHash)
                    .toList();

            List<String> inputOrder = sessions.stream()
                    .map(VisitorActivitySession::getIdentifierHash)
                    .filter(hashes::contains)
                    .toList();
            assertThat(hashes).isEqualTo(inputOrder);
        }
    }

    @Nested
    @DisplayName("features")
    class Features {

        @Test
        @DisplayName("Should derive the rate from the session duration")
        void shouldDeriveRate() {
            double[] row = BotDetector.features(session("a", 120, 60, 0.4));

            assertThat(row).containsExactly(120.0, 2.0, 0.4);
        }

        @Test
        @DisplayName("Should treat a zero length session as one second")
        void shouldTreatZeroDurationAsOneSecond() {
            double[] row = BotDetector.features(session("a", 30, 0, 0.4));

            assertThat(row[BotDetector.REQUEST_RATE]).isEqualTo(30.0);
        }

        @Test
        @DisplayName("Should keep fractional seconds")
        void shouldKeepFractionalSeconds() {
            VisitorActivitySession s = VisitorActivitySession.builder()
                    .identifierHash("a")
                    .firstSeen(T0)
                    .lastSeen(T0.plusMillis(500))
                    .requestCount(10)
                    .build();

            assertThat(BotDetector.features(s)[BotDetector.REQUEST_RATE]).isCloseTo(20.0, within(1e-9));
        }

        @Test
        @DisplayName("Should score a missing user agent as zero")
        void shouldScoreMissingUserAgentAsZero() {
            double[] row = BotDetector.features(session("a", 10, 10, null));

            assertThat(row[BotDetector.UA_SCORE]).isZero();
        }
    }

    @Nested
    @DisplayName("reasons")
    class Reasons {

        @Test
        @DisplayName("Should list every reason that applies in check order")
        void shouldListAllReasons() {
            List<String> reasons = detector.reasons(new double[] { 500, 50, 0.9 }, 100, 10);

            assertThat(reasons).containsExactly(
                    "High Request Volume", "Abnormal Request Rate", "Suspicious User Agent");
        }

        @Test
        @DisplayName("Should report only the rate when volume is normal")
        void shouldReportRateOnly() {
            List<String> reasons = detector.reasons(new double[] { 100, 50, 0.1 }, 100, 10);

            assertThat(reasons).containsExactly("Abnormal Request Rate");
        }

        @Test
        @DisplayName("Should fall back to an unusual pattern")
        void shouldFallBackToUnusualPattern() {
            List<String> reasons = detector.reasons(new double[] { 1, 0.01, 0.1 }, 100, 10);

            assertThat(reasons).containsExactly("Unusual Pattern");
        }

        @Test
        @DisplayName("Should not call out values exactly at the limits")
        void shouldNotCallOutBoundaryValues() {
            List<String> reasons = detector.reasons(new double[] { 200, 20, 0.8 }, 100, 10);

            assertThat(reasons).containsExactly("Unusual Pattern");
        }
    }
}
