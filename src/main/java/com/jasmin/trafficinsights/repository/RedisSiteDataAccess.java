package com.jasmin.trafficinsights.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.jasmin.trafficinsights.models.DailyStat;
import com.jasmin.trafficinsights.models.VisitorActivitySession;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Keeps each site's records in two Redis hashes (see {@link KeyManager}). Values are
 * JSON; entries that do not parse are skipped with a warning instead of failing the
 * whole fetch.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class RedisSiteDataAccess implements SiteDataAccess {

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final StorageProperties props;

    @Override
    public List<DailyStat> fetchDailyStats(String siteId) {
        String key = KeyManager.getDailyStatsKey(props.getKeyPrefix(), requireSiteId(siteId));
        Map<Object, Object> h = entries(siteId, key);

        List<DailyStat> stats = new ArrayList<>(h.size());
        for (Map.Entry<Object, Object> e : h.entrySet()) {
            try {
                LocalDate date = LocalDate.parse((String) e.getKey());
                StoredDailyCounts counts = objectMapper.readValue((String) e.getValue(), StoredDailyCounts.class);
                if (counts == null) {
                    log.warn("Skipping empty daily stat: site={} date={}", siteId, date);
                    continue;
                }
                if (counts.getTotalVisits() < 0 || counts.getUniqueVisitors() < 0) {
                    log.warn("Skipping daily stat with negative counts: site={} date={}", siteId, date);
                    continue;
                }
                stats.add(DailyStat.builder()
                        .date(date)
                        .totalVisits(counts.getTotalVisits())
                        .uniqueVisitors(counts.getUniqueVisitors())
                        .build());
            } catch (DateTimeParseException | JsonProcessingException | ClassCastException ex) {
                log.warn("Skipping malformed daily stat: site={} field={} ({})", siteId, e.getKey(), ex.getMessage());
            }
        }
        stats.sort(Comparator.comparing(DailyStat::getDate));
        return stats;
    }

    @Override
    public List<VisitorActivitySession> fetchVisitorActivity(String siteId) {
        String key = KeyManager.getVisitorsKey(props.getKeyPrefix(), requireSiteId(siteId));
        Map<Object, Object> h = entries(siteId, key);

        List<VisitorActivitySession> sessions = new ArrayList<>(h.size());
        for (Map.Entry<Object, Object> e : h.entrySet()) {
            try {
                String identifierHash = (String) e.getKey();
                StoredSession s = objectMapper.readValue((String) e.getValue(), StoredSession.class);
                if (s == null) {
                    log.warn("Skipping empty visitor session: site={} visitor={}", siteId, identifierHash);
                    continue;
                }
                if (s.getFirstSeen() == null || s.getLastSeen() == null) {
                    log.warn("Skipping visitor session without timestamps: site={} visitor={}", siteId, identifierHash);
                    continue;
                }
                Instant firstSeen = Instant.parse(s.getFirstSeen());
                Instant lastSeen = Instant.parse(s.getLastSeen());
                if (s.getRequestCount() <= 0 || lastSeen.isBefore(firstSeen)) {
                    log.warn("Skipping inconsistent visitor session: site={} visitor={}", siteId, identifierHash);
                    continue;
                }
                sessions.add(VisitorActivitySession.builder()
                        .identifierHash(identifierHash)
                        .firstSeen(firstSeen)
                        .lastSeen(lastSeen)
                        .requestCount(s.getRequestCount())
                        .uaScore(s.getUaScore())
                        .build());
            } catch (DateTimeParseException | JsonProcessingException | ClassCastException ex) {
                log.warn("Skipping malformed visitor session: site={} field={} ({})", siteId, e.getKey(), ex.getMessage());
            }
        }
        // hash iteration order is not stable; sort so repeated fetches score identically
        sessions.sort(Comparator.comparing(VisitorActivitySession::getIdentifierHash));
        return sessions;
    }

    public void saveDailyStat(String siteId, DailyStat stat) {
        String key = KeyManager.getDailyStatsKey(props.getKeyPrefix(), requireSiteId(siteId));
        String json = toJson(new StoredDailyCounts(stat.getTotalVisits(), stat.getUniqueVisitors()));
        put(siteId, key, stat.getDate().toString(), json);
    }

    public void saveVisitorSession(String siteId, VisitorActivitySession session) {
        String key = KeyManager.getVisitorsKey(props.getKeyPrefix(), requireSiteId(siteId));
        String json = toJson(new StoredSession(
                session.getFirstSeen().toString(),
                session.getLastSeen().toString(),
                session.getRequestCount(),
                session.getUaScore()));
        put(siteId, key, session.getIdentifierHash(), json);
    }

    private Map<Object, Object> entries(String siteId, String key) {
        try {
            Map<Object, Object> h = redis.opsForHash().entries(key);
            return h == null ? Map.of() : h;
        } catch (DataAccessException e) {
            log.error("Failed to read {} for site {}", key, siteId, e);
            throw new SiteDataAccessException("Failed to read data of site " + siteId, e);
        }
    }

    private void put(String siteId, String key, String field, String json) {
        try {
            redis.opsForHash().put(key, field, json);
        } catch (DataAccessException e) {
            log.error("Failed to write {} field {} for site {}", key, field, siteId, e);
            throw new SiteDataAccessException("Failed to write data of site " + siteId, e);
        }
    }

    private String toJson(Object o) {
        try {
            return objectMapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + o.getClass().getSimpleName(), e);
        }
    }

    private static String requireSiteId(String siteId) {
        if (!StringUtils.hasText(siteId)) {
            throw new IllegalArgumentException("Site id must not be blank");
        }
        return siteId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class StoredDailyCounts {
        private long totalVisits;
        private long uniqueVisitors;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class StoredSession {
        private String firstSeen;
        private String lastSeen;
        private long requestCount;
        private Double uaScore;
    }
}
