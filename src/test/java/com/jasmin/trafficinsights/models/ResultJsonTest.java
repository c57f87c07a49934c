package com.jasmin.trafficinsights.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Result JSON")
class ResultJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should write forecasts in snake case")
    void shouldWriteForecast() {
        ForecastResult result = ForecastResult.builder()
                .canForecast(true)
                .forecast(List.of(new ForecastPoint("2024-01-11", 150)))
                .trend("increasing")
                .slope(5.0)
                .build();

        JsonNode json = mapper.valueToTree(result);

        assertThat(json.get("can_forecast").asBoolean()).isTrue();
        assertThat(json.get("forecast").get(0).get("predicted_visits").asLong()).isEqualTo(150);
        assertThat(json.get("forecast").get(0).get("date").asText()).isEqualTo("2024-01-11");
        assertThat(json.has("message")).isFalse();
    }

    @Test
    @DisplayName("Should omit forecast fields when there was not enough data")
    void shouldOmitForecastFields() {
        JsonNode json = mapper.valueToTree(ForecastResult.notEnoughData("Not enough data."));

        assertThat(json.get("can_forecast").asBoolean()).isFalse();
        assertThat(json.get("message").asText()).isEqualTo("Not enough data.");
        assertThat(json.has("forecast")).isFalse();
        assertThat(json.has("trend")).isFalse();
        assertThat(json.has("slope")).isFalse();
    }

    @Test
    @DisplayName("Should write only the error of an empty summary")
    void shouldWriteSummaryError() {
        JsonNode json = mapper.valueToTree(SummaryResult.error("No data available"));

        assertThat(json.size()).isEqualTo(1);
        assertThat(json.get("error").asText()).isEqualTo("No data available");
    }

    @Test
    @DisplayName("Should nest weekly growth in snake case")
    void shouldWriteWeeklyGrowth() {
        SummaryResult summary = SummaryResult.builder()
                .averageDailyVisits(18.3)
                .averageDailyUnique(5.7)
                .busiestDayOfWeek("Friday")
                .weeklyGrowth(new SummaryResult.WeeklyGrowth(105, 70, 50.0))
                .build();

        JsonNode json = mapper.valueToTree(summary);

        assertThat(json.get("average_daily_visits").asDouble()).isEqualTo(18.3);
        assertThat(json.get("busiest_day_of_week").asText()).isEqualTo("Friday");
        assertThat(json.get("weekly_growth").get("current_week_visits").asLong()).isEqualTo(105);
        assertThat(json.get("weekly_growth").get("growth_rate_percent").asDouble()).isEqualTo(50.0);
        assertThat(json.has("error")).isFalse();
    }

    @Test
    @DisplayName("Should write anomaly and bot results")
    void shouldWriteDetectorResults() {
        JsonNode anomalies = mapper.valueToTree(AnomalyResult.of(List.of(new AnomalyRecord("2024-01-05", 1000, "spike"))));
        JsonNode bots = mapper.valueToTree(BotResult.of(List.of(new BotRecord("abc", 5000, "Unusual Pattern"))));

        assertThat(anomalies.get("has_anomalies").asBoolean()).isTrue();
        assertThat(anomalies.get("anomalies").get(0).get("type").asText()).isEqualTo("spike");
        assertThat(bots.get("detected_bots_count").asInt()).isEqualTo(1);
        assertThat(bots.get("bots").get(0).get("identifier_hash").asText()).isEqualTo("abc");
        assertThat(bots.get("bots").get(0).get("request_count").asLong()).isEqualTo(5000);
        assertThat(bots.has("message")).isFalse();
    }
}
