package com.codelogickeep.coverage.model;

import com.codelogickeep.coverage.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CoverageTrendTest {

    @Test
    @DisplayName("history entries should use snake_case keys")
    void serialize_shouldUseHistoryKeys() throws Exception {
        CoverageTrend trend = new CoverageTrend("2026-03-01T12:00:00Z", 81.5, 66.0, 90.0, 77.25, 42, "abc123", "main");

        JsonNode node = JsonUtil.mapper().readTree(JsonUtil.toJson(trend));

        assertEquals(81.5, node.get("line_coverage").asDouble());
        assertEquals(66.0, node.get("branch_coverage").asDouble());
        assertEquals(90.0, node.get("function_coverage").asDouble());
        assertEquals(77.25, node.get("overall_score").asDouble());
        assertEquals(42, node.get("test_count").asInt());
        assertEquals("abc123", node.get("commit_hash").asText());
        assertEquals("main", node.get("branch_name").asText());
    }

    @Test
    @DisplayName("a stored entry should read back unchanged")
    void roundTrip_shouldPreserveFields() throws Exception {
        CoverageTrend trend = new CoverageTrend("2026-03-01T12:00:00Z", 81.5, 66.0, 90.0, 77.25, 42, "abc123", null);

        assertEquals(trend, JsonUtil.mapper().readValue(JsonUtil.toJson(trend), CoverageTrend.class));
    }

    @Test
    @DisplayName("unknown keys in stored history should be ignored")
    void deserialize_shouldIgnoreUnknownKeys() throws Exception {
        String json = """
                {"timestamp": "2026-02-01T08:30:00+02:00", "line_coverage": 70.0, "branch_coverage": 60.0,
                 "function_coverage": 75.0, "overall_score": 68.0, "test_count": 10, "author": "ci"}
                """;

        CoverageTrend trend = JsonUtil.mapper().readValue(json, CoverageTrend.class);

        assertEquals(70.0, trend.lineCoverage());
        assertNull(trend.commitId());
        assertEquals(Instant.parse("2026-02-01T06:30:00Z"), trend.instant());
    }

    @Test
    @DisplayName("valueOf should map tracked metrics onto fields")
    void valueOf_shouldReadTrackedMetric() {
        CoverageTrend trend = new CoverageTrend("2026-03-01T12:00:00Z", 81.5, 66.0, 90.0, 77.25, 42, null, null);

        assertEquals(81.5, trend.valueOf(TrackedMetric.LINE_COVERAGE));
        assertEquals(66.0, trend.valueOf(TrackedMetric.BRANCH_COVERAGE));
        assertEquals(90.0, trend.valueOf(TrackedMetric.FUNCTION_COVERAGE));
        assertEquals(77.25, trend.valueOf(TrackedMetric.OVERALL_SCORE));
    }

    @Test
    @DisplayName("gap type labels should be title cased")
    void gapTypeLabel_shouldBeReadable() {
        assertEquals("Missing Branch", GapType.MISSING_BRANCH.getLabel());
        assertEquals("Error Path", GapType.ERROR_PATH.getLabel());
        assertEquals("uncovered_lines", GapType.UNCOVERED_LINES.getValue());
    }
}
