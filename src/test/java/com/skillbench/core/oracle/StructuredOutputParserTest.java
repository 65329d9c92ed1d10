package com.skillbench.core.oracle;

import com.skillbench.core.analysis.AnalysisReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StructuredOutputParserTest {

    private final StructuredOutputParser parser = new StructuredOutputParser();

    @Test
    @DisplayName("parses bare JSON")
    void parsesBareJson() {
        assertEquals(42, parser.parse("{\"total\": 42}").get("total").asInt());
    }

    @Test
    @DisplayName("parses a fenced json block surrounded by prose")
    void parsesFencedBlock() {
        String raw = "Here is the verdict:\n```json\n{\"total\": 7}\n```\nThanks.";
        assertEquals(7, parser.parse(raw).get("total").asInt());
    }

    @Test
    @DisplayName("falls back to the first-brace to last-brace span")
    void parsesBraceSpan() {
        String raw = "verdict -> {\"scores\": {\"robustness\": 12}} <- end";
        assertEquals(12, parser.parse(raw).path("scores").path("robustness").asInt());
    }

    @Test
    @DisplayName("rejects text without a JSON object")
    void rejectsProse() {
        var ex = assertThrows(OracleException.class, () -> parser.parse("no json here"));
        assertEquals(OracleErrorCode.OUTPUT_PARSE_ERROR, ex.getCode());
        assertThrows(OracleException.class, () -> parser.parse("   "));
        assertThrows(OracleException.class, () -> parser.parse("[1, 2, 3]"));
    }

    @Test
    @DisplayName("binds snake_case fields to a typed result")
    void bindsTypedResult() {
        String raw = """
                {"best_skill_id": "s1", "best_skill_name": "Alpha",
                 "dimension_leaders": {"robustness": "s2"},
                 "advantage_segments": [{"id": "seg_001", "skill_id": "s1", "type": "role", "content": "You are..."}],
                 "issues": []}
                """;
        AnalysisReport report = parser.parse(raw, AnalysisReport.class);

        assertEquals("s1", report.bestSkillId());
        assertEquals("s2", report.dimensionLeaders().get("robustness"));
        assertEquals("seg_001", report.advantageSegments().get(0).id());
    }
}
