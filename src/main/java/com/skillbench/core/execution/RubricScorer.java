package com.skillbench.core.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.skillbench.core.model.Score;
import com.skillbench.core.model.ScoreDimension;
import com.skillbench.core.model.TestCase;
import com.skillbench.core.oracle.OracleClient;
import com.skillbench.core.oracle.OracleErrorCode;
import com.skillbench.core.oracle.OracleException;
import com.skillbench.core.oracle.OracleOptions;
import com.skillbench.core.oracle.OracleProperties;
import com.skillbench.core.oracle.OracleResponse;
import com.skillbench.core.oracle.StructuredOutputParser;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Asks the oracle to grade a task output against the six-dimension rubric.
 */
@Component
public class RubricScorer {

    static final String PROMPT_TEMPLATE = """
            You are an expert code-quality reviewer. Score the generated result below objectively \
            against the rubric.

            [Test input]
            {test_input}

            [Expected output description]
            {expected_output}

            [Actual output]
            {actual_output}

            [Rubric, 100 points in total]
            Score each of the six dimensions:

            1. Functional correctness (0-30)
               - Does the output implement what the test input asks for?
               - Is the core logic correct?
               - Does it meet the key requirements of the expected output?

            2. Robustness (0-20)
               - Are error conditions caught and handled?
               - Are edge cases (empty, huge, illegal input) covered?

            3. Readability (0-15)
               - Are names meaningful?
               - Is the structure easy to follow?

            4. Conciseness (0-15)
               - Is there redundant or duplicated logic?

            5. Complexity control (0-10)
               - Is needless nesting avoided and the work sensibly split?

            6. Format compliance (0-10)
               - Does the output follow the usual conventions of its language?

            [Rules]
            1. Reply with JSON only: no prose, no Markdown fences.
            2. total must equal the sum of the six scores.

            [Reply format]
            {
              "scores": {
                "functional_correctness": <integer 0-30>,
                "robustness": <integer 0-20>,
                "readability": <integer 0-15>,
                "conciseness": <integer 0-15>,
                "complexity_control": <integer 0-10>,
                "format_compliance": <integer 0-10>,
                "total": <sum of the above>
              },
              "reasoning": "<one short justification per dimension, as name(score/max): reason; ...>"
            }""";

    private final OracleClient oracle;
    private final StructuredOutputParser parser;
    private final OracleProperties properties;

    public RubricScorer(OracleClient oracle, StructuredOutputParser parser, OracleProperties properties) {
        this.oracle = oracle;
        this.parser = parser;
        this.properties = properties;
    }

    /**
     * @throws OracleException when the oracle call fails or its answer carries no scores
     */
    public ScoringResult score(TestCase testCase, String actualOutput, Path workingDir, String model) {
        String prompt = buildPrompt(testCase, actualOutput);
        var options = OracleOptions.of(workingDir,
                Duration.ofSeconds(properties.getScoringTimeoutSeconds()), model);
        OracleResponse response = oracle.generate(prompt, options);
        return parseVerdict(response.text());
    }

    static String buildPrompt(TestCase testCase, String actualOutput) {
        return PROMPT_TEMPLATE
                .replace("{test_input}", nullToEmpty(testCase.input()))
                .replace("{expected_output}", nullToEmpty(testCase.expectedOutput()))
                .replace("{actual_output}", nullToEmpty(actualOutput));
    }

    /**
     * Reads the scores object. The total is always recomputed from the sub-scores.
     */
    ScoringResult parseVerdict(String text) {
        JsonNode root = parser.parse(text);
        JsonNode scores = root.path("scores");
        if (!scores.isObject()) {
            throw new OracleException(OracleErrorCode.OUTPUT_PARSE_ERROR, "verdict has no scores object");
        }
        Score score = Score.of(
                dimension(scores, ScoreDimension.FUNCTIONAL_CORRECTNESS),
                dimension(scores, ScoreDimension.ROBUSTNESS),
                dimension(scores, ScoreDimension.READABILITY),
                dimension(scores, ScoreDimension.CONCISENESS),
                dimension(scores, ScoreDimension.COMPLEXITY_CONTROL),
                dimension(scores, ScoreDimension.FORMAT_COMPLIANCE));
        return new ScoringResult(score, root.path("reasoning").asText(""));
    }

    private static int dimension(JsonNode scores, ScoreDimension dimension) {
        JsonNode value = scores.path(dimension.key());
        if (value.isNumber()) {
            return (int) Math.round(value.asDouble());
        }
        if (value.isTextual()) {
            try {
                return (int) Math.round(Double.parseDouble(value.asText().trim()));
            } catch (NumberFormatException e) {
                throw new OracleException(OracleErrorCode.OUTPUT_PARSE_ERROR,
                        "verdict score " + dimension.key() + " is not a number: " + value.asText(), e);
            }
        }
        throw new OracleException(OracleErrorCode.OUTPUT_PARSE_ERROR,
                "verdict is missing a numeric " + dimension.key() + " score");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
