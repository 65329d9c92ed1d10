package com.skillbench.core.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillbench.core.persistence.StoreMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a JSON object from free-form model text.
 * <p>
 * Tries, in order: the whole text, the first fenced {@code ```json} block, and the
 * span from the first {@code {} to the last {@code }}. Field names are read as snake_case.
 */
@Component
public class StructuredOutputParser {

    private static final Logger log = LoggerFactory.getLogger(StructuredOutputParser.class);

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");

    private final ObjectMapper mapper = StoreMapper.create();

    /**
     * @throws OracleException OUTPUT_PARSE_ERROR when no strategy yields a JSON object
     */
    public JsonNode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new OracleException(OracleErrorCode.OUTPUT_PARSE_ERROR, "empty output");
        }
        JsonNode direct = tryParse(raw.trim());
        if (direct != null) {
            return direct;
        }
        Matcher fenced = FENCED_BLOCK.matcher(raw);
        if (fenced.find()) {
            JsonNode block = tryParse(fenced.group(1).trim());
            if (block != null) {
                return block;
            }
        }
        int first = raw.indexOf('{');
        int last = raw.lastIndexOf('}');
        if (first >= 0 && last > first) {
            JsonNode span = tryParse(raw.substring(first, last + 1));
            if (span != null) {
                return span;
            }
        }
        log.debug("Unparsable model output ({} chars): {}", raw.length(),
                raw.substring(0, Math.min(200, raw.length())));
        throw new OracleException(OracleErrorCode.OUTPUT_PARSE_ERROR,
                "no JSON object found in model output");
    }

    public <T> T parse(String raw, Class<T> type) {
        JsonNode node = parse(raw);
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new OracleException(OracleErrorCode.OUTPUT_PARSE_ERROR,
                    "model output does not match " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode tryParse(String candidate) {
        try {
            JsonNode node = mapper.readTree(candidate);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
