package com.mailmind.triage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailmind.exception.ValidationException;
import com.mailmind.priority.BaseClassification;
import com.mailmind.priority.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses model output of the form {@code {"priority": "High", "confidence": 0.9}}.
 *
 * <p>Models wrap the object in prose or code fences, so the first {@code {...}} span
 * is parsed. Anything unusable yields {@link BaseClassification#neutral()}.
 */
public class BaseClassificationParser {

    private static final Logger log = LoggerFactory.getLogger(BaseClassificationParser.class);

    private final ObjectMapper objectMapper;

    public BaseClassificationParser() {
        this(new ObjectMapper());
    }

    public BaseClassificationParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public BaseClassification parse(String output) {
        if (output == null) {
            return BaseClassification.neutral();
        }
        int start = output.indexOf('{');
        int end = output.lastIndexOf('}');
        if (start < 0 || end <= start) {
            log.debug("No JSON object in model output, using neutral classification");
            return BaseClassification.neutral();
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(output.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            log.debug("Unparsable model output ({}), using neutral classification", e.getOriginalMessage());
            return BaseClassification.neutral();
        }

        Priority priority;
        try {
            priority = Priority.fromLabel(node.path("priority").asText(""));
        } catch (ValidationException e) {
            log.debug("Unknown priority in model output: {}", node.path("priority"));
            return BaseClassification.neutral();
        }

        JsonNode confidenceNode = node.path("confidence");
        double confidence = confidenceNode.isNumber()
                ? confidenceNode.asDouble()
                : confidenceNode.asDouble(BaseClassification.neutral().confidence());
        if (Double.isNaN(confidence)) {
            confidence = BaseClassification.neutral().confidence();
        }
        return new BaseClassification(priority, Math.max(0.0, Math.min(1.0, confidence)));
    }
}
