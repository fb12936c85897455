package com.sentimento.service.core.ingest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentimento.live.model.Composites;
import com.sentimento.live.model.IsoTimestamps;
import com.sentimento.live.model.LiveEvent;
import java.time.Clock;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Shape and range checks for producer payloads of the form
 * {@code {"composites":{"hope":0.8,"sorrow":0.2},"metadata":{...}}}.
 *
 * <p>Values are never clamped: anything outside {@code [0.0, 1.0]} or not a JSON number is refused. The
 * event timestamp always comes from the server clock; a {@code timestamp} sent by the client is ignored
 * so producers cannot skew the metrics timeline.
 */
@Component
@RequiredArgsConstructor
public class IngestValidator {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Clock clock;
    private final ObjectMapper mapper;

    public ValidationResult validate(JsonNode raw) {
        if (raw == null || raw.isMissingNode() || raw.isNull()) {
            return ValidationResult.invalid("body", "request body is required");
        }
        if (!raw.isObject()) {
            return ValidationResult.invalid("body", "request body must be a JSON object");
        }
        JsonNode composites = raw.path("composites");
        if (!composites.isObject()) {
            return ValidationResult.invalid("composites", "composites object is required");
        }

        ValidationResult hopeProblem = checkScore(composites, "hope");
        if (hopeProblem != null) {
            return hopeProblem;
        }
        ValidationResult sorrowProblem = checkScore(composites, "sorrow");
        if (sorrowProblem != null) {
            return sorrowProblem;
        }

        JsonNode metadataNode = raw.path("metadata");
        Map<String, Object> metadata = Map.of();
        if (!metadataNode.isMissingNode() && !metadataNode.isNull()) {
            if (!metadataNode.isObject()) {
                return ValidationResult.invalid("metadata", "metadata must be a JSON object");
            }
            metadata = mapper.convertValue(metadataNode, MAP_TYPE);
        }

        Composites scores = new Composites(
                composites.get("hope").doubleValue(), composites.get("sorrow").doubleValue());
        return new ValidationResult.Valid(new LiveEvent(IsoTimestamps.now(clock), scores, metadata));
    }

    private static ValidationResult checkScore(JsonNode composites, String name) {
        String field = "composites." + name;
        JsonNode value = composites.get(name);
        if (value == null || value.isNull()) {
            return ValidationResult.invalid(field, field + " is required");
        }
        if (!value.isNumber()) {
            return ValidationResult.invalid(field, field + " must be a number");
        }
        if (!Composites.inRange(value.doubleValue())) {
            return ValidationResult.invalid(
                    field, field + " must be between 0.0 and 1.0, got " + value.asText());
        }
        return null;
    }
}
