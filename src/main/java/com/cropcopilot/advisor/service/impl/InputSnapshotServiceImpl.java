package com.cropcopilot.advisor.service.impl;

import com.cropcopilot.advisor.model.intake.FieldInputEntity;
import com.cropcopilot.advisor.model.recommendation.InputSnapshot;
import com.cropcopilot.advisor.model.recommendation.InputType;
import com.cropcopilot.advisor.model.retrieval.ImageObservation;
import com.cropcopilot.advisor.repository.FieldInputRepository;
import com.cropcopilot.advisor.service.InputSnapshotService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds {@link InputSnapshot}s from stored field inputs.
 *
 * Lab data and image observations are stored as JSON text; malformed JSON
 * is logged and treated as absent rather than failing the request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InputSnapshotServiceImpl implements InputSnapshotService {

    private static final TypeReference<List<ImageObservation>> OBSERVATION_LIST = new TypeReference<>() {
    };

    private final FieldInputRepository fieldInputRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<InputSnapshot> load(String inputId, String userId) {
        return fieldInputRepository.findByIdAndUserId(inputId, userId).map(this::toSnapshot);
    }

    private InputSnapshot toSnapshot(FieldInputEntity entity) {
        return InputSnapshot.builder()
                .type(InputType.fromValue(entity.getType()))
                .imageUrl(entity.getImageUrl())
                .crop(entity.getCrop())
                .location(entity.getLocation())
                .season(entity.getSeason())
                .description(entity.getDescription())
                .labData(parseLabData(entity.getId(), entity.getLabData()))
                .imageObservations(parseObservations(entity.getId(), entity.getImageObservations()))
                .build();
    }

    /**
     * Numeric entries only; other values are skipped.
     */
    private Map<String, Double> parseLabData(String inputId, String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                log.warn("⚠️  Lab data of input {} is not a JSON object, ignoring", inputId);
                return null;
            }
            Map<String, Double> values = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isNumber()) {
                    values.put(field.getKey(), field.getValue().asDouble());
                } else {
                    log.debug("Skipping non-numeric lab value {} on input {}", field.getKey(), inputId);
                }
            }
            return values;
        } catch (JsonProcessingException e) {
            log.warn("⚠️  Malformed lab data on input {}: {}", inputId, e.getOriginalMessage());
            return null;
        }
    }

    private List<ImageObservation> parseObservations(String inputId, String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<ImageObservation> observations = objectMapper.readValue(json, OBSERVATION_LIST);
            return observations == null ? List.of() : observations;
        } catch (JsonProcessingException e) {
            log.warn("⚠️  Malformed image observations on input {}: {}", inputId, e.getOriginalMessage());
            return List.of();
        }
    }
}
