package com.cropcopilot.advisor.service.synthesis;

import com.cropcopilot.advisor.exception.ModelOutputParseException;
import com.cropcopilot.advisor.model.recommendation.ModelOutput;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the JSON object from a model answer, tolerating code fences and
 * surrounding prose.
 *
 * <p>Fields are read leniently: a field of the wrong JSON type is left null
 * rather than failing the whole answer, so normalization can fall back for
 * that field alone.
 */
@Component
@RequiredArgsConstructor
public class ModelOutputParser {

    private static final Pattern LEADING_FENCE = Pattern.compile("^```(?:json)?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```$");
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");

    private final ObjectMapper objectMapper;

    public ModelOutput parse(String raw) throws ModelOutputParseException {
        if (raw == null || raw.isBlank()) {
            throw new ModelOutputParseException("Model output was empty");
        }
        String cleaned = TRAILING_FENCE.matcher(LEADING_FENCE.matcher(raw.trim()).replaceFirst(""))
                .replaceFirst("")
                .trim();

        Matcher matcher = JSON_OBJECT.matcher(cleaned);
        if (!matcher.find()) {
            throw new ModelOutputParseException("Model output did not include a JSON object");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(matcher.group());
        } catch (JsonProcessingException e) {
            throw new ModelOutputParseException("Model output JSON was malformed: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ModelOutputParseException("Model output JSON root must be an object");
        }
        return toModelOutput(root);
    }

    private ModelOutput toModelOutput(JsonNode root) {
        ModelOutput output = new ModelOutput();
        output.setConfidence(number(root.get("confidence")));

        JsonNode diagnosisNode = root.get("diagnosis");
        if (diagnosisNode != null && diagnosisNode.isObject()) {
            ModelOutput.RawDiagnosis diagnosis = new ModelOutput.RawDiagnosis();
            diagnosis.setCondition(text(diagnosisNode.get("condition")));
            diagnosis.setConditionType(text(diagnosisNode.get("conditionType")));
            diagnosis.setConfidence(number(diagnosisNode.get("confidence")));
            diagnosis.setReasoning(text(diagnosisNode.get("reasoning")));
            output.setDiagnosis(diagnosis);
        }

        JsonNode recommendationsNode = root.get("recommendations");
        if (recommendationsNode != null && recommendationsNode.isArray()) {
            List<ModelOutput.RawRecommendation> recommendations = new ArrayList<>();
            for (JsonNode node : recommendationsNode) {
                if (!node.isObject()) {
                    continue;
                }
                ModelOutput.RawRecommendation recommendation = new ModelOutput.RawRecommendation();
                recommendation.setAction(text(node.get("action")));
                recommendation.setPriority(text(node.get("priority")));
                recommendation.setTiming(text(node.get("timing")));
                recommendation.setDetails(text(node.get("details")));
                recommendation.setCitations(textList(node.get("citations")));
                recommendations.add(recommendation);
            }
            output.setRecommendations(recommendations);
        }

        JsonNode productsNode = root.get("products");
        if (productsNode != null && productsNode.isArray()) {
            List<ModelOutput.RawProduct> products = new ArrayList<>();
            for (JsonNode node : productsNode) {
                if (!node.isObject()) {
                    continue;
                }
                ModelOutput.RawProduct product = new ModelOutput.RawProduct();
                product.setProductId(text(node.get("productId")));
                product.setProductName(text(node.has("productName") ? node.get("productName") : node.get("name")));
                product.setReason(text(node.get("reason")));
                product.setApplicationRate(text(node.get("applicationRate")));
                product.setAlternatives(textList(node.get("alternatives")));
                products.add(product);
            }
            output.setProducts(products);
        }
        return output;
    }

    private static String text(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }

    private static Double number(JsonNode node) {
        return node != null && node.isNumber() ? node.asDouble() : null;
    }

    private static List<String> textList(JsonNode node) {
        if (node == null || !node.isArray()) {
            return null;
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isTextual()) {
                values.add(item.asText());
            }
        }
        return values;
    }
}
