package com.cropcopilot.advisor.service.synthesis;

import com.cropcopilot.advisor.model.recommendation.ConditionType;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keyword classification of free-text symptoms into a condition category.
 *
 * <p>Rules are tried in order and the first match wins; text matching none
 * of them is {@link ConditionType#UNKNOWN}.
 */
@Component
public class ConditionClassifier {

    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("chlorosis|deficien|nutrient|yellowing between veins|interveinal"),
                    ConditionType.DEFICIENCY, "probable_nutrient_deficiency_or_root_stress"),
            new Rule(Pattern.compile("aphid|insect|mite|worm|beetle|larva|pest"),
                    ConditionType.PEST, "probable_insect_pressure"),
            new Rule(Pattern.compile("drought|frost|heat|waterlogging|environment"),
                    ConditionType.ENVIRONMENTAL, "probable_environmental_stress"),
            new Rule(Pattern.compile("lesion|blight|rot|mold|fung|bacter|viral|disease"),
                    ConditionType.DISEASE, "probable_foliar_disease"));

    private static final Classification UNCERTAIN =
            new Classification(ConditionType.UNKNOWN, "uncertain_field_issue");

    public Classification classify(String text) {
        if (text == null || text.isBlank()) {
            return UNCERTAIN;
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (rule.pattern.matcher(normalized).find()) {
                return new Classification(rule.type, rule.condition);
            }
        }
        return UNCERTAIN;
    }

    @Value
    public static class Classification {
        ConditionType conditionType;
        String condition;
    }

    private static final class Rule {
        private final Pattern pattern;
        private final ConditionType type;
        private final String condition;

        private Rule(Pattern pattern, ConditionType type, String condition) {
            this.pattern = pattern;
            this.type = type;
            this.condition = condition;
        }
    }
}
