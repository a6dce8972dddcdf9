package com.coverwise.insurance.rules;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses the JSON condition object stored on discount and eligibility rules.
 *
 * <pre>
 * {"min_fleet_size": 5, "max_claim_ratio": 0.2, "min_years_no_claim": 3,
 *  "age_range": [25, 60], "min_age": 18, "max_age": 65, "min_income": 300000}
 * </pre>
 *
 * Every present key becomes one conjunct. Unknown keys are ignored with a warning.
 */
@Slf4j
@Component
public class ConditionParser {

    public RuleCondition parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return RuleCondition.AllOf.empty();
        }
        if (!node.isObject()) {
            throw new InvalidRuleConditionException("$", "condition must be a JSON object");
        }
        List<RuleCondition> conditions = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            switch (key) {
                case "min_fleet_size" -> conditions.add(new RuleCondition.MinFleetSize(intValue(key, value)));
                case "max_claim_ratio" -> conditions.add(new RuleCondition.MaxClaimRatio(decimalValue(key, value)));
                case "min_years_no_claim" -> conditions.add(new RuleCondition.MinYearsNoClaim(intValue(key, value)));
                case "age_range" -> conditions.add(ageRange(key, value));
                case "min_age" -> conditions.add(new RuleCondition.MinAge(intValue(key, value)));
                case "max_age" -> conditions.add(new RuleCondition.MaxAge(intValue(key, value)));
                case "min_income" -> conditions.add(new RuleCondition.MinIncome(decimalValue(key, value)));
                default -> log.warn("Ignoring unknown rule condition key '{}'", key);
            }
        }
        return new RuleCondition.AllOf(conditions);
    }

    private RuleCondition ageRange(String key, JsonNode value) {
        if (!value.isArray() || value.size() != 2) {
            throw new InvalidRuleConditionException(key, "expected [min, max]");
        }
        int min = intValue(key, value.get(0));
        int max = intValue(key, value.get(1));
        if (min > max) {
            throw new InvalidRuleConditionException(key, "min " + min + " exceeds max " + max);
        }
        return new RuleCondition.AgeRange(min, max);
    }

    private int intValue(String key, JsonNode value) {
        if (value == null || !value.isIntegralNumber()) {
            throw new InvalidRuleConditionException(key, "expected an integer but was " + value);
        }
        return value.intValue();
    }

    private BigDecimal decimalValue(String key, JsonNode value) {
        if (value == null || !value.isNumber()) {
            throw new InvalidRuleConditionException(key, "expected a number but was " + value);
        }
        return value.decimalValue();
    }
}
