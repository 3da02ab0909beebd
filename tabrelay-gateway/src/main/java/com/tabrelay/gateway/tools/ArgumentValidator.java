package com.tabrelay.gateway.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Programmatic checks of tool arguments against the declared input schema.
 * Supports the subset the catalog uses: type, required, enum, minimum and maximum.
 * Every failure is reported, not just the first.
 */
public class ArgumentValidator {

    static final String CONTAINS_GUIDANCE = "The :contains() pseudo-selector is not valid CSS and is not supported "
            + "by browsers. Use contains() with the `xpath` property instead!";

    public List<String> validate(ToolDefinition tool, JsonNode args) {
        List<String> errors = new ArrayList<>();
        if (args != null && !args.isNull() && !args.isObject()) {
            errors.add("arguments: Expected object, received " + describe(args));
            return errors;
        }
        JsonNode schema = tool.getInputSchema();
        if (schema == null) {
            return errors;
        }

        for (JsonNode required : schema.path("required")) {
            String field = required.asText();
            JsonNode value = args != null ? args.get(field) : null;
            if (value == null || value.isNull()) {
                errors.add(field + ": Required");
            }
        }

        if (args != null && args.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = schema.path("properties").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> property = fields.next();
                JsonNode value = args.get(property.getKey());
                if (value != null && !value.isNull()) {
                    checkValue(property.getKey(), property.getValue(), value, errors);
                }
            }
            JsonNode selector = args.get("selector");
            if (selector != null && selector.isTextual() && selector.asText().contains(":contains(")) {
                errors.add(CONTAINS_GUIDANCE);
            }
        }
        return errors;
    }

    private void checkValue(String field, JsonNode schema, JsonNode value, List<String> errors) {
        String type = schema.path("type").asText(null);
        if (type != null && !matchesType(type, value)) {
            errors.add(field + ": Expected " + type + ", received " + describe(value));
            return;
        }

        JsonNode allowed = schema.get("enum");
        if (allowed != null && allowed.isArray()) {
            boolean match = StreamSupport.stream(allowed.spliterator(), false).anyMatch(value::equals);
            if (!match) {
                String options = StreamSupport.stream(allowed.spliterator(), false)
                        .map(v -> "'" + v.asText() + "'")
                        .collect(Collectors.joining(" | "));
                errors.add(field + ": Invalid enum value. Expected " + options + ", received '" + value.asText() + "'");
            }
        }

        if (value.isNumber()) {
            JsonNode min = schema.get("minimum");
            if (min != null && min.isNumber() && value.doubleValue() < min.doubleValue()) {
                errors.add(field + ": Number must be greater than or equal to " + min.asText());
            }
            JsonNode max = schema.get("maximum");
            if (max != null && max.isNumber() && value.doubleValue() > max.doubleValue()) {
                errors.add(field + ": Number must be less than or equal to " + max.asText());
            }
        }
    }

    private static boolean matchesType(String type, JsonNode value) {
        return switch (type) {
            case "string" -> value.isTextual();
            case "number" -> value.isNumber();
            case "integer" -> value.isIntegralNumber()
                    || (value.isNumber() && value.doubleValue() == Math.rint(value.doubleValue()));
            case "boolean" -> value.isBoolean();
            case "object" -> value.isObject();
            case "array" -> value.isArray();
            default -> true;
        };
    }

    private static String describe(JsonNode value) {
        if (value.isTextual()) return "string";
        if (value.isNumber()) return "number";
        if (value.isBoolean()) return "boolean";
        if (value.isArray()) return "array";
        if (value.isObject()) return "object";
        return "null";
    }
}
