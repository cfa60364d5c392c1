package com.zzf.miku.highlight.tool;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;

/**
 * Type checks for raw tool arguments. A missing field and an explicit JSON null both count as absent.
 */
final class ToolArguments {

    private ToolArguments() {}

    static boolean isAbsent(JsonNode args, String field) {
        JsonNode node = args.get(field);
        return node == null || node.isNull() || node.isMissingNode();
    }

    /**
     * @return the integral value, or null when the node is not a whole number in int range
     */
    static Integer intValue(JsonNode args, String field) {
        JsonNode node = args.get(field);
        if (node == null || !node.isNumber()) {
            return null;
        }
        double d = node.asDouble();
        if (Double.isNaN(d) || d != Math.rint(d) || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) {
            return null;
        }
        return (int) d;
    }

    static Integer positiveInt(JsonNode args, String field) {
        Integer v = intValue(args, field);
        return v != null && v > 0 ? v : null;
    }

    static Integer nonNegativeInt(JsonNode args, String field) {
        Integer v = intValue(args, field);
        return v != null && v >= 0 ? v : null;
    }

    static String string(JsonNode args, String field) {
        JsonNode node = args.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    static String nonEmptyString(JsonNode args, String field) {
        String s = string(args, field);
        return s != null && !s.isEmpty() ? s : null;
    }

    static Double normalizedNumber(JsonNode args, String field) {
        JsonNode node = args.get(field);
        if (node == null || !node.isNumber()) {
            return null;
        }
        double d = node.asDouble();
        return d >= 0 && d <= 1 ? d : null;
    }

    static Boolean bool(JsonNode args, String field) {
        JsonNode node = args.get(field);
        return node != null && node.isBoolean() ? node.asBoolean() : null;
    }

    static String oneOf(JsonNode args, String field, Collection<String> allowed) {
        String s = string(args, field);
        return s != null && allowed.contains(s) ? s : null;
    }
}
