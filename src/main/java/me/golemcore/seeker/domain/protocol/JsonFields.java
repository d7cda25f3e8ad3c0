/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.seeker.domain.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Typed field accessors that raise {@link SchemaViolation} instead of guessing
 * defaults.
 */
final class JsonFields {

    private JsonFields() {
    }

    static JsonNode requireField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new SchemaViolation(DecodeFailureReason.MISSING_FIELD, field);
        }
        return value;
    }

    static String requireString(JsonNode node, String field) {
        JsonNode value = requireField(node, field);
        if (!value.isTextual()) {
            throw wrongType(field, "string", value);
        }
        return value.asText();
    }

    static String requireNonBlankString(JsonNode node, String field) {
        String value = requireString(node, field);
        if (value.isBlank()) {
            throw new SchemaViolation(DecodeFailureReason.INVALID_VALUE, field + " must not be blank");
        }
        return value;
    }

    static String optionalString(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw wrongType(field, "string", value);
        }
        return value.asText();
    }

    static List<String> requireStringArray(JsonNode node, String field) {
        return toStringList(field, requireField(node, field));
    }

    static List<String> optionalStringArray(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        return toStringList(field, value);
    }

    static double requireNumberInRange(JsonNode node, String field, double min, double max) {
        JsonNode value = requireField(node, field);
        if (!value.isNumber()) {
            throw wrongType(field, "number", value);
        }
        double number = value.asDouble();
        if (Double.isNaN(number) || number < min || number > max) {
            throw new SchemaViolation(DecodeFailureReason.INVALID_VALUE,
                    field + " must be within [" + min + ", " + max + "], got " + value.asText());
        }
        return number;
    }

    static Integer optionalPositiveInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isIntegralNumber()) {
            throw wrongType(field, "integer", value);
        }
        if (!value.canConvertToInt() || value.asInt() <= 0) {
            throw new SchemaViolation(DecodeFailureReason.INVALID_VALUE, field + " must be a positive integer");
        }
        return value.asInt();
    }

    static JsonNode requireObject(JsonNode node, String field) {
        JsonNode value = requireField(node, field);
        if (!value.isObject()) {
            throw wrongType(field, "object", value);
        }
        return value;
    }

    private static List<String> toStringList(String field, JsonNode value) {
        if (!value.isArray()) {
            throw wrongType(field, "array of strings", value);
        }
        List<String> result = new ArrayList<>(value.size());
        for (JsonNode element : value) {
            if (!element.isTextual()) {
                throw wrongType(field + "[]", "string", element);
            }
            result.add(element.asText());
        }
        return result;
    }

    private static SchemaViolation wrongType(String field, String expected, JsonNode actual) {
        return new SchemaViolation(DecodeFailureReason.WRONG_TYPE,
                field + " must be " + expected + ", got " + actual.getNodeType().name().toLowerCase(Locale.ROOT));
    }
}
