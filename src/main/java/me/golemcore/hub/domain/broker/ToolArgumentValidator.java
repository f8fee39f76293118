package me.golemcore.hub.domain.broker;

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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks tool arguments against the subset of JSON Schema that tool servers
 * advertise in practice: {@code type}, {@code required}, {@code properties},
 * {@code enum}, {@code items} and {@code additionalProperties: false}.
 * Unknown keywords are ignored.
 */
public final class ToolArgumentValidator {

    private ToolArgumentValidator() {
    }

    /**
     * Returns human-readable violations; empty when the arguments conform.
     */
    public static List<String> validate(Map<String, Object> schema, Map<String, Object> arguments) {
        List<String> violations = new ArrayList<>();
        if (schema == null || schema.isEmpty()) {
            return violations;
        }
        validateValue("arguments", schema, arguments != null ? arguments : Map.of(), violations);
        return violations;
    }

    @SuppressWarnings("unchecked")
    private static void validateValue(String path, Map<String, Object> schema, Object value,
            List<String> violations) {
        Object type = schema.get("type");
        if (type instanceof String && !matchesType((String) type, value)) {
            violations.add(path + ": expected " + type + " but got " + describe(value));
            return;
        }

        Object allowed = schema.get("enum");
        if (allowed instanceof Collection && !((Collection<?>) allowed).contains(value)) {
            violations.add(path + ": value " + value + " is not one of " + allowed);
        }

        if (value instanceof Map) {
            validateObject(path, schema, (Map<String, Object>) value, violations);
        } else if (value instanceof List && schema.get("items") instanceof Map) {
            Map<String, Object> itemSchema = (Map<String, Object>) schema.get("items");
            List<?> items = (List<?>) value;
            for (int i = 0; i < items.size(); i++) {
                validateValue(path + "[" + i + "]", itemSchema, items.get(i), violations);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static void validateObject(String path, Map<String, Object> schema, Map<String, Object> value,
            List<String> violations) {
        Object required = schema.get("required");
        if (required instanceof Collection) {
            for (Object name : (Collection<?>) required) {
                if (!value.containsKey(String.valueOf(name))) {
                    violations.add(path + ": missing required property '" + name + "'");
                }
            }
        }

        Map<String, Object> properties = schema.get("properties") instanceof Map
                ? (Map<String, Object>) schema.get("properties")
                : Map.of();
        boolean closed = Boolean.FALSE.equals(schema.get("additionalProperties"));

        for (Map.Entry<String, Object> entry : value.entrySet()) {
            Object propertySchema = properties.get(entry.getKey());
            if (propertySchema instanceof Map) {
                validateValue(path + "." + entry.getKey(), (Map<String, Object>) propertySchema,
                        entry.getValue(), violations);
            } else if (closed) {
                violations.add(path + ": unexpected property '" + entry.getKey() + "'");
            }
        }
    }

    private static boolean matchesType(String type, Object value) {
        switch (type) {
        case "object":
            return value instanceof Map;
        case "array":
            return value instanceof List;
        case "string":
            return value instanceof String;
        case "boolean":
            return value instanceof Boolean;
        case "integer":
            return value instanceof Integer || value instanceof Long
                    || value instanceof Number && ((Number) value).doubleValue() % 1 == 0;
        case "number":
            return value instanceof Number;
        case "null":
            return value == null;
        default:
            return true;
        }
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Map) {
            return "object";
        }
        if (value instanceof List) {
            return "array";
        }
        return value.getClass().getSimpleName().toLowerCase(Locale.ROOT);
    }
}
