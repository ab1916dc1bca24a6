/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.toolshape.core.engine.networknt;

import com.fasterxml.jackson.databind.JsonNode;
import com.phonepe.toolshape.core.model.ValidationErrorRecord;
import com.phonepe.toolshape.core.schema.NodeKind;
import com.phonepe.toolshape.core.schema.SchemaField;
import com.phonepe.toolshape.core.schema.SchemaNode;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps engine messages to error records with the kinds and messages LLMs know from pydantic. The expected type and the
 * violated bound are read from the model's own shape, found by following the instance location of the message.
 */
@Slf4j
class ValidationMessageMapper {
    private final SchemaNode shape;

    ValidationMessageMapper(SchemaNode shape) {
        this.shape = shape;
    }

    List<ValidationErrorRecord> map(final Collection<ValidationMessage> messages, final JsonNode input) {
        return messages.stream()
                .map(message -> map(message, input))
                .sorted(Comparator.comparingInt(this::declarationIndex))
                .toList();
    }

    private ValidationErrorRecord map(ValidationMessage message, JsonNode input) {
        final var keyword = message.getType();
        final var location = location(message);
        log.debug("Mapping {} failure at {}: {}", keyword, location, message.getMessage());
        if ("required".equals(keyword)) {
            final var withProperty = new ArrayList<>(location);
            withProperty.add(missingProperty(message));
            return ValidationErrorRecord.builder()
                    .kind("missing")
                    .location(withProperty)
                    .message("Field required")
                    .input(resolve(input, location))
                    .build();
        }
        final var target = shapeAt(location);
        final var value = resolve(input, location);
        final var builder = ValidationErrorRecord.builder()
                .location(location)
                .input(value);
        return switch (keyword) {
            case "type" -> typeError(builder, target, value, message);
            case "enum" -> {
                final var expected = expected(constraint(target, "enum", message));
                yield builder.kind("enum")
                        .message("Input should be " + expected)
                        .context(contextOf("expected", expected))
                        .build();
            }
            case "const" -> {
                final var expected = expected(constraint(target, "const", message));
                yield builder.kind("literal_error")
                        .message("Input should be " + expected)
                        .context(contextOf("expected", expected))
                        .build();
            }
            case "pattern" -> {
                final var pattern = text(constraint(target, "pattern", message));
                yield builder.kind("string_pattern_mismatch")
                        .message("String should match pattern '%s'".formatted(pattern))
                        .context(contextOf("pattern", pattern))
                        .build();
            }
            case "minLength" -> lengthError(builder, "string_too_short", "String should have at least %s character%s",
                                            "min_length", constraint(target, keyword, message));
            case "maxLength" -> lengthError(builder, "string_too_long", "String should have at most %s character%s",
                                            "max_length", constraint(target, keyword, message));
            case "minimum" -> boundError(builder, "greater_than_equal", "greater than or equal to", "ge",
                                         constraint(target, keyword, message));
            case "maximum" -> boundError(builder, "less_than_equal", "less than or equal to", "le",
                                         constraint(target, keyword, message));
            case "exclusiveMinimum" -> boundError(builder, "greater_than", "greater than", "gt",
                                                  constraint(target, keyword, message));
            case "exclusiveMaximum" -> boundError(builder, "less_than", "less than", "lt",
                                                  constraint(target, keyword, message));
            case "minItems" -> itemsError(builder, "too_short", "at least", "min_length",
                                          constraint(target, keyword, message), value);
            case "maxItems" -> itemsError(builder, "too_long", "at most", "max_length",
                                          constraint(target, keyword, message), value);
            case "multipleOf" -> {
                final var bound = constraint(target, keyword, message);
                yield builder.kind("multiple_of")
                        .message("Input should be a multiple of " + text(bound))
                        .context(contextOf("multiple_of", number(bound)))
                        .build();
            }
            default -> builder.kind(keyword)
                    .message(message.getMessage())
                    .build();
        };
    }

    private static ValidationErrorRecord typeError(
            ValidationErrorRecord.ValidationErrorRecordBuilder builder,
            SchemaNode target,
            JsonNode value,
            ValidationMessage message) {
        final var textual = null != value && value.isTextual();
        return switch (expectedType(target, message)) {
            case "integer" -> {
                if (textual) {
                    yield builder.kind("int_parsing")
                            .message("Input should be a valid integer, unable to parse string as an integer")
                            .build();
                }
                if (null != value && value.isFloatingPointNumber()) {
                    yield builder.kind("int_from_float")
                            .message("Input should be a valid integer, got a number with a fractional part")
                            .build();
                }
                yield builder.kind("int_type").message("Input should be a valid integer").build();
            }
            case "number" -> textual
                             ? builder.kind("float_parsing")
                                     .message("Input should be a valid number, unable to parse string as a number")
                                     .build()
                             : builder.kind("float_type").message("Input should be a valid number").build();
            case "boolean" -> textual
                              ? builder.kind("bool_parsing")
                                      .message("Input should be a valid boolean, unable to interpret input")
                                      .build()
                              : builder.kind("bool_type").message("Input should be a valid boolean").build();
            case "string" -> builder.kind("string_type").message("Input should be a valid string").build();
            case "object" -> builder.kind("dict_type").message("Input should be a valid dictionary").build();
            case "array" -> builder.kind("list_type").message("Input should be a valid list").build();
            case "null" -> builder.kind("none_required").message("Input should be None").build();
            default -> builder.kind("type").message(message.getMessage()).build();
        };
    }

    private static String expectedType(SchemaNode target, ValidationMessage message) {
        if (null != target) {
            switch (target.getKind()) {
                case OBJECT:
                    return "object";
                case ARRAY:
                    return "array";
                case PRIMITIVE:
                case ENUM:
                    if (null != target.getPrimitiveType() && null != target.getPrimitiveType().getKeyword()) {
                        return target.getPrimitiveType().getKeyword();
                    }
                    break;
                default:
                    break;
            }
        }
        final var arguments = message.getArguments();
        return null != arguments && arguments.length > 1 ? String.valueOf(arguments[1]) : "";
    }

    private static ValidationErrorRecord lengthError(
            ValidationErrorRecord.ValidationErrorRecordBuilder builder,
            String kind,
            String template,
            String contextKey,
            JsonNode bound) {
        return builder.kind(kind)
                .message(template.formatted(text(bound), plural(bound)))
                .context(contextOf(contextKey, number(bound)))
                .build();
    }

    private static ValidationErrorRecord boundError(
            ValidationErrorRecord.ValidationErrorRecordBuilder builder,
            String kind,
            String relation,
            String contextKey,
            JsonNode bound) {
        return builder.kind(kind)
                .message("Input should be %s %s".formatted(relation, text(bound)))
                .context(contextOf(contextKey, number(bound)))
                .build();
    }

    private static ValidationErrorRecord itemsError(
            ValidationErrorRecord.ValidationErrorRecordBuilder builder,
            String kind,
            String relation,
            String contextKey,
            JsonNode bound,
            JsonNode value) {
        final var actual = null == value ? 0 : value.size();
        final var context = new LinkedHashMap<String, Object>();
        context.put("field_type", "List");
        context.put(contextKey, number(bound));
        context.put("actual_length", actual);
        return builder.kind(kind)
                .message("List should have %s %s item%s after validation, not %d"
                                 .formatted(relation, text(bound), plural(bound), actual))
                .context(context)
                .build();
    }

    /**
     * Bound as declared on the shape, or as reported by the engine when the shape cannot be followed
     */
    private static JsonNode constraint(SchemaNode target, String keyword, ValidationMessage message) {
        if (null != target && target.getConstraints().containsKey(keyword)) {
            return target.getConstraints().get(keyword);
        }
        final var schemaNode = message.getSchemaNode();
        if (null != schemaNode && schemaNode.has(keyword)) {
            return schemaNode.get(keyword);
        }
        return null;
    }

    private static String expected(JsonNode values) {
        if (null == values) {
            return "";
        }
        final var rendered = new ArrayList<String>();
        if (values.isArray()) {
            values.forEach(value -> rendered.add(literal(value)));
        }
        else {
            rendered.add(literal(values));
        }
        if (rendered.size() == 1) {
            return rendered.get(0);
        }
        return String.join(", ", rendered.subList(0, rendered.size() - 1))
                + " or " + rendered.get(rendered.size() - 1);
    }

    private static Map<String, Object> contextOf(String key, Object value) {
        final var context = new LinkedHashMap<String, Object>();
        context.put(key, value);
        return context;
    }

    private static String literal(JsonNode value) {
        return value.isTextual() ? "'" + value.asText() + "'" : value.toString();
    }

    private static String text(JsonNode bound) {
        return null == bound ? "" : bound.asText();
    }

    private static Object number(JsonNode bound) {
        if (null == bound) {
            return null;
        }
        return bound.isNumber() ? bound.numberValue() : bound.asText();
    }

    private static String plural(JsonNode bound) {
        return null != bound && bound.isNumber() && bound.asLong() == 1 ? "" : "s";
    }

    private static List<Object> location(ValidationMessage message) {
        final var path = message.getInstanceLocation();
        final var location = new ArrayList<>();
        if (null == path) {
            return location;
        }
        for (int i = 0; i < path.getNameCount(); i++) {
            location.add(path.getElement(i));
        }
        return location;
    }

    private static String missingProperty(ValidationMessage message) {
        if (null != message.getProperty()) {
            return message.getProperty();
        }
        final var arguments = message.getArguments();
        return null != arguments && arguments.length > 0 ? String.valueOf(arguments[0]) : "";
    }

    private static JsonNode resolve(JsonNode input, List<Object> location) {
        var current = input;
        for (final var segment : location) {
            if (null == current) {
                return null;
            }
            current = segment instanceof Integer index ? current.get(index) : current.get(String.valueOf(segment));
        }
        return current;
    }

    private SchemaNode shapeAt(List<Object> location) {
        var current = shape;
        for (final var segment : location) {
            if (null == current) {
                return null;
            }
            if (segment instanceof Integer && current.getKind() == NodeKind.ARRAY) {
                current = current.getItems();
            }
            else if (segment instanceof String name && current.getKind() == NodeKind.OBJECT) {
                current = current.field(name).map(SchemaField::getNode).orElse(null);
            }
            else {
                return null;
            }
        }
        return current;
    }

    /**
     * Position of the top level field an error belongs to. Errors about the input as a whole come first.
     */
    private int declarationIndex(ValidationErrorRecord errorRecord) {
        if (errorRecord.getLocation().isEmpty()) {
            return -1;
        }
        final var first = errorRecord.getLocation().get(0);
        final var fields = shape.getFields();
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).getName().equals(first)) {
                return i;
            }
        }
        return Integer.MAX_VALUE;
    }
}
