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

package com.phonepe.toolshape.core.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.phonepe.toolshape.core.errors.SchemaBuildException;
import com.phonepe.toolshape.core.errors.SchemaErrorType;
import com.phonepe.toolshape.core.schema.PrimitiveType;
import com.phonepe.toolshape.core.schema.SchemaField;
import com.phonepe.toolshape.core.schema.SchemaNode;
import com.phonepe.toolshape.core.source.DataSampleSource;
import com.phonepe.toolshape.core.source.EmptySequencePolicy;
import com.phonepe.toolshape.core.source.SampleOptions;
import com.phonepe.toolshape.core.utils.JsonUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Infers a tree from sample values. Booleans are checked before numbers so that they never turn into integers.
 * Type tokens ({@code String.class}, {@code List.of(Integer.class)}) stand for the type itself.
 */
@Slf4j
public class DataSampleAdapter {
    private static final String ITEM_SUFFIX = "Item";

    private final JavaTypeResolver typeResolver;
    private final JsonMapper mapper;

    public DataSampleAdapter(JavaTypeResolver typeResolver) {
        this.typeResolver = typeResolver;
        this.mapper = JsonUtils.createMapper();
    }

    public SchemaNode adapt(final DataSampleSource source) {
        log.debug("Inferring schema tree {} from sample with {} fields", source.getName(), source.getSample().size());
        return SchemaNode.object(source.getName(),
                                 source.getDescription(),
                                 fields(source.getName(), source.getSample(), source.getOptions()));
    }

    private List<SchemaField> fields(String parentName, Map<String, ?> sample, SampleOptions options) {
        final var fields = new ArrayList<SchemaField>();
        sample.forEach((fieldName, value) -> fields.add(field(parentName, fieldName, value, options)));
        return fields;
    }

    private SchemaField field(String parentName, String fieldName, Object value, SampleOptions options) {
        final var path = parentName + "." + fieldName;
        if (options.isDescriptionsFromStringValues() && isText(value)) {
            final var description = value instanceof JsonNode node ? node.asText() : value.toString();
            return SchemaField.required(fieldName,
                                        SchemaNode.primitive(PrimitiveType.STRING).withDescription(description));
        }
        final var node = infer(nestedName(parentName, fieldName), path, value, options);
        if (options.isDefaultsFromValues() && isSampleValue(value)) {
            return SchemaField.optional(fieldName, node.withDefaultValue(mapper.valueToTree(value)));
        }
        return SchemaField.required(fieldName, node);
    }

    private SchemaNode infer(String name, String path, Object value, SampleOptions options) {
        if (null == value || (value instanceof JsonNode node && (node.isNull() || node.isMissingNode()))) {
            return SchemaNode.any();
        }
        if (value instanceof Type type) {
            return typeResolver.resolve(type);
        }
        if (value instanceof JsonNode node) {
            return inferJson(name, path, node, options);
        }
        if (value instanceof Boolean) {
            return SchemaNode.primitive(PrimitiveType.BOOLEAN);
        }
        if (value instanceof Float || value instanceof Double || value instanceof BigDecimal) {
            return SchemaNode.primitive(PrimitiveType.NUMBER);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return SchemaNode.primitive(PrimitiveType.INTEGER);
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return SchemaNode.primitive(PrimitiveType.STRING);
        }
        if (value instanceof Enum<?> constant) {
            return typeResolver.resolve(constant.getDeclaringClass());
        }
        if (value instanceof Map<?, ?> map) {
            final var nested = new LinkedHashMap<String, Object>();
            map.forEach((key, nestedValue) -> nested.put(String.valueOf(key), nestedValue));
            return SchemaNode.object(name, null, fields(name, nested, options));
        }
        if (value instanceof Iterable<?> iterable) {
            return sequence(name, path, iterable.iterator(), options);
        }
        if (value.getClass().isArray() && !value.getClass().getComponentType().isPrimitive()) {
            return sequence(name, path, List.of((Object[]) value).iterator(), options);
        }
        return typeResolver.resolve(value.getClass());
    }

    private SchemaNode inferJson(String name, String path, JsonNode node, SampleOptions options) {
        if (node.isBoolean()) {
            return SchemaNode.primitive(PrimitiveType.BOOLEAN);
        }
        if (node.isIntegralNumber()) {
            return SchemaNode.primitive(PrimitiveType.INTEGER);
        }
        if (node.isNumber()) {
            return SchemaNode.primitive(PrimitiveType.NUMBER);
        }
        if (node.isTextual()) {
            return SchemaNode.primitive(PrimitiveType.STRING);
        }
        if (node.isObject()) {
            final var nested = new LinkedHashMap<String, Object>();
            node.fields().forEachRemaining(entry -> nested.put(entry.getKey(), entry.getValue()));
            return SchemaNode.object(name, null, fields(name, nested, options));
        }
        if (node.isArray()) {
            return sequence(name, path, node.elements(), options);
        }
        return SchemaNode.any();
    }

    private SchemaNode sequence(String name, String path, Iterator<?> elements, SampleOptions options) {
        if (!elements.hasNext()) {
            if (options.getEmptySequencePolicy() == EmptySequencePolicy.FAIL) {
                throw new SchemaBuildException(SchemaErrorType.AMBIGUOUS_SAMPLE, path);
            }
            return SchemaNode.array(SchemaNode.any());
        }
        return SchemaNode.array(infer(nestedName(name, ITEM_SUFFIX), path + "[0]", elements.next(), options));
    }

    private static String nestedName(String parentName, String fieldName) {
        return parentName + "_" + StringUtils.capitalize(fieldName);
    }

    private static boolean isText(Object value) {
        return value instanceof CharSequence || (value instanceof JsonNode node && node.isTextual());
    }

    /**
     * Plain values and lists of them can act as defaults. Type tokens, nulls and nested objects cannot.
     */
    private static boolean isSampleValue(Object value) {
        if (null == value || value instanceof Type || value instanceof Map<?, ?>) {
            return false;
        }
        if (value instanceof JsonNode node) {
            return !node.isNull() && !node.isMissingNode() && !node.isObject();
        }
        if (value instanceof Iterable<?> iterable) {
            for (final var element : iterable) {
                if (element instanceof Type) {
                    return false;
                }
            }
        }
        return true;
    }
}
