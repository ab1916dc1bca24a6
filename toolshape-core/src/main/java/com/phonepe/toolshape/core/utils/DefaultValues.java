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

package com.phonepe.toolshape.core.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.primitives.Primitives;
import com.phonepe.toolshape.core.errors.SchemaBuildException;
import com.phonepe.toolshape.core.errors.SchemaErrorType;
import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

/**
 * Annotation attributes carry defaults as text. Converts them into the json type of the annotated member.
 */
@UtilityClass
public class DefaultValues {

    public static Object parse(final String raw, final Class<?> type) {
        final var wrapped = Primitives.wrap(type);
        try {
            if (wrapped == Integer.class || wrapped == Short.class || wrapped == Byte.class) {
                return Integer.valueOf(raw.trim());
            }
            if (wrapped == Long.class || wrapped == BigInteger.class) {
                return Long.valueOf(raw.trim());
            }
            if (wrapped == Double.class || wrapped == Float.class || wrapped == BigDecimal.class) {
                return Double.valueOf(raw.trim());
            }
        }
        catch (NumberFormatException e) {
            throw new SchemaBuildException(SchemaErrorType.UNSUPPORTED_CONSTRUCT, e,
                                           "default", "'" + raw + "' is not a valid " + type.getSimpleName());
        }
        if (wrapped == Boolean.class) {
            return Boolean.parseBoolean(raw.trim());
        }
        return raw;
    }

    public static JsonNode toNode(final String raw, final Class<?> type) {
        final var mapper = JsonUtils.createMapper();
        if (Iterable.class.isAssignableFrom(type) || type.isArray() || Map.class.isAssignableFrom(type)) {
            try {
                return mapper.readTree(raw);
            }
            catch (JsonProcessingException e) {
                throw new SchemaBuildException(SchemaErrorType.UNSUPPORTED_CONSTRUCT, e,
                                               "default", "'" + raw + "' is not valid json");
            }
        }
        return mapper.valueToTree(parse(raw, type));
    }
}
