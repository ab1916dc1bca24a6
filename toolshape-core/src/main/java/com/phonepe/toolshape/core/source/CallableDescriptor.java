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

package com.phonepe.toolshape.core.source;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.google.common.base.Strings;
import com.google.common.reflect.TypeToken;
import com.phonepe.toolshape.core.errors.SchemaBuildException;
import com.phonepe.toolshape.core.errors.SchemaErrorType;
import com.phonepe.toolshape.core.utils.DefaultValues;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Name, docstring and ordered parameters of a callable. The return type plays no part in the schema.
 */
@Value
@Builder
@With
public class CallableDescriptor {
    @NonNull
    String name;

    String description;

    @Singular
    List<ParameterSpec> parameters;

    /**
     * Reads the descriptor off a method. {@link Tool} gives name and description,
     * {@link JsonPropertyDescription} describes a parameter and {@link JsonProperty} can rename it or give it a
     * default. Parameters of type {@link Optional} are not required.
     */
    public static CallableDescriptor fromMethod(final Method method) {
        final var tool = method.getAnnotation(Tool.class);
        final var name = null != tool && !tool.name().isBlank() ? tool.name() : method.getName();
        final var parameters = new ArrayList<ParameterSpec>();
        for (final var parameter : method.getParameters()) {
            parameters.add(readParameter(method, parameter));
        }
        return CallableDescriptor.builder()
                .name(name)
                .description(null == tool ? null : tool.value())
                .parameters(parameters)
                .build();
    }

    private static ParameterSpec readParameter(Method method, Parameter parameter) {
        final var property = parameter.getAnnotation(JsonProperty.class);
        final String name;
        if (null != property && !Strings.isNullOrEmpty(property.value())) {
            name = property.value();
        }
        else if (parameter.isNamePresent()) {
            name = parameter.getName();
        }
        else {
            throw new SchemaBuildException(SchemaErrorType.MISSING_ANNOTATION,
                                           parameter.getName(),
                                           method.getName(),
                                           "compile with -parameters or name it with @JsonProperty");
        }
        var type = parameter.getParameterizedType();
        var optional = false;
        if (type instanceof ParameterizedType parameterized && parameterized.getRawType() == Optional.class) {
            type = parameterized.getActualTypeArguments()[0];
            optional = true;
        }
        else if (parameter.getType() == Optional.class) {
            type = Object.class;
            optional = true;
        }
        if (type instanceof TypeVariable<?> || type instanceof WildcardType) {
            throw new SchemaBuildException(SchemaErrorType.MISSING_ANNOTATION,
                                           name,
                                           method.getName(),
                                           "type " + type.getTypeName() + " cannot be resolved");
        }
        final var description = parameter.getAnnotation(JsonPropertyDescription.class);
        final var defaultValue = null != property && !Strings.isNullOrEmpty(property.defaultValue())
                                 ? DefaultValues.toNode(property.defaultValue(), rawType(type))
                                 : null;
        return ParameterSpec.builder()
                .name(name)
                .type(type)
                .description(null == description ? null : description.value())
                .defaultValue(defaultValue)
                .optional(optional)
                .build();
    }

    private static Class<?> rawType(Type type) {
        return TypeToken.of(type).getRawType();
    }
}
