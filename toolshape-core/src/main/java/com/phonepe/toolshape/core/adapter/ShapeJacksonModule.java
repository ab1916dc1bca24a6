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

import com.fasterxml.classmate.ResolvedType;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.victools.jsonschema.generator.FieldScope;
import com.github.victools.jsonschema.generator.MemberScope;
import com.github.victools.jsonschema.generator.MethodScope;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.TypeScope;
import com.github.victools.jsonschema.module.jackson.JacksonModule;
import com.google.common.base.Strings;
import com.google.common.reflect.TypeToken;
import com.phonepe.toolshape.core.utils.DefaultValues;

import java.util.List;
import java.util.Optional;

/**
 * Jackson module with the field rules of the dialect:
 * <ul>
 *     <li>properties keep declaration order, fields before methods</li>
 *     <li>a field is required unless it is an {@link Optional} or has a {@link JsonProperty#defaultValue()}</li>
 *     <li>the annotated default is written in the json type of the field</li>
 *     <li>documented enums list their options in the description</li>
 * </ul>
 */
class ShapeJacksonModule extends JacksonModule {

    @Override
    public void applyToConfigBuilder(SchemaGeneratorConfigBuilder builder) {
        super.applyToConfigBuilder(builder);
        builder.forTypesInGeneral()
                .withPropertySorter((first, second) -> Boolean.compare(first instanceof MethodScope,
                                                                       second instanceof MethodScope));
        builder.forFields()
                .withTargetTypeOverridesResolver(ShapeJacksonModule::unwrapOptional)
                .withRequiredCheck(field -> !isOptional(field) && null == annotatedDefault(field))
                .withDefaultResolver(ShapeJacksonModule::resolveDefault);
    }

    @Override
    protected String resolveDescription(MemberScope<?, ?> member) {
        final var description = super.resolveDescription(member);
        final var type = member.getType();
        if (null != type && DocumentedEnums.isDocumented(type.getErasedType())) {
            return DocumentedEnums.describe(type.getErasedType(),
                                            Strings.isNullOrEmpty(description)
                                            ? super.resolveDescriptionForType(member)
                                            : description);
        }
        return description;
    }

    @Override
    protected String resolveDescriptionForType(TypeScope scope) {
        final var description = super.resolveDescriptionForType(scope);
        final var type = scope.getType();
        if (null != type && DocumentedEnums.isDocumented(type.getErasedType())) {
            return DocumentedEnums.describe(type.getErasedType(), description);
        }
        return description;
    }

    /**
     * An optional field is described by its value type and is never nullable, absence is expressed through
     * requiredness alone
     */
    private static List<ResolvedType> unwrapOptional(FieldScope field) {
        if (!field.getType().isInstanceOf(Optional.class)) {
            return null;
        }
        final var valueType = field.getTypeParameterFor(Optional.class, 0);
        return null == valueType ? null : List.of(valueType);
    }

    private static boolean isOptional(FieldScope field) {
        return field.getRawMember().getType() == Optional.class;
    }

    private static String annotatedDefault(FieldScope field) {
        final var property = field.getAnnotationConsideringFieldAndGetter(JsonProperty.class);
        return null == property || Strings.isNullOrEmpty(property.defaultValue())
               ? null
               : property.defaultValue();
    }

    private static Object resolveDefault(FieldScope field) {
        final var raw = annotatedDefault(field);
        if (null == raw) {
            return null;
        }
        var type = TypeToken.of(field.getRawMember().getGenericType());
        if (type.getRawType() == Optional.class) {
            type = type.resolveType(Optional.class.getTypeParameters()[0]);
        }
        return DefaultValues.parse(raw, type.getRawType());
    }
}
