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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.phonepe.toolshape.core.source.DocumentedEnum;
import lombok.experimental.UtilityClass;

import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds the description of a {@link DocumentedEnum}. Each option is listed as {@code 'NAME': description}, one
 * per line. The list replaces the single placeholder in the template ({@code {options}} or any other identifier
 * in braces), or is appended after a "Valid options:" line. Doubled braces stand for literal ones.
 */
@UtilityClass
public class DocumentedEnums {
    private static final Pattern TOKEN = Pattern.compile("\\{\\{|}}|\\{([^{}]*)}");
    private static final Pattern IDENTIFIER = Pattern.compile("\\w*");

    public static boolean isDocumented(final Class<?> type) {
        return null != type && type.isEnum() && DocumentedEnum.class.isAssignableFrom(type);
    }

    public static String describe(final Class<?> enumType, final String template) {
        Preconditions.checkArgument(isDocumented(enumType), "%s is not a documented enum", enumType);
        final var options = Arrays.stream(enumType.getEnumConstants())
                .map(constant -> "'" + ((Enum<?>) constant).name() + "': "
                        + ((DocumentedEnum) constant).getDescription())
                .collect(Collectors.joining("\n"));
        final var text = Strings.nullToEmpty(template);
        final var matcher = TOKEN.matcher(text);
        final var placeholders = matcher.results()
                .filter(result -> null != result.group(1))
                .toList();
        Preconditions.checkArgument(placeholders.size() <= 1,
                                    "Only one placeholder is allowed for enum options in the `%s` description. "
                                            + "Found %s in '%s'",
                                    enumType.getSimpleName(), placeholders.size(), text);
        placeholders.forEach(placeholder -> Preconditions.checkArgument(
                IDENTIFIER.matcher(placeholder.group(1)).matches(),
                "Invalid placeholder identifier '%s' in the `%s` description. "
                        + "Only alphanumerics and underscores are allowed.",
                placeholder.group(), enumType.getSimpleName()));
        final var rendered = matcher.reset()
                .replaceAll(result -> switch (result.group()) {
                    case "{{" -> "{";
                    case "}}" -> "}";
                    default -> Matcher.quoteReplacement(options);
                });
        if (!placeholders.isEmpty()) {
            return rendered;
        }
        return rendered.isEmpty()
               ? "Valid options:\n" + options
               : rendered + "\nValid options:\n" + options;
    }
}
