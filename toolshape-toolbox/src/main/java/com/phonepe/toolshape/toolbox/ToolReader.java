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

package com.phonepe.toolshape.toolbox;

import com.google.common.base.CaseFormat;
import com.phonepe.toolshape.core.source.CallableDescriptor;
import com.phonepe.toolshape.core.source.Tool;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads tools from the {@link Tool} annotated methods of an object
 */
@Slf4j
@UtilityClass
public class ToolReader {

    public static Map<String, ValidatedTool> readTools(Object instance) {
        return readTools(instance, ToolSettings.defaults());
    }

    /**
     * Creates a tool per annotated method, walking up the class hierarchy. Tools are named after the
     * annotation, or the snake_case method name.
     */
    public static Map<String, ValidatedTool> readTools(Object instance, ToolSettings settings) {
        Class<?> type = instance.getClass();
        final var tools = new LinkedHashMap<String, ValidatedTool>();
        while (type != Object.class) { // Traverse up till we reach Object
            final var className = type.getSimpleName();
            Arrays.stream(type.getDeclaredMethods())
                    .filter(method -> method.isAnnotationPresent(Tool.class))
                    .sorted(Comparator.comparing(Method::getName))
                    .forEach(method -> {
                        final var descriptor = CallableDescriptor.fromMethod(method).withName(toolName(method));
                        if (tools.containsKey(descriptor.getName())) {
                            log.debug("Tool {} is overridden in a subclass, skipping {}::{}",
                                      descriptor.getName(), className, method.getName());
                            return;
                        }
                        final var tool = ValidatedTool.of(instance, method, descriptor, settings);
                        log.info("Created tool: {} from {}::{}", tool.name(), className, method.getName());
                        tools.put(tool.name(), tool);
                    });
            type = type.getSuperclass();
        }
        return tools;
    }

    public static String toolName(Method method) {
        final var tool = method.getAnnotation(Tool.class);
        if (null != tool && !tool.name().isBlank()) {
            return tool.name();
        }
        return CaseFormat.LOWER_CAMEL.converterTo(CaseFormat.LOWER_UNDERSCORE).convert(method.getName());
    }
}
