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

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phonepe.toolshape.core.errors.SchemaBuildException;
import com.phonepe.toolshape.core.errors.SchemaErrorType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Tools by name, in registration order. Routes calls from the model to the right tool.
 */
@Slf4j
public class ToolDispatch {
    private final Map<String, ValidatedTool> tools = new LinkedHashMap<>();

    public ToolDispatch() {
    }

    public ToolDispatch(Collection<ValidatedTool> tools) {
        tools.forEach(this::register);
    }

    public static ToolDispatch of(ValidatedTool... tools) {
        return new ToolDispatch(List.of(tools));
    }

    /**
     * Reads the annotated tools of an object
     */
    public static ToolDispatch from(Object instance, ToolSettings settings) {
        return new ToolDispatch(ToolReader.readTools(instance, settings).values());
    }

    /**
     * Adds a tool under its own name
     *
     * @throws SchemaBuildException if a tool of that name is already registered
     */
    public ToolDispatch register(ValidatedTool tool) {
        if (tools.containsKey(tool.name())) {
            throw new SchemaBuildException(SchemaErrorType.DUPLICATE_TOOL, tool.name());
        }
        tools.put(tool.name(), tool);
        log.info("Registered tool {}", tool.name());
        return this;
    }

    /**
     * Sets the tool for a name, renaming the tool if needed. Replaces any tool already registered under the name.
     */
    public ToolDispatch put(String name, ValidatedTool tool) {
        tools.put(name, tool.withName(name));
        log.info("Registered tool {}", name);
        return this;
    }

    /**
     * @throws NoSuchElementException if there is no such tool
     */
    public ValidatedTool get(String name) {
        return find(name).orElseThrow(() -> new NoSuchElementException("Tool '%s' not found".formatted(name)));
    }

    public Optional<ValidatedTool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public boolean contains(String name) {
        return tools.containsKey(name);
    }

    /**
     * @throws NoSuchElementException if there is no such tool
     */
    public ValidatedTool remove(String name) {
        final var removed = tools.remove(name);
        if (null == removed) {
            throw new NoSuchElementException("Tool '%s' not found".formatted(name));
        }
        return removed;
    }

    public ToolDispatch clear() {
        tools.clear();
        return this;
    }

    public int size() {
        return tools.size();
    }

    public Map<String, ValidatedTool> tools() {
        return Collections.unmodifiableMap(tools);
    }

    /**
     * New dispatcher holding the tools of both, this one's first
     *
     * @throws SchemaBuildException if both hold a tool of the same name
     */
    public ToolDispatch merge(ToolDispatch other) {
        final var all = new ArrayList<>(tools.values());
        all.addAll(other.tools.values());
        return new ToolDispatch(all);
    }

    public List<ObjectNode> schemas(ToolSchemaFormat format) {
        return tools.values()
                .stream()
                .map(tool -> tool.schema(format))
                .toList();
    }

    /**
     * Calls a tool by name. Unknown tools and invalid arguments come back as failures.
     */
    public ToolCallResult call(String name, String arguments) {
        final var tool = tools.get(name);
        if (null == tool) {
            log.warn("Model called unknown tool {}", name);
            return ToolCallResult.failure(name,
                                          ToolCallStatus.UNKNOWN_TOOL,
                                          "Tool '%s' not found. Available tools: %s".formatted(name, tools.keySet()));
        }
        return tool.call(arguments);
    }
}
