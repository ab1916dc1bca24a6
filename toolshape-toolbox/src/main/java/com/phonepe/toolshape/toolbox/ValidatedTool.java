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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.primitives.Primitives;
import com.phonepe.toolshape.core.adapter.TypeDescriptorAdapter;
import com.phonepe.toolshape.core.errors.ValidationFailureException;
import com.phonepe.toolshape.core.feedback.ErrorTranslator;
import com.phonepe.toolshape.core.model.ModelSynthesizer;
import com.phonepe.toolshape.core.model.ValidatingModel;
import com.phonepe.toolshape.core.model.ValidationErrorRecord;
import com.phonepe.toolshape.core.schema.CanonicalSchema;
import com.phonepe.toolshape.core.schema.SchemaNormalizer;
import com.phonepe.toolshape.core.source.CallableDescriptor;
import com.phonepe.toolshape.core.source.FunctionSignatureSource;
import lombok.Getter;
import lombok.NonNull;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A callable wrapped with a validating model. Arguments are checked against the model before the callable runs,
 * so the callable only ever sees inputs of the declared shape.
 */
@Slf4j
public class ValidatedTool {
    private static final TypeReference<LinkedHashMap<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    @Getter
    private final CallableDescriptor descriptor;
    private final ToolFunction function;
    private final Class<?> returnType;
    private final ToolSettings settings;
    private final ValidatingModel model;
    private final CanonicalSchema schema;
    private final ErrorTranslator translator;

    private ValidatedTool(
            @NonNull CallableDescriptor descriptor,
            @NonNull ToolFunction function,
            Class<?> returnType,
            @NonNull ToolSettings settings) {
        this.descriptor = descriptor;
        this.function = function;
        this.returnType = returnType;
        this.settings = settings;
        final var tree = new TypeDescriptorAdapter().adapt(FunctionSignatureSource.of(descriptor));
        this.model = new ModelSynthesizer(settings.getEngine(), settings.getAllocator()).synthesize(tree);
        this.schema = SchemaNormalizer.normalize(tree);
        this.translator = new ErrorTranslator(settings.getFeedback());
    }

    public static ValidatedTool of(CallableDescriptor descriptor, ToolFunction function) {
        return of(descriptor, function, ToolSettings.defaults());
    }

    public static ValidatedTool of(CallableDescriptor descriptor, ToolFunction function, ToolSettings settings) {
        return new ValidatedTool(descriptor, function, null, settings);
    }

    /**
     * Wraps a method of an object. Validated arguments are converted to the declared parameter types.
     */
    public static ValidatedTool of(Object instance, Method method, ToolSettings settings) {
        return of(instance, method, CallableDescriptor.fromMethod(method), settings);
    }

    @SuppressWarnings("java:S3011")
    static ValidatedTool of(Object instance, Method method, CallableDescriptor descriptor, ToolSettings settings) {
        final var mapper = settings.getMapper();
        final var parameters = method.getParameters();
        final var specs = descriptor.getParameters();
        method.setAccessible(true);
        final ToolFunction function = arguments -> {
            final var values = new ArrayList<>();
            for (int i = 0; i < parameters.length; i++) {
                final var value = mapper.valueToTree(arguments.get(specs.get(i).getName()));
                if (parameters[i].getType() == Optional.class) {
                    final var type = parameters[i].getParameterizedType() instanceof ParameterizedType parameterized
                                     ? parameterized.getActualTypeArguments()[0]
                                     : Object.class;
                    values.add(null == value || value.isNull()
                               ? Optional.empty()
                               : Optional.ofNullable(mapper.convertValue(value,
                                                                         mapper.constructType(type))));
                }
                else {
                    values.add(mapper.convertValue(value, mapper.constructType(parameters[i].getParameterizedType())));
                }
            }
            return method.invoke(instance, values.toArray());
        };
        return new ValidatedTool(descriptor, function, method.getReturnType(), settings);
    }

    public String name() {
        return descriptor.getName();
    }

    public String description() {
        return descriptor.getDescription();
    }

    public ValidatingModel model() {
        return model;
    }

    public CanonicalSchema schema() {
        return schema;
    }

    public ObjectNode schema(final ToolSchemaFormat format) {
        return format.render(name(), description(), schema);
    }

    /**
     * Same callable under a different name
     */
    public ValidatedTool withName(final String newName) {
        if (Objects.equals(newName, name())) {
            return this;
        }
        return new ValidatedTool(descriptor.withName(newName), function, returnType, settings);
    }

    /**
     * Validates the json arguments and runs the callable.
     *
     * @throws ValidationFailureException if the arguments are not valid json or do not match the schema
     * @throws ToolInvocationException    if the callable fails
     */
    public Object invoke(final String json) {
        final JsonNode arguments;
        try {
            arguments = settings.getMapper().readTree(Objects.requireNonNullElse(json, ""));
        }
        catch (JsonProcessingException e) {
            throw new ValidationFailureException(model.name(),
                                                 List.of(invalidJson(json, "Invalid JSON: " + e.getOriginalMessage())));
        }
        if (arguments.isMissingNode()) {
            throw new ValidationFailureException(model.name(),
                                                 List.of(invalidJson(json, "Invalid JSON: no content to parse")));
        }
        return invoke(arguments);
    }

    public Object invoke(final JsonNode arguments) {
        final var validated = model.validate(arguments).orElseThrow();
        final Map<String, Object> values = settings.getMapper().convertValue(validated, ARGUMENTS_TYPE);
        log.debug("Calling tool {} with {}", name(), values);
        try {
            return function.apply(values);
        }
        catch (InvocationTargetException e) {
            throw new ToolInvocationException(name(), null == e.getCause() ? e : e.getCause());
        }
        catch (Exception e) {
            throw new ToolInvocationException(name(), e);
        }
    }

    /**
     * Like {@link #invoke(String)}, but reports failures as results. Validation failures carry the feedback
     * envelope, ready to be sent back to the model.
     */
    public ToolCallResult call(final String json) {
        try {
            return ToolCallResult.success(name(), toStringContent(invoke(json)));
        }
        catch (ValidationFailureException e) {
            log.debug("Invalid arguments for tool {}: {}", name(), e.getMessage());
            return ToolCallResult.failure(name(),
                                          ToolCallStatus.VALIDATION_FAILURE,
                                          translator.translateToJson(e.getErrors()));
        }
        catch (ToolInvocationException e) {
            log.error("Local error making tool call " + name(), e);
            return ToolCallResult.failure(name(),
                                          ToolCallStatus.INVOCATION_FAILURE,
                                          "Tool call local failure: %s".formatted(e.getMessage()));
        }
    }

    /**
     * Converts the result to the text sent to the LLM. Void methods report a fixed success string.
     */
    @SneakyThrows
    private String toStringContent(Object result) {
        if (null != returnType && (returnType.equals(Void.TYPE) || returnType.equals(Void.class))) {
            return "success";
        }
        final var type = null != returnType && returnType != Object.class
                         ? returnType
                         : (null == result ? Void.class : result.getClass());
        if (type.equals(Void.class)) {
            return "success";
        }
        if (CharSequence.class.isAssignableFrom(type) || Primitives.isWrapperType(Primitives.wrap(type))) {
            return Objects.toString(result);
        }
        return settings.getMapper().writeValueAsString(result);
    }

    private static ValidationErrorRecord invalidJson(String json, String message) {
        return ValidationErrorRecord.builder()
                .kind("json_invalid")
                .location(List.of())
                .message(message)
                .input(null == json ? null : TextNode.valueOf(json))
                .build();
    }
}
