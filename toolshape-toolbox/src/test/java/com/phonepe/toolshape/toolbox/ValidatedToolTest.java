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

import com.phonepe.toolshape.core.errors.ValidationFailureException;
import com.phonepe.toolshape.core.feedback.FeedbackSettings;
import com.phonepe.toolshape.core.source.CallableDescriptor;
import com.phonepe.toolshape.core.source.ParameterSpec;
import com.phonepe.toolshape.core.utils.JsonUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ValidatedToolTest {
    private final WeatherTools tools = new WeatherTools();

    @Test
    void testSchemaAndModel() {
        final var tool = ValidatedTool.of(tools, method("getWeather"), ToolSettings.defaults());
        assertEquals("getWeather", tool.name());
        assertEquals("Get the weather forecast for a city", tool.description());
        assertEquals("{\"type\":\"object\",\"description\":\"Get the weather forecast for a city\",\"properties\":{"
                             + "\"city\":{\"type\":\"string\",\"description\":\"Name of the city\"},"
                             + "\"days\":{\"type\":\"integer\",\"default\":3}},"
                             + "\"required\":[\"city\"],\"title\":\"getWeather\"}",
                     tool.schema().toJson());
        assertEquals(tool.schema(), tool.model().schema());
        assertEquals("getWeather", tool.model().name());
    }

    @Test
    void testInvokeAppliesDefaults() {
        final var tool = ValidatedTool.of(tools, method("getWeather"), ToolSettings.defaults());
        assertEquals("Sunny in Pune for 3 days", tool.invoke("{\"city\": \"Pune\"}"));
        assertEquals("Sunny in Pune for 5 days", tool.invoke("{\"city\": \"Pune\", \"days\": 5}"));
    }

    @Test
    void testCallResults() {
        final var convert = ValidatedTool.of(tools, method("toFahrenheit"), ToolSettings.defaults());
        assertEquals("convert", convert.name());
        assertEquals(ToolCallResult.success("convert", "212.0"), convert.call("{\"celsius\": 100}"));

        final var cityInfo = ValidatedTool.of(tools, method("cityInfo"), ToolSettings.defaults());
        assertEquals("{\"city\":\"Pune\"}", cityInfo.call("{\"city\": \"Pune\"}").getContent());

        final var record = ValidatedTool.of(tools, method("record"), ToolSettings.defaults());
        assertEquals("success", record.call("{\"note\": \"Cloudy\"}").getContent());
        assertEquals("success", record.call("{\"note\": \"Windy\", \"station\": \"North\"}").getContent());
        assertEquals(List.of("Cloudy", "North: Windy"), tools.getNotes());
        assertEquals(List.of("note"), record.schema().required());
    }

    @Test
    void testValidationFailure() {
        final var tool = ValidatedTool.of(tools, method("getWeather"), ToolSettings.defaults());
        final var error = assertThrows(ValidationFailureException.class, () -> tool.invoke("{\"days\": 2}"));
        assertEquals(1, error.getErrors().size());

        final var result = tool.call("{\"days\": 2}");
        assertFalse(result.isSuccess());
        assertEquals(ToolCallStatus.VALIDATION_FAILURE, result.getStatus());
        assertEquals("{\"success\":false,\"message_to_assistant\":\"" + FeedbackSettings.DEFAULT_MESSAGE_TO_ASSISTANT
                             + "\",\"errors\":[{\"type\":\"missing\",\"loc\":\"('city',)\",\"msg\":\"Field required\","
                             + "\"input\":{\"days\":2}}]}",
                     result.getContent());
    }

    @Test
    @SneakyThrows
    void testInvalidJson() {
        final var tool = ValidatedTool.of(tools, method("getWeather"), ToolSettings.defaults());
        for (final var text : new String[]{"{not json", "", "  "}) {
            final var result = tool.call(text);
            assertEquals(ToolCallStatus.VALIDATION_FAILURE, result.getStatus(), text);
            final var envelope = JsonUtils.createMapper().readTree(result.getContent());
            assertEquals("json_invalid", envelope.get("errors").get(0).get("type").asText());
            assertEquals("()", envelope.get("errors").get(0).get("loc").asText());
            assertTrue(envelope.get("errors").get(0).get("msg").asText().startsWith("Invalid JSON"));
        }
    }

    @Test
    void testInvocationFailure() {
        final var tool = ValidatedTool.of(tools, method("explode"), ToolSettings.defaults());
        final var error = assertThrows(ToolInvocationException.class, () -> tool.invoke("{\"reason\": \"test\"}"));
        assertEquals("Boom: test", error.getMessage());
        assertEquals("explode", error.getToolName());
        assertInstanceOf(IllegalStateException.class, error.getCause());

        final var result = tool.call("{\"reason\": \"test\"}");
        assertEquals(ToolCallStatus.INVOCATION_FAILURE, result.getStatus());
        assertEquals("Tool call local failure: Boom: test", result.getContent());
    }

    @Test
    @SneakyThrows
    void testFunctionNotCalledOnInvalidInput() {
        final var function = mock(ToolFunction.class);
        when(function.apply(any())).thenReturn(5);
        final var tool = ValidatedTool.of(addDescriptor(), function);
        final var result = tool.call("{\"a\": 2, \"b\": \"three\"}");
        assertEquals(ToolCallStatus.VALIDATION_FAILURE, result.getStatus());
        assertTrue(result.getContent().contains("\"type\":\"int_parsing\""));
        assertTrue(result.getContent().contains("\"loc\":\"('b',)\""));
        verifyNoInteractions(function);

        assertEquals("5", tool.call("{\"a\": 2, \"b\": 3}").getContent());
        verify(function).apply(any());
    }

    @Test
    void testDescriptorTool() {
        final var tool = ValidatedTool.of(addDescriptor(),
                                          arguments -> (Integer) arguments.get("a") + (Integer) arguments.get("b"));
        assertEquals("add", tool.name());
        assertEquals(5, tool.invoke("{\"a\": 2, \"b\": 3}"));
        assertEquals(ToolCallResult.success("add", "5"), tool.call("{\"a\": 2, \"b\": 3}"));
    }

    @Test
    void testWithName() {
        final var tool = ValidatedTool.of(addDescriptor(), arguments -> null);
        assertSame(tool, tool.withName("add"));
        final var renamed = tool.withName("sum");
        assertEquals("sum", renamed.name());
        assertEquals("sum", renamed.schema().title());
        assertEquals("sum", renamed.model().name());
        assertEquals("success", renamed.call("{\"a\": 1, \"b\": 1}").getContent());
    }

    private static CallableDescriptor addDescriptor() {
        return CallableDescriptor.builder()
                .name("add")
                .description("Adds two numbers")
                .parameter(ParameterSpec.of("a", Integer.class))
                .parameter(ParameterSpec.of("b", Integer.class))
                .build();
    }

    private static Method method(String name) {
        return Arrays.stream(WeatherTools.class.getDeclaredMethods())
                .filter(method -> method.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }
}
