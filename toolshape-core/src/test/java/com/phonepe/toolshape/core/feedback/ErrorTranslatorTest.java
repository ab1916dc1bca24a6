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

package com.phonepe.toolshape.core.feedback;

import com.fasterxml.jackson.databind.node.TextNode;
import com.phonepe.toolshape.core.model.ValidationErrorRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ErrorTranslatorTest {
    private final ErrorTranslator translator = new ErrorTranslator();

    @Test
    void testRenderLocation() {
        assertEquals("()", ErrorTranslator.renderLocation(List.of()));
        assertEquals("()", ErrorTranslator.renderLocation(null));
        assertEquals("('age',)", ErrorTranslator.renderLocation(List.of("age")));
        assertEquals("(0,)", ErrorTranslator.renderLocation(List.of(0)));
        assertEquals("('items', 0, 'name')", ErrorTranslator.renderLocation(List.of("items", 0, "name")));
        assertEquals("(\"it's\",)", ErrorTranslator.renderLocation(List.of("it's")));
        assertEquals("('say \"hi\" it\\'s',)", ErrorTranslator.renderLocation(List.of("say \"hi\" it's")));
        assertEquals("('a\\nb',)", ErrorTranslator.renderLocation(List.of("a\nb")));
    }

    @Test
    void testTranslate() {
        final var records = List.of(
                ValidationErrorRecord.builder()
                        .kind("missing")
                        .location(List.of("age"))
                        .message("Field required")
                        .input(TextNode.valueOf("ignored"))
                        .build(),
                ValidationErrorRecord.builder()
                        .kind("greater_than_equal")
                        .location(List.of("days"))
                        .message("Input should be greater than or equal to 1")
                        .input(TextNode.valueOf("0"))
                        .context(Map.of("ge", 1))
                        .extras(Map.of("url", "https://errors.pydantic.dev/2/v/greater_than_equal", "type", "other"))
                        .build());
        final var envelope = translator.translate(records);
        assertFalse(envelope.isSuccess());
        assertEquals(FeedbackSettings.DEFAULT_MESSAGE_TO_ASSISTANT, envelope.getMessageToAssistant());
        assertEquals(2, envelope.getErrors().size());
        assertEquals("('age',)", envelope.getErrors().get(0).getLoc());
        assertEquals("{\"success\":false,\"message_to_assistant\":\"" + FeedbackSettings.DEFAULT_MESSAGE_TO_ASSISTANT
                             + "\",\"errors\":[{\"type\":\"missing\",\"loc\":\"('age',)\",\"msg\":\"Field required\","
                             + "\"input\":\"ignored\"},{\"type\":\"greater_than_equal\",\"loc\":\"('days',)\","
                             + "\"msg\":\"Input should be greater than or equal to 1\",\"input\":\"0\","
                             + "\"ctx\":{\"ge\":1},\"url\":\"https://errors.pydantic.dev/2/v/greater_than_equal\"}]}",
                     translator.toJson(envelope));
    }

    @Test
    void testEmptyAndOddInput() {
        final var expected = "{\"success\":false,\"message_to_assistant\":\""
                + FeedbackSettings.DEFAULT_MESSAGE_TO_ASSISTANT + "\",\"errors\":[]}";
        assertEquals(expected, translator.translateToJson(null));
        assertEquals(expected, translator.translateToJson(List.of()));
        final var withNull = new ArrayList<ValidationErrorRecord>();
        withNull.add(null);
        assertEquals(expected, translator.translateToJson(withNull));
    }

    @Test
    void testCustomMessage() {
        final var custom = new ErrorTranslator(FeedbackSettings.defaults().withMessageToAssistant("Fix the input."));
        final var json = custom.translateToJson(List.of(ValidationErrorRecord.builder()
                                                                .kind("json_invalid")
                                                                .message("Invalid JSON")
                                                                .build()));
        assertEquals("{\"success\":false,\"message_to_assistant\":\"Fix the input.\",\"errors\":["
                             + "{\"type\":\"json_invalid\",\"loc\":\"()\",\"msg\":\"Invalid JSON\",\"input\":null}]}",
                     json);
    }

    @Test
    void testMissingInputIsNull() {
        final var envelope = translator.translate(List.of(ValidationErrorRecord.builder()
                                                                  .kind("missing")
                                                                  .location(List.of("age"))
                                                                  .message("Field required")
                                                                  .build()));
        assertEquals("{\"type\":\"missing\",\"loc\":\"('age',)\",\"msg\":\"Field required\",\"input\":null}",
                     envelope.getErrors().get(0).toJsonNode().toString());
    }
}
