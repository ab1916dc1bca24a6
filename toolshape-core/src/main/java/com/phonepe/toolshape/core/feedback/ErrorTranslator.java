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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.phonepe.toolshape.core.model.ValidationErrorRecord;
import com.phonepe.toolshape.core.utils.JsonUtils;
import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Turns validation error records into the feedback envelope. Keeps the order of the records and never fails on
 * odd input.
 */
public class ErrorTranslator {
    @Getter
    private final FeedbackSettings settings;
    private final JsonMapper mapper;

    public ErrorTranslator() {
        this(FeedbackSettings.defaults());
    }

    public ErrorTranslator(FeedbackSettings settings) {
        this.settings = Objects.requireNonNull(settings);
        this.mapper = JsonUtils.createMapper();
    }

    public FeedbackEnvelope translate(final List<ValidationErrorRecord> records) {
        final var errors = null == records
                           ? List.<FeedbackError>of()
                           : records.stream()
                                   .filter(Objects::nonNull)
                                   .map(ErrorTranslator::toFeedbackError)
                                   .toList();
        return FeedbackEnvelope.failure(settings.getMessageToAssistant(), errors);
    }

    public String toJson(final FeedbackEnvelope envelope) {
        try {
            return mapper.writeValueAsString(envelope);
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize feedback envelope", e);
        }
    }

    /**
     * Convenience for translate followed by {@link #toJson(FeedbackEnvelope)}
     */
    public String translateToJson(final List<ValidationErrorRecord> records) {
        return toJson(translate(records));
    }

    /**
     * Renders a location the way a python tuple prints: {@code ()}, {@code ('age',)}, {@code ('items', 0, 'name')}
     */
    public static String renderLocation(final List<Object> location) {
        if (null == location || location.isEmpty()) {
            return "()";
        }
        if (location.size() == 1) {
            return "(" + renderSegment(location.get(0)) + ",)";
        }
        return location.stream()
                .map(ErrorTranslator::renderSegment)
                .collect(Collectors.joining(", ", "(", ")"));
    }

    private static FeedbackError toFeedbackError(ValidationErrorRecord errorRecord) {
        return FeedbackError.builder()
                .type(errorRecord.getKind())
                .loc(renderLocation(errorRecord.getLocation()))
                .msg(errorRecord.getMessage())
                .input(errorRecord.getInput())
                .ctx(errorRecord.getContext())
                .extras(errorRecord.getExtras())
                .build();
    }

    private static String renderSegment(Object segment) {
        if (segment instanceof Number) {
            return segment.toString();
        }
        return quote(String.valueOf(segment));
    }

    private static String quote(String value) {
        final var quote = value.contains("'") && !value.contains("\"") ? '"' : '\'';
        final var out = new StringBuilder().append(quote);
        for (final var c : value.toCharArray()) {
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c == quote) {
                        out.append('\\');
                    }
                    out.append(c);
                }
            }
        }
        return out.append(quote).toString();
    }
}
