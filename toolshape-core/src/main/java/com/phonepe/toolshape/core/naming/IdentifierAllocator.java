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

package com.phonepe.toolshape.core.naming;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import lombok.Getter;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hands out unique model names. Ids increase monotonically and are never reused. Safe for concurrent use.
 */
public class IdentifierAllocator {
    public static final String DEFAULT_PREFIX = "Model";

    private static final AtomicReference<IdentifierAllocator> DEFAULT = new AtomicReference<>();

    @Getter
    private final String prefix;
    private final AtomicLong counter;

    public IdentifierAllocator(String prefix, long start) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(prefix), "Identifier prefix is required");
        Preconditions.checkArgument(start >= 0, "Identifier start must not be negative");
        this.prefix = prefix;
        this.counter = new AtomicLong(start);
    }

    /**
     * Sets up the process wide allocator. Can be called once, before the default allocator is first used.
     */
    public static IdentifierAllocator initialize(String prefix, long start) {
        final var allocator = new IdentifierAllocator(prefix, start);
        Preconditions.checkState(DEFAULT.compareAndSet(null, allocator),
                                 "Identifier allocator is already initialized");
        return allocator;
    }

    public static IdentifierAllocator defaultAllocator() {
        final var current = DEFAULT.get();
        if (null != current) {
            return current;
        }
        DEFAULT.compareAndSet(null, new IdentifierAllocator(DEFAULT_PREFIX, 0));
        return DEFAULT.get();
    }

    public String next() {
        return next(prefix);
    }

    public String next(String base) {
        return (Strings.isNullOrEmpty(base) ? prefix : base) + "_" + counter.incrementAndGet();
    }
}
