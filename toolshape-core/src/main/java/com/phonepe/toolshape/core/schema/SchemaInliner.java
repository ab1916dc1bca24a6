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

package com.phonepe.toolshape.core.schema;

import com.google.common.base.Strings;
import com.phonepe.toolshape.core.errors.SchemaBuildException;
import com.phonepe.toolshape.core.errors.SchemaErrorType;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Removes all indirection from a schema tree. Every reference is replaced by the subtree it points to, at every
 * place it is used. A reference back to a node that is already being expanded on the current path is a true
 * cycle and cannot be expressed without references, so it fails.
 */
@Slf4j
public class SchemaInliner {
    private static final String ROOT_REFERENCE = "#";
    private static final String DEFS_PREFIX = "#/" + SchemaKeywords.DEFS + "/";
    private static final String DEFINITIONS_PREFIX = "#/" + SchemaKeywords.DEFINITIONS + "/";

    public SchemaNode inline(final SchemaNode root) {
        final Set<SchemaNode> expanding = Collections.newSetFromMap(new IdentityHashMap<>());
        expanding.add(root);
        final var inlined = expand(root, root, expanding);
        log.debug("Inlined schema tree {} ({} definitions removed)",
                  root.getName(), root.getDefinitions().size());
        return inlined.toBuilder()
                .name(rootName(root))
                .definitions(Map.of())
                .build();
    }

    private static String rootName(SchemaNode root) {
        if (!Strings.isNullOrEmpty(root.getName()) || root.getKind() != NodeKind.REFERENCE) {
            return root.getName();
        }
        return resolve(root.getReference(), root).getName();
    }

    private SchemaNode expand(SchemaNode node, SchemaNode root, Set<SchemaNode> expanding) {
        return switch (node.getKind()) {
            case REFERENCE -> expandReference(node, root, expanding);
            case OBJECT -> nested(node.withFields(node.getFields()
                                                          .stream()
                                                          .map(field -> field.withNode(
                                                                  expand(field.getNode(), root, expanding)))
                                                          .toList()));
            case ARRAY -> nested(node.withItems(null == node.getItems()
                                                ? SchemaNode.any()
                                                : expand(node.getItems(), root, expanding)));
            case UNION -> nested(node.withVariants(node.getVariants()
                                                           .stream()
                                                           .map(variant -> expand(variant, root, expanding))
                                                           .toList()));
            case PRIMITIVE, ENUM -> nested(node);
        };
    }

    private SchemaNode expandReference(SchemaNode reference, SchemaNode root, Set<SchemaNode> expanding) {
        final var target = resolve(reference.getReference(), root);
        if (expanding.contains(target)) {
            throw new SchemaBuildException(SchemaErrorType.CYCLIC_REFERENCE, reference.getReference());
        }
        expanding.add(target);
        try {
            var expanded = expand(target, root, expanding);
            if (!Strings.isNullOrEmpty(reference.getDescription())) {
                expanded = expanded.withDescription(reference.getDescription());
            }
            if (reference.getDefaultValue() != null) {
                expanded = expanded.withDefaultValue(reference.getDefaultValue());
            }
            return expanded;
        }
        finally {
            expanding.remove(target);
        }
    }

    private static SchemaNode resolve(String reference, SchemaNode root) {
        if (null == reference || reference.isEmpty() || reference.equals(ROOT_REFERENCE)) {
            return root;
        }
        final String name;
        if (reference.startsWith(DEFS_PREFIX)) {
            name = reference.substring(DEFS_PREFIX.length());
        }
        else if (reference.startsWith(DEFINITIONS_PREFIX)) {
            name = reference.substring(DEFINITIONS_PREFIX.length());
        }
        else {
            throw new SchemaBuildException(SchemaErrorType.UNRESOLVED_REFERENCE, reference);
        }
        if (name.contains("/")) {
            throw new SchemaBuildException(SchemaErrorType.UNRESOLVED_REFERENCE, reference);
        }
        final var target = root.getDefinitions().get(unescape(name));
        if (null == target) {
            throw new SchemaBuildException(SchemaErrorType.UNRESOLVED_REFERENCE, reference);
        }
        return target;
    }

    /**
     * Json pointer escapes, see RFC 6901
     */
    private static String unescape(String token) {
        return token.replace("~1", "/").replace("~0", "~");
    }

    private static SchemaNode nested(SchemaNode node) {
        if (null == node.getName() && node.getDefinitions().isEmpty()) {
            return node;
        }
        return node.toBuilder()
                .name(null)
                .definitions(Map.of())
                .build();
    }
}
