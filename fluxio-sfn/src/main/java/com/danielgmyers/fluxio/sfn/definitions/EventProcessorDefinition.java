/*
 *   Copyright Flux Contributors
 *
 *   Licensed under the Apache License, Version 2.0 (the "License").
 *   You may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package com.danielgmyers.fluxio.sfn.definitions;

import java.util.List;

import com.danielgmyers.fluxio.ast.ClassDef;

/**
 * A class deriving from EventProcessor, which state machines can reference with {@code @process_events}.
 */
public final class EventProcessorDefinition {

    public static final String CUSTOM_TAG_PREFIX = "get_custom_tags_";

    private final String name;
    private final ClassDef node;
    private final List<String> customTags;

    public EventProcessorDefinition(String name, ClassDef node, List<String> customTags) {
        this.name = name;
        this.node = node;
        this.customTags = List.copyOf(customTags);
    }

    public String getName() {
        return name;
    }

    public ClassDef getNode() {
        return node;
    }

    /**
     * The tag names of the processor's {@code get_custom_tags_<tag>} methods, in declaration order.
     */
    public List<String> getCustomTags() {
        return customTags;
    }
}
