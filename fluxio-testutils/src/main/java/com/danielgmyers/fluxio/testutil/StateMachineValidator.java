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

package com.danielgmyers.fluxio.testutil;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Helper class for validating the structure of a rendered state machine document.
 *
 * Embedded Map iterators and Parallel branches are validated recursively.
 */
public final class StateMachineValidator {

    private static final Set<String> TERMINAL_TYPES = new HashSet<>(Arrays.asList("Succeed", "Fail"));
    private static final String CHOICE = "Choice";

    private StateMachineValidator() {}

    /**
     * @throws RuntimeException describing the first problem found
     */
    public static void validate(Map<String, Object> document) {
        validate(document, "");
    }

    private static void validate(Map<String, Object> document, String path) {
        Map<String, Object> states = asMap(document.get("States"), path + "States");
        Object startAt = document.get("StartAt");
        if (!(startAt instanceof String) || !states.containsKey(startAt)) {
            throw new RuntimeException(String.format("%sStartAt %s does not name a state", path, startAt));
        }

        for (Map.Entry<String, Object> entry : states.entrySet()) {
            String statePath = path + entry.getKey();
            Map<String, Object> state = asMap(entry.getValue(), statePath);
            Object type = state.get("Type");
            if (!(type instanceof String)) {
                throw new RuntimeException(String.format("State %s has no Type", statePath));
            }

            boolean hasNext = state.containsKey("Next");
            boolean hasEnd = state.containsKey("End");
            if (TERMINAL_TYPES.contains(type) || CHOICE.equals(type)) {
                if (hasNext || hasEnd) {
                    throw new RuntimeException(String.format("%s state %s cannot have Next or End", type, statePath));
                }
            } else if (hasNext == hasEnd) {
                throw new RuntimeException(String.format("State %s must have exactly one of Next or End", statePath));
            }

            checkTarget(states, state.get("Next"), statePath);
            checkTarget(states, state.get("Default"), statePath);
            for (Object choice : asList(state.get("Choices"))) {
                checkTarget(states, asMap(choice, statePath).get("Next"), statePath);
            }
            for (Object handler : asList(state.get("Catch"))) {
                checkTarget(states, asMap(handler, statePath).get("Next"), statePath);
            }

            if (state.containsKey("Iterator")) {
                validate(asMap(state.get("Iterator"), statePath), statePath + ".Iterator.");
            }
            int index = 0;
            for (Object branch : asList(state.get("Branches"))) {
                validate(asMap(branch, statePath), statePath + ".Branches[" + index + "].");
                index++;
            }
        }
    }

    private static void checkTarget(Map<String, Object> states, Object target, String statePath) {
        if (target != null && !states.containsKey(target)) {
            throw new RuntimeException(String.format("State %s transitions to unknown state %s", statePath, target));
        }
    }

    private static Map<String, Object> asMap(Object value, String path) {
        if (!(value instanceof Map)) {
            throw new RuntimeException(String.format("Expected an object at %s", path));
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>)value).entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return result;
    }

    private static List<?> asList(Object value) {
        return value instanceof List ? (List<?>)value : List.of();
    }
}
