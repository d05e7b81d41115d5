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

package com.danielgmyers.fluxio.options;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import com.danielgmyers.fluxio.ast.Expression;

/**
 * Declares one keyword option (or class attribute): the shapes its value may take, how to extract the value,
 * its default, whether it is required, and which values are allowed.
 */
public final class CallableOption {

    private final Set<ValueShape> shapes;
    private final String label;
    private final Function<Expression, Object> extractor;
    private final Supplier<Object> defaultValue;
    private final boolean required;
    private final Predicate<Object> allowed;
    private final String allowedDescription;

    private CallableOption(Builder builder) {
        this.shapes = Collections.unmodifiableSet(EnumSet.copyOf(builder.shapes));
        this.label = builder.label;
        this.extractor = builder.extractor;
        this.defaultValue = builder.defaultValue;
        this.required = builder.required;
        this.allowed = builder.allowed;
        this.allowedDescription = builder.allowedDescription;
    }

    /**
     * Starts declaring an option.
     * @param label  Human-readable description of the expected value, used in error messages, e.g. "integer".
     * @param shapes The accepted value shapes. Must not be empty.
     */
    public static Builder builder(String label, ValueShape... shapes) {
        return new Builder(label, shapes);
    }

    public Set<ValueShape> getShapes() {
        return shapes;
    }

    public String getLabel() {
        return label;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean accepts(Expression value) {
        for (ValueShape shape : shapes) {
            if (shape.matches(value)) {
                return true;
            }
        }
        return false;
    }

    public Object extract(Expression value) {
        if (extractor != null) {
            return extractor.apply(value);
        }
        for (ValueShape shape : shapes) {
            if (shape.matches(value)) {
                return shape.extract(value);
            }
        }
        throw new IllegalArgumentException("Value does not match any accepted shape: " + value);
    }

    public Object getDefaultValue() {
        return defaultValue == null ? null : defaultValue.get();
    }

    public boolean isAllowed(Object value) {
        return allowed == null || allowed.test(value);
    }

    public String getAllowedDescription() {
        return allowedDescription;
    }

    /**
     * Builder for CallableOption.
     */
    public static final class Builder {
        private final String label;
        private final Set<ValueShape> shapes;
        private Function<Expression, Object> extractor;
        private Supplier<Object> defaultValue;
        private boolean required;
        private Predicate<Object> allowed;
        private String allowedDescription;

        private Builder(String label, ValueShape... shapes) {
            if (shapes.length == 0) {
                throw new IllegalArgumentException("An option must accept at least one value shape.");
            }
            this.label = label;
            this.shapes = new LinkedHashSet<>(Arrays.asList(shapes));
        }

        public Builder extractor(Function<Expression, Object> extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder defaultValue(Object value) {
            this.defaultValue = () -> value;
            return this;
        }

        /**
         * Sets a default that is computed each time the option is resolved without a supplied value.
         */
        public Builder computedDefault(Supplier<Object> supplier) {
            this.defaultValue = supplier;
            return this;
        }

        public Builder required() {
            this.required = true;
            return this;
        }

        public Builder allowedValues(Object... values) {
            Set<Object> valueSet = new LinkedHashSet<>(Arrays.asList(values));
            this.allowed = valueSet::contains;
            this.allowedDescription = valueSet.stream().map(String::valueOf).collect(Collectors.joining(", "));
            return this;
        }

        public Builder allowedRange(long min, long max) {
            this.allowed = v -> v instanceof Number && ((Number)v).longValue() >= min && ((Number)v).longValue() <= max;
            this.allowedDescription = String.format("%d to %d", min, max);
            return this;
        }

        public CallableOption build() {
            return new CallableOption(this);
        }
    }
}
