package me.qbot.gateway.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Effective value of a key plus the cascade level that supplied it.
 */
public record ResolvedValue(String keyPath, ValueType type, Object value, ResolutionLevel level) {

    public boolean isPresent() {
        return value != null;
    }

    public boolean asBoolean() {
        Object coerced = ValueType.BOOLEAN.coerce(value);
        return coerced != null && (Boolean) coerced;
    }

    public int asInt() {
        Object coerced = ValueType.INTEGER.coerce(value);
        if (coerced == null) {
            throw new IllegalStateException("No value for " + keyPath);
        }
        return (Integer) coerced;
    }

    public double asDouble() {
        Object coerced = ValueType.DOUBLE.coerce(value);
        if (coerced == null) {
            throw new IllegalStateException("No value for " + keyPath);
        }
        return (Double) coerced;
    }

    public String asString() {
        return value != null ? value.toString() : null;
    }
}
