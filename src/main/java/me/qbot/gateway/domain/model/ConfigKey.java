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

import lombok.Builder;
import lombok.Getter;
import me.qbot.gateway.domain.model.ConfigDocument.RoleBlock;
import me.qbot.gateway.domain.model.ConfigDocument.SettingsBlock;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * One leaf of the closed key schema. Carries the accessors that read and write
 * the leaf at every level that may hold it: a role block, a group's flat
 * settings block, and the top of the document.
 */
@Getter
@Builder
public final class ConfigKey {

    /** Placeholder written into the default document for mandatory values. */
    public static final String REQUIRED_PLACEHOLDER = "REQUIRED";

    private final String path;
    private final ValueType type;
    private final boolean required;
    private final boolean globalOnly;
    private final Object fallback;

    /** Top-level switch that gates this key, or null. */
    private final String vetoSwitch;

    private final Function<RoleBlock, Object> blockReader;
    private final BiConsumer<RoleBlock, Object> blockWriter;
    private final Function<SettingsBlock, Object> settingsReader;
    private final BiConsumer<SettingsBlock, Object> settingsWriter;
    private final Function<ConfigDocument, Object> documentReader;
    private final BiConsumer<ConfigDocument, Object> documentWriter;

    public boolean isSettingsKey() {
        return settingsReader != null;
    }

    public boolean isVetoed() {
        return vetoSwitch != null;
    }

    public Object readFrom(RoleBlock block) {
        if (block == null || blockReader == null) {
            return null;
        }
        return present(blockReader.apply(block));
    }

    public Object readFrom(SettingsBlock settings) {
        if (settings == null || settingsReader == null) {
            return null;
        }
        return present(settingsReader.apply(settings));
    }

    public Object readTop(ConfigDocument document) {
        return present(documentReader.apply(document));
    }

    public void writeTo(RoleBlock block, Object value) {
        if (globalOnly) {
            throw new IllegalArgumentException(path + " can only be set at the top level");
        }
        blockWriter.accept(block, value);
    }

    public void writeTo(SettingsBlock settings, Object value) {
        if (settingsWriter == null) {
            throw new IllegalArgumentException(path + " is not a settings key");
        }
        settingsWriter.accept(settings, value);
    }

    public void writeTop(ConfigDocument document, Object value) {
        documentWriter.accept(document, value);
    }

    public Object coerce(Object raw) {
        Object value = type.coerce(raw);
        if (value instanceof Double d && path.endsWith(".probability") && (d < 0.0 || d > 1.0)) {
            throw new IllegalArgumentException(path + " must be between 0 and 1, got " + d);
        }
        return value;
    }

    private Object present(Object value) {
        if (value == null) {
            return null;
        }
        if (required && isPlaceholder(value)) {
            return null;
        }
        return value;
    }

    private static boolean isPlaceholder(Object value) {
        if (REQUIRED_PLACEHOLDER.equals(value)) {
            return true;
        }
        if (value instanceof List<?> list) {
            return list.isEmpty() || list.stream().allMatch(REQUIRED_PLACEHOLDER::equals);
        }
        return false;
    }
}
