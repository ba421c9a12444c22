package me.qbot.gateway.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.qbot.gateway.domain.exception.ConfigKeyMissingException;
import me.qbot.gateway.domain.exception.MalformedDocumentException;
import me.qbot.gateway.domain.model.ConfigDefaults;
import me.qbot.gateway.domain.model.ConfigDocument;
import me.qbot.gateway.domain.model.ConfigDocument.PermissionEntry;
import me.qbot.gateway.domain.model.ConfigKey;
import me.qbot.gateway.domain.model.ConfigKeys;
import me.qbot.gateway.domain.model.Role;
import me.qbot.gateway.infrastructure.config.BotProperties;
import me.qbot.gateway.port.outbound.ConfigDocumentPort;
import me.qbot.gateway.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Stores the gateway document as pretty-printed JSON in the workspace.
 *
 * <p>
 * Loading overlays the stored document on the compiled-in defaults (objects
 * merge recursively, everything else replaces), so keys added in a newer
 * release appear without touching existing values. The merged result is
 * written back before validation, giving the operator a complete file to fill
 * in when a mandatory key is still missing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonConfigDocumentAdapter implements ConfigDocumentPort {

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final BotProperties properties;

    @Override
    public ConfigDocument load() {
        String location = location();
        String stored = readStored();

        ObjectNode merged = objectMapper.valueToTree(ConfigDefaults.create());
        if (stored == null || stored.isBlank()) {
            log.info("[Config] No document at {}, creating defaults", location);
        } else {
            mergeInto(merged, parse(stored, location));
        }

        ConfigDocument document;
        try {
            document = objectMapper.treeToValue(merged, ConfigDocument.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedDocumentException("Config document " + location + " has an invalid structure: "
                    + e.getMessage(), e);
        }
        document.ensureSections();
        ensureAdminEntry(document);

        List<String> missing = missingRequiredKeys(document);
        joinSave(document);
        if (!missing.isEmpty()) {
            throw new ConfigKeyMissingException(missing.get(0),
                    "Required configuration keys are not set in " + location + ": " + String.join(", ", missing));
        }
        log.info("[Config] Loaded document from {}", location);
        return document;
    }

    @Override
    public CompletableFuture<Void> save(ConfigDocument document) {
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Failed to serialize config document", e));
        }
        BotProperties.ConfigProperties config = properties.getConfig();
        return storagePort.putTextAtomic(config.getDirectory(), config.getFile(), json, config.isBackup());
    }

    private String readStored() {
        BotProperties.ConfigProperties config = properties.getConfig();
        try {
            return storagePort.getText(config.getDirectory(), config.getFile()).join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Failed to read config document " + location(), e.getCause());
        }
    }

    private ObjectNode parse(String json, String location) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedDocumentException("Config document " + location + " is not valid JSON: "
                    + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedDocumentException("Config document " + location + " must be a JSON object");
        }
        return (ObjectNode) root;
    }

    private void mergeInto(ObjectNode target, ObjectNode overlay) {
        Iterator<Map.Entry<String, JsonNode>> fields = overlay.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                mergeInto((ObjectNode) existing, (ObjectNode) field.getValue());
            } else {
                target.set(field.getKey(), field.getValue().deepCopy());
            }
        }
    }

    private void ensureAdminEntry(ConfigDocument document) {
        String adminId = document.getQqBot().getAdminQq();
        if (adminId == null || adminId.isBlank() || ConfigKey.REQUIRED_PLACEHOLDER.equals(adminId)) {
            return;
        }
        PermissionEntry entry = document.getPermissions().getUsers()
                .computeIfAbsent(adminId.trim(), id -> new PermissionEntry());
        if (entry.getRoles() == null) {
            entry.setRoles(new LinkedHashSet<>());
        }
        boolean changed = entry.getRoles().add(Role.ADMIN);
        changed |= entry.getRoles().add(Role.PRIVATE_USER);
        if (changed) {
            log.info("[Config] Granted admin roles to configured admin {}", adminId);
        }
    }

    private List<String> missingRequiredKeys(ConfigDocument document) {
        List<String> missing = new ArrayList<>();
        for (ConfigKey key : ConfigKeys.requiredKeys()) {
            if (key.readTop(document) == null) {
                missing.add(key.getPath());
            }
        }
        return missing;
    }

    private void joinSave(ConfigDocument document) {
        try {
            save(document).join();
        } catch (CompletionException e) {
            log.error("[Config] Failed to write merged document to {}", location(), e.getCause());
        }
    }

    private String location() {
        return properties.getConfig().getDirectory() + "/" + properties.getConfig().getFile();
    }
}
