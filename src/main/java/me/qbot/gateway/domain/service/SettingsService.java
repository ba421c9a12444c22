package me.qbot.gateway.domain.service;

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

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.qbot.gateway.domain.exception.PermissionDeniedException;
import me.qbot.gateway.domain.model.ConfigDocument;
import me.qbot.gateway.domain.model.ConfigDocument.RoleBlock;
import me.qbot.gateway.domain.model.ConfigDocument.ScopeNode;
import me.qbot.gateway.domain.model.ConfigDocument.SettingsBlock;
import me.qbot.gateway.domain.model.ConfigKey;
import me.qbot.gateway.domain.model.ConfigKeys;
import me.qbot.gateway.domain.model.ResolutionContext;
import me.qbot.gateway.domain.model.RoleType;
import me.qbot.gateway.domain.model.SettingChange;
import me.qbot.gateway.domain.model.ValueType;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Writes settings by full document path, enforcing who may write where.
 *
 * <p>
 * Top-level sections, {@code group.__default__}, {@code private.*} and
 * {@code permissions.*} require the admin role. {@code group.<id>.*} is open to
 * admins and to managers of that group. The leaf after the scope prefix must be
 * a known key; global-only keys can only be written at the top level.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettingsService {

    private static final Set<String> TOP_LEVEL_SECTIONS = Set.of(
            "settings", "gemini", "qq_bot", "random_events", "log", "service", "proxy");
    private static final Set<String> PERMISSION_FIELDS = Set.of("roles", "managed_groups", "blacklisted_in");
    private static final String SPECIFIC_USER = "__specific_user__";
    private static final String GROUP = "group";
    private static final String PRIVATE = "private";
    private static final String PERMISSIONS = "permissions";

    private final ConfigStore configStore;
    private final PermissionRegistry permissionRegistry;
    private final ObjectMapper objectMapper;

    private enum TargetScope {
        TOP_LEVEL, GROUP_ROLE, GROUP_SETTINGS, GROUP_SPECIFIC_USER, PRIVATE_DEFAULT_ROLE, PRIVATE_SPECIFIC_USER,
        PERMISSION
    }

    private record Target(TargetScope scope, String path, String groupId, RoleType roleType, String userId,
            ConfigKey key, String field) {

        boolean isConcreteGroup() {
            return groupId != null && !ResolutionContext.DEFAULT_NODE.equals(groupId);
        }
    }

    /**
     * Write one value.
     *
     * @param context
     *            where the request came from; used for the audit log only
     * @throws PermissionDeniedException
     *             if the requester may not write this path
     * @throws IllegalArgumentException
     *             if the path is unknown or the value does not fit the key
     */
    public SettingChange setConfig(String keyPath, Object value, ResolutionContext context, String requesterId) {
        Target target = parseTarget(keyPath);
        authorize(target, requesterId);
        if (value == null) {
            throw new IllegalArgumentException("A value is required for " + target.path());
        }

        Object stored = target.scope() == TargetScope.PERMISSION
                ? ValueType.STRING_LIST.coerce(value)
                : target.key().coerce(value);
        switch (target.scope()) {
        case PERMISSION:
            permissionRegistry.replaceEntryField(target.userId(), target.field(), castList(stored));
            break;
        case TOP_LEVEL:
            configStore.mutate(doc -> {
                target.key().writeTop(doc, stored);
                return null;
            });
            break;
        case GROUP_SETTINGS:
            configStore.mutate(doc -> {
                ScopeNode node = groupNode(doc, target.groupId());
                if (node.getSettings() == null) {
                    node.setSettings(new SettingsBlock());
                }
                target.key().writeTo(node.getSettings(), stored);
                return null;
            });
            break;
        default:
            if (target.scope() == TargetScope.GROUP_ROLE && target.isConcreteGroup()) {
                configStore.materializeRoleBlock(target.groupId(), target.roleType());
            }
            configStore.mutate(doc -> {
                target.key().writeTo(roleBlock(doc, target), stored);
                return null;
            });
            break;
        }

        log.info("[Settings] {} set {} = {}{}", requesterId, target.path(), stored,
                context != null ? " (from " + context.describe() + ")" : "");
        return new SettingChange(target.path(), stored);
    }

    /**
     * Pretty-printed JSON of the raw block at {@code scopePath} (no cascade).
     * An empty path renders the whole document.
     */
    public String viewRaw(String scopePath, String requesterId) {
        String path = scopePath == null ? "" : scopePath.trim();
        List<String> tokens = path.isEmpty() ? List.of() : Arrays.asList(path.split("\\.", -1));
        String groupId = tokens.size() >= 2 && GROUP.equals(tokens.get(0)) ? tokens.get(1) : null;
        boolean managed = groupId != null && !ResolutionContext.DEFAULT_NODE.equals(groupId);
        if (!permissionRegistry.isAdmin(requesterId)
                && !(managed && permissionRegistry.managesGroup(requesterId, groupId))) {
            throw new PermissionDeniedException("Viewing " + (path.isEmpty() ? "the document" : path)
                    + " requires " + (managed ? "admin or manager of group " + groupId : "admin"));
        }

        JsonPointer pointer = toPointer(tokens);
        JsonNode node = configStore.read(doc -> objectMapper.valueToTree(doc).at(pointer));
        if (node == null || node.isMissingNode()) {
            throw new IllegalArgumentException("Nothing is configured at " + path);
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render " + path, e);
        }
    }

    private Target parseTarget(String keyPath) {
        if (keyPath == null || keyPath.isBlank()) {
            throw new IllegalArgumentException("Key path is required");
        }
        String path = keyPath.trim();
        String[] tokens = path.split("\\.", -1);
        String head = tokens[0];

        if (TOP_LEVEL_SECTIONS.contains(head)) {
            return new Target(TargetScope.TOP_LEVEL, path, null, null, null, ConfigKeys.parse(path), null);
        }
        if (GROUP.equals(head) && tokens.length >= 4) {
            String groupId = requireSegment(tokens[1], path);
            String kind = tokens[2];
            if ("settings".equals(kind)) {
                ConfigKey key = ConfigKeys.parse(join(tokens, 2));
                if (!key.isSettingsKey()) {
                    throw new IllegalArgumentException(path + " is not a settings key");
                }
                return new Target(TargetScope.GROUP_SETTINGS, path, groupId, null, null, key, null);
            }
            if (SPECIFIC_USER.equals(kind) && tokens.length >= 5) {
                return new Target(TargetScope.GROUP_SPECIFIC_USER, path, groupId, null,
                        requireSegment(tokens[3], path), scopedKey(join(tokens, 4), path), null);
            }
            if (RoleType.isToken(kind)) {
                return new Target(TargetScope.GROUP_ROLE, path, groupId, RoleType.fromToken(kind), null,
                        scopedKey(join(tokens, 3), path), null);
            }
        }
        if (PRIVATE.equals(head) && tokens.length >= 4) {
            if (ResolutionContext.DEFAULT_NODE.equals(tokens[1]) && RoleType.isToken(tokens[2])) {
                return new Target(TargetScope.PRIVATE_DEFAULT_ROLE, path, null, RoleType.fromToken(tokens[2]), null,
                        scopedKey(join(tokens, 3), path), null);
            }
            if (SPECIFIC_USER.equals(tokens[1])) {
                return new Target(TargetScope.PRIVATE_SPECIFIC_USER, path, null, null,
                        requireSegment(tokens[2], path), scopedKey(join(tokens, 3), path), null);
            }
        }
        if (PERMISSIONS.equals(head) && tokens.length == 4 && "users".equals(tokens[1])
                && PERMISSION_FIELDS.contains(tokens[3])) {
            return new Target(TargetScope.PERMISSION, path, null, null, requireSegment(tokens[2], path), null,
                    tokens[3]);
        }
        throw new IllegalArgumentException("Unknown configuration path: " + keyPath);
    }

    private void authorize(Target target, String requesterId) {
        if (permissionRegistry.isAdmin(requesterId)) {
            return;
        }
        boolean groupScoped = target.scope() == TargetScope.GROUP_ROLE
                || target.scope() == TargetScope.GROUP_SETTINGS
                || target.scope() == TargetScope.GROUP_SPECIFIC_USER;
        if (groupScoped && target.isConcreteGroup()
                && permissionRegistry.managesGroup(requesterId, target.groupId())) {
            return;
        }
        log.warn("[Settings] Denied {} writing {}", requesterId, target.path());
        if (groupScoped && target.isConcreteGroup()) {
            throw new PermissionDeniedException("Setting " + target.path()
                    + " requires admin or manager of group " + target.groupId());
        }
        throw new PermissionDeniedException("Setting " + target.path() + " requires admin");
    }

    private RoleBlock roleBlock(ConfigDocument doc, Target target) {
        switch (target.scope()) {
        case GROUP_ROLE: {
            ScopeNode node = groupNode(doc, target.groupId());
            RoleBlock block = node.roleBlock(target.roleType());
            if (block == null) {
                block = new RoleBlock();
                node.putRoleBlock(target.roleType(), block);
            }
            return block;
        }
        case GROUP_SPECIFIC_USER: {
            ScopeNode node = groupNode(doc, target.groupId());
            if (node.getSpecificUsers() == null) {
                node.setSpecificUsers(new LinkedHashMap<>());
            }
            return node.getSpecificUsers().computeIfAbsent(target.userId(), id -> new RoleBlock());
        }
        case PRIVATE_DEFAULT_ROLE: {
            if (doc.getPrivateScope().getDefaults() == null) {
                doc.getPrivateScope().setDefaults(new ScopeNode());
            }
            ScopeNode node = doc.getPrivateScope().getDefaults();
            RoleBlock block = node.roleBlock(target.roleType());
            if (block == null) {
                block = new RoleBlock();
                node.putRoleBlock(target.roleType(), block);
            }
            return block;
        }
        case PRIVATE_SPECIFIC_USER: {
            if (doc.getPrivateScope().getSpecificUsers() == null) {
                doc.getPrivateScope().setSpecificUsers(new LinkedHashMap<>());
            }
            return doc.getPrivateScope().getSpecificUsers().computeIfAbsent(target.userId(), id -> new RoleBlock());
        }
        default:
            throw new IllegalStateException("No role block for " + target.scope());
        }
    }

    private static ScopeNode groupNode(ConfigDocument doc, String groupId) {
        return doc.getGroup().computeIfAbsent(groupId, id -> new ScopeNode());
    }

    private static ConfigKey scopedKey(String leaf, String path) {
        ConfigKey key = ConfigKeys.parse(leaf);
        if (key.isGlobalOnly()) {
            throw new IllegalArgumentException(leaf + " is global-only and cannot be set under " + path);
        }
        return key;
    }

    private static String requireSegment(String segment, String path) {
        if (segment == null || segment.isBlank()) {
            throw new IllegalArgumentException("Empty id in " + path);
        }
        return segment;
    }

    private static String join(String[] tokens, int from) {
        return String.join(".", Arrays.copyOfRange(tokens, from, tokens.length));
    }

    private static JsonPointer toPointer(List<String> tokens) {
        StringBuilder pointer = new StringBuilder();
        for (String token : tokens) {
            pointer.append('/').append(token.replace("~", "~0").replace("/", "~1"));
        }
        return JsonPointer.compile(pointer.toString());
    }

    @SuppressWarnings("unchecked")
    private static List<String> castList(Object value) {
        return (List<String>) value;
    }
}
