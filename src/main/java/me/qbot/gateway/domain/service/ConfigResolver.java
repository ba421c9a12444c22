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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.qbot.gateway.domain.exception.ConfigKeyMissingException;
import me.qbot.gateway.domain.model.ConfigDocument;
import me.qbot.gateway.domain.model.ConfigDocument.RandomEventConfig;
import me.qbot.gateway.domain.model.ConfigDocument.ScopeNode;
import me.qbot.gateway.domain.model.ConfigKey;
import me.qbot.gateway.domain.model.ConfigKeys;
import me.qbot.gateway.domain.model.ResolutionContext;
import me.qbot.gateway.domain.model.ResolutionLevel;
import me.qbot.gateway.domain.model.ResolvedValue;
import me.qbot.gateway.domain.model.RoleType;
import me.qbot.gateway.domain.model.ValueType;
import org.springframework.stereotype.Service;

/**
 * Resolves a key for a sender by walking the override levels, most specific
 * first:
 *
 * <ol>
 * <li>{@code group.<id>.__specific_user__.<userId>} (group scope)</li>
 * <li>{@code private.__specific_user__.<userId>} (private scope)</li>
 * <li>{@code group.<id>.<role>}, copied down from
 * {@code group.__default__.<role>} on first touch, then
 * {@code group.<id>.settings} for {@code settings.*} keys</li>
 * <li>{@code private.__default__.<role>} (private scope)</li>
 * <li>{@code group.__default__.<role>} (group scope)</li>
 * <li>the top-level key</li>
 * </ol>
 *
 * <p>
 * Each leaf resolves on its own, so a block that sets only one field still
 * inherits its siblings. Gate keys are checked against their top-level switch
 * first: an explicit {@code false} there wins over everything below.
 * Global-only keys are read from the top level and never cause copy-down.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConfigResolver {

    private final ConfigStore configStore;

    public ResolvedValue resolve(String keyPath, ResolutionContext context) {
        ConfigKey key = ConfigKeys.parse(keyPath);
        if (key.isVetoed() && isVetoed(key)) {
            log.debug("[Config] {} vetoed by global {}", key.getPath(), key.getVetoSwitch());
            return new ResolvedValue(key.getPath(), key.getType(), Boolean.FALSE, ResolutionLevel.GLOBAL_VETO);
        }
        ResolvedValue resolved;
        if (key.isGlobalOnly()) {
            resolved = configStore.read(doc -> top(doc, key));
        } else if (context.isGroup()) {
            resolved = resolveInGroup(key, context);
        } else {
            resolved = configStore.read(doc -> resolveInPrivate(doc, key, context));
        }
        if (resolved == null) {
            return fallback(key, context);
        }
        return resolved;
    }

    public boolean resolveBoolean(String keyPath, ResolutionContext context) {
        return resolve(keyPath, context).asBoolean();
    }

    public int resolveInt(String keyPath, ResolutionContext context) {
        return resolve(keyPath, context).asInt();
    }

    public double resolveDouble(String keyPath, ResolutionContext context) {
        return resolve(keyPath, context).asDouble();
    }

    public String resolveString(String keyPath, ResolutionContext context) {
        return resolve(keyPath, context).asString();
    }

    /**
     * Effective configuration of one random event, merged field by field.
     */
    public RandomEventConfig resolveEvent(String eventId, ResolutionContext context) {
        return RandomEventConfig.builder()
                .id(resolveString(ConfigKeys.eventKeyPath(eventId, "id"), context))
                .name(resolveString(ConfigKeys.eventKeyPath(eventId, "name"), context))
                .description(resolveString(ConfigKeys.eventKeyPath(eventId, "description"), context))
                .enabled(resolveBoolean(ConfigKeys.eventKeyPath(eventId, "enabled"), context))
                .probability(resolveDouble(ConfigKeys.eventKeyPath(eventId, "probability"), context))
                .minInterval(resolveInt(ConfigKeys.eventKeyPath(eventId, "min_interval"), context))
                .sharedMinInterval(resolveInt(ConfigKeys.eventKeyPath(eventId, "shared_min_interval"), context))
                .build();
    }

    private boolean isVetoed(ConfigKey key) {
        ConfigKey gate = ConfigKeys.parse(key.getVetoSwitch());
        Object value = configStore.read(gate::readTop);
        return value != null && Boolean.FALSE.equals(ValueType.BOOLEAN.coerce(value));
    }

    private ResolvedValue resolveInGroup(ConfigKey key, ResolutionContext context) {
        ResolvedValue specific = configStore.read(doc -> {
            ScopeNode node = doc.getGroup().get(context.groupId());
            Object value = node != null ? key.readFrom(node.specificUser(context.userId())) : null;
            return found(key, value, ResolutionLevel.SPECIFIC_USER_GROUP);
        });
        if (specific != null) {
            return specific;
        }
        RoleType roleType = context.roleTypeOrDefault();
        configStore.materializeRoleBlock(context.groupId(), roleType);
        return configStore.read(doc -> {
            ScopeNode node = doc.getGroup().get(context.groupId());
            if (node != null) {
                ResolvedValue hit = found(key, key.readFrom(node.roleBlock(roleType)), ResolutionLevel.GROUP_ROLE);
                if (hit == null) {
                    hit = found(key, key.readFrom(node.getSettings()), ResolutionLevel.GROUP_SETTINGS);
                }
                if (hit != null) {
                    return hit;
                }
            }
            ScopeNode defaults = doc.defaultGroupNode();
            if (defaults != null) {
                ResolvedValue hit = found(key, key.readFrom(defaults.roleBlock(roleType)),
                        ResolutionLevel.GROUP_DEFAULT_ROLE);
                if (hit != null) {
                    return hit;
                }
            }
            return top(doc, key);
        });
    }

    private ResolvedValue resolveInPrivate(ConfigDocument doc, ConfigKey key, ResolutionContext context) {
        ResolvedValue hit = found(key, key.readFrom(doc.getPrivateScope().specificUser(context.userId())),
                ResolutionLevel.SPECIFIC_USER_PRIVATE);
        if (hit != null) {
            return hit;
        }
        ScopeNode defaults = doc.getPrivateScope().getDefaults();
        if (defaults != null) {
            hit = found(key, key.readFrom(defaults.roleBlock(context.roleTypeOrDefault())),
                    ResolutionLevel.PRIVATE_DEFAULT_ROLE);
            if (hit != null) {
                return hit;
            }
        }
        return top(doc, key);
    }

    private ResolvedValue top(ConfigDocument doc, ConfigKey key) {
        return found(key, key.readTop(doc), ResolutionLevel.TOP_LEVEL);
    }

    private ResolvedValue found(ConfigKey key, Object value, ResolutionLevel level) {
        if (value == null) {
            return null;
        }
        return new ResolvedValue(key.getPath(), key.getType(), key.getType().copy(value), level);
    }

    private ResolvedValue fallback(ConfigKey key, ResolutionContext context) {
        if (key.isRequired()) {
            throw new ConfigKeyMissingException(key.getPath(),
                    "Required configuration key " + key.getPath() + " has no value for " + context.describe());
        }
        log.warn("[Config] No value for {} ({}), using compiled default: {}", key.getPath(), context.describe(),
                key.getFallback());
        return new ResolvedValue(key.getPath(), key.getType(), key.getType().copy(key.getFallback()),
                ResolutionLevel.COMPILED_DEFAULT);
    }
}
