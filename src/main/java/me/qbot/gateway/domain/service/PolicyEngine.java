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
import me.qbot.gateway.domain.model.ConfigKeys;
import me.qbot.gateway.domain.model.MessagePolicy;
import me.qbot.gateway.domain.model.RateLimitResult;
import me.qbot.gateway.domain.model.ResolutionContext;
import me.qbot.gateway.domain.model.ResolvedValue;
import me.qbot.gateway.domain.model.Role;
import me.qbot.gateway.domain.model.RoleType;
import me.qbot.gateway.domain.model.SettingChange;
import me.qbot.gateway.ratelimit.RateLimitScope;
import me.qbot.gateway.ratelimit.RateLimiter;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Entry point for the message-handling and command layers. Fills in the
 * sender's role block from the permission registry when the caller did not
 * supply one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PolicyEngine {

    private final ConfigResolver configResolver;
    private final PermissionRegistry permissionRegistry;
    private final RateLimiter rateLimiter;
    private final EventCooldownTracker cooldownTracker;
    private final RandomEventService randomEventService;
    private final SettingsService settingsService;

    public ResolvedValue resolve(String keyPath, ResolutionContext context) {
        return configResolver.resolve(keyPath, withRole(context));
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

    public Set<Role> roles(String userId) {
        return permissionRegistry.roles(userId);
    }

    public boolean isBlacklistedInGroup(String userId, String groupId) {
        return permissionRegistry.isBlacklistedInGroup(userId, groupId);
    }

    public boolean managesGroup(String userId, String groupId) {
        return permissionRegistry.managesGroup(userId, groupId);
    }

    public RateLimitResult checkRate(ResolutionContext context, int limitPerHour) {
        return rateLimiter.check(RateLimitScope.of(context).key(), limitPerHour);
    }

    /**
     * Check against the sender's effective {@code settings.message_rate_limit}.
     */
    public RateLimitResult checkRate(ResolutionContext context) {
        return checkRate(context, resolveInt(ConfigKeys.MESSAGE_RATE_LIMIT, context));
    }

    public boolean tryRandomEvent(String eventId, ResolutionContext context, double probability,
            long personalIntervalSec, long sharedIntervalSec) {
        return cooldownTracker.tryTrigger(eventId, context, probability, personalIntervalSec, sharedIntervalSec);
    }

    /**
     * Try an event using its configured probability and intervals.
     */
    public boolean tryRandomEvent(String eventId, ResolutionContext context) {
        return randomEventService.tryFire(eventId, withRole(context));
    }

    public SettingChange setConfig(String keyPath, Object value, ResolutionContext context, String requesterId) {
        return settingsService.setConfig(keyPath, value, context, requesterId);
    }

    /**
     * Everything the message layer needs for one inbound message.
     */
    public MessagePolicy evaluate(ResolutionContext context) {
        ResolutionContext resolved = withRole(context);
        return MessagePolicy.builder()
                .roleType(resolved.roleType())
                .blacklisted(resolved.roleType() == RoleType.BLACKLISTED)
                .aiChatEnabled(configResolver.resolveBoolean(ConfigKeys.ENABLE_AI_CHAT, resolved))
                .commandsEnabled(configResolver.resolveBoolean(ConfigKeys.ENABLE_CHAT_COMMANDS, resolved))
                .historyEditEnabled(configResolver.resolveBoolean(ConfigKeys.ENABLE_HISTORY_EDIT, resolved))
                .personalityRetrainEnabled(
                        configResolver.resolveBoolean(ConfigKeys.ENABLE_PERSONALITY_RETRAIN, resolved))
                .messageRateLimit(configResolver.resolveInt(ConfigKeys.MESSAGE_RATE_LIMIT, resolved))
                .voice(configResolver.resolveString(ConfigKeys.VOICE, resolved))
                .build();
    }

    private ResolutionContext withRole(ResolutionContext context) {
        if (context.roleType() != null) {
            return context;
        }
        RoleType roleType = permissionRegistry.roleTypeFor(context.userId(), context.channelType(), context.groupId());
        log.trace("[Config] {} reads the {} block", context.describe(), roleType.getToken());
        return context.withRoleType(roleType);
    }
}
