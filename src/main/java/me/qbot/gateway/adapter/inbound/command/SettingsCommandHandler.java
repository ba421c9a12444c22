package me.qbot.gateway.adapter.inbound.command;

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
import me.qbot.gateway.domain.exception.PermissionDeniedException;
import me.qbot.gateway.domain.exception.PolicyException;
import me.qbot.gateway.domain.model.ChannelType;
import me.qbot.gateway.domain.model.ConfigDocument.PermissionEntry;
import me.qbot.gateway.domain.model.ResolutionContext;
import me.qbot.gateway.domain.model.ResolvedValue;
import me.qbot.gateway.domain.model.Role;
import me.qbot.gateway.domain.model.SettingChange;
import me.qbot.gateway.domain.service.EventCooldownTracker;
import me.qbot.gateway.domain.service.PermissionRegistry;
import me.qbot.gateway.domain.service.PolicyEngine;
import me.qbot.gateway.domain.service.SettingsService;
import me.qbot.gateway.port.inbound.SettingsCommandPort;
import me.qbot.gateway.ratelimit.RateLimiter;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Settings and permission commands.
 *
 * <ul>
 * <li>set &lt;path&gt; &lt;value&gt; - write a setting</li>
 * <li>view [path] - show a raw block</li>
 * <li>effective &lt;key&gt; - resolve a key for the caller</li>
 * <li>roles [user] - show roles</li>
 * <li>grant / revoke &lt;user&gt; &lt;role&gt; - admin only</li>
 * <li>manage / unmanage &lt;user&gt; &lt;group&gt; - admin only</li>
 * <li>blacklist / unblacklist &lt;user&gt; [group] - admin, or manager of the
 * group</li>
 * <li>resetcounts - clear rate windows and cooldowns, admin only</li>
 * </ul>
 *
 * <p>
 * Engine errors become failed results; nothing propagates to the transport.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettingsCommandHandler implements SettingsCommandPort {

    private static final String CMD_SET = "set";
    private static final String CMD_VIEW = "view";
    private static final String CMD_EFFECTIVE = "effective";
    private static final String CMD_ROLES = "roles";
    private static final String CMD_GRANT = "grant";
    private static final String CMD_REVOKE = "revoke";
    private static final String CMD_MANAGE = "manage";
    private static final String CMD_UNMANAGE = "unmanage";
    private static final String CMD_BLACKLIST = "blacklist";
    private static final String CMD_UNBLACKLIST = "unblacklist";
    private static final String CMD_RESET_COUNTS = "resetcounts";
    private static final Set<String> KNOWN_COMMANDS = Set.of(CMD_SET, CMD_VIEW, CMD_EFFECTIVE, CMD_ROLES,
            CMD_GRANT, CMD_REVOKE, CMD_MANAGE, CMD_UNMANAGE, CMD_BLACKLIST, CMD_UNBLACKLIST, CMD_RESET_COUNTS);

    private final PolicyEngine policyEngine;
    private final PermissionRegistry permissionRegistry;
    private final SettingsService settingsService;
    private final RateLimiter rateLimiter;
    private final EventCooldownTracker cooldownTracker;

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context) {
        return CompletableFuture.supplyAsync(() -> {
            if (!hasCommand(command)) {
                return CommandResult.failure("Unknown command: " + command);
            }
            try {
                ResolutionContext caller = toContext(context);
                log.debug("[Settings] /{} from {}", command, caller.describe());
                return switch (command) {
                case CMD_SET -> handleSet(args, caller);
                case CMD_VIEW -> handleView(args, caller);
                case CMD_EFFECTIVE -> handleEffective(args, caller);
                case CMD_ROLES -> handleRoles(args, caller);
                case CMD_GRANT -> handleGrant(args, caller, true);
                case CMD_REVOKE -> handleGrant(args, caller, false);
                case CMD_MANAGE -> handleManage(args, caller, true);
                case CMD_UNMANAGE -> handleManage(args, caller, false);
                case CMD_BLACKLIST -> handleBlacklist(args, caller, true);
                case CMD_UNBLACKLIST -> handleBlacklist(args, caller, false);
                case CMD_RESET_COUNTS -> handleResetCounts(caller);
                default -> CommandResult.failure("Unknown command: " + command);
                };
            } catch (PermissionDeniedException e) {
                return CommandResult.failure("Permission denied: " + e.getMessage());
            } catch (PolicyException | IllegalArgumentException e) {
                return CommandResult.failure(e.getMessage());
            } catch (RuntimeException e) {
                log.error("[Settings] /{} failed", command, e);
                return CommandResult.failure("Command failed: " + e.getMessage());
            }
        });
    }

    @Override
    public boolean hasCommand(String command) {
        return command != null && KNOWN_COMMANDS.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return List.of(
                new CommandDefinition(CMD_SET, "Write a setting", "/set <path> <value>"),
                new CommandDefinition(CMD_VIEW, "Show a raw configuration block", "/view [path]"),
                new CommandDefinition(CMD_EFFECTIVE, "Show the value that applies to you", "/effective <key>"),
                new CommandDefinition(CMD_ROLES, "Show roles", "/roles [user]"),
                new CommandDefinition(CMD_GRANT, "Grant a role", "/grant <user> <role>"),
                new CommandDefinition(CMD_REVOKE, "Revoke a role", "/revoke <user> <role>"),
                new CommandDefinition(CMD_MANAGE, "Make a user manager of a group", "/manage <user> <group>"),
                new CommandDefinition(CMD_UNMANAGE, "Remove a group manager", "/unmanage <user> <group>"),
                new CommandDefinition(CMD_BLACKLIST, "Blacklist a user", "/blacklist <user> [group]"),
                new CommandDefinition(CMD_UNBLACKLIST, "Lift a blacklist", "/unblacklist <user> [group]"),
                new CommandDefinition(CMD_RESET_COUNTS, "Reset rate limits and cooldowns", "/resetcounts"));
    }

    private CommandResult handleSet(List<String> args, ResolutionContext caller) {
        if (args.size() < 2) {
            return CommandResult.failure("Usage: /set <path> <value>");
        }
        String value = String.join(" ", args.subList(1, args.size()));
        SettingChange change = policyEngine.setConfig(args.get(0), value, caller, caller.userId());
        return CommandResult.success("Set " + change.targetPath() + " = " + change.value(), change);
    }

    private CommandResult handleView(List<String> args, ResolutionContext caller) {
        String path = args.isEmpty() ? defaultViewPath(caller) : args.get(0);
        return CommandResult.success(settingsService.viewRaw(path, caller.userId()));
    }

    private CommandResult handleEffective(List<String> args, ResolutionContext caller) {
        if (args.isEmpty()) {
            return CommandResult.failure("Usage: /effective <key>");
        }
        ResolvedValue value = policyEngine.resolve(args.get(0), caller);
        return CommandResult.success(value.keyPath() + " = " + value.value() + " (from " + value.level() + ")", value);
    }

    private CommandResult handleRoles(List<String> args, ResolutionContext caller) {
        String target = args.isEmpty() ? caller.userId() : args.get(0);
        if (!target.equals(caller.userId())) {
            requireAdmin(caller, "Viewing another user's roles");
        }
        Set<Role> roles = permissionRegistry.roles(target);
        PermissionEntry entry = permissionRegistry.entry(target);
        String roleList = roles.isEmpty() ? "(none)"
                : roles.stream().map(Role::getToken).collect(Collectors.joining(", "));
        return CommandResult.success("Roles of " + target + ": " + roleList
                + "\nManaged groups: " + entry.getManagedGroups()
                + "\nBlacklisted in: " + entry.getBlacklistedIn(), roles);
    }

    private CommandResult handleGrant(List<String> args, ResolutionContext caller, boolean grant) {
        if (args.size() < 2) {
            return CommandResult.failure("Usage: /" + (grant ? CMD_GRANT : CMD_REVOKE) + " <user> <role>");
        }
        requireAdmin(caller, grant ? "Granting roles" : "Revoking roles");
        String userId = args.get(0);
        String role = args.get(1);
        boolean changed = grant
                ? permissionRegistry.grantRole(userId, role)
                : permissionRegistry.revokeRole(userId, role);
        if (!changed) {
            return CommandResult.success("No change for " + userId);
        }
        return CommandResult.success((grant ? "Granted " : "Revoked ") + role + (grant ? " to " : " from ") + userId);
    }

    private CommandResult handleManage(List<String> args, ResolutionContext caller, boolean manage) {
        if (args.size() < 2) {
            return CommandResult.failure("Usage: /" + (manage ? CMD_MANAGE : CMD_UNMANAGE) + " <user> <group>");
        }
        requireAdmin(caller, "Changing group managers");
        String userId = args.get(0);
        String groupId = args.get(1);
        boolean changed = manage
                ? permissionRegistry.addManagedGroup(userId, groupId)
                : permissionRegistry.removeManagedGroup(userId, groupId);
        if (!changed) {
            return CommandResult.success("No change for " + userId);
        }
        return CommandResult.success(userId + (manage ? " now manages group " : " no longer manages group ")
                + groupId);
    }

    private CommandResult handleBlacklist(List<String> args, ResolutionContext caller, boolean blacklist) {
        if (args.isEmpty()) {
            return CommandResult.failure("Usage: /" + (blacklist ? CMD_BLACKLIST : CMD_UNBLACKLIST)
                    + " <user> [group]");
        }
        String userId = args.get(0);
        String groupId = args.size() > 1 ? args.get(1) : null;
        boolean changed;
        if (groupId == null) {
            requireAdmin(caller, "Changing the global blacklist");
            changed = permissionRegistry.setGlobalBlacklist(userId, blacklist);
        } else {
            if (!permissionRegistry.isAdmin(caller.userId())
                    && !permissionRegistry.managesGroup(caller.userId(), groupId)) {
                throw new PermissionDeniedException(
                        "Changing the blacklist of group " + groupId + " requires admin or manager of that group");
            }
            changed = blacklist
                    ? permissionRegistry.blacklistInGroup(userId, groupId)
                    : permissionRegistry.unblacklist(userId, groupId);
        }
        if (!changed) {
            return CommandResult.success("No change for " + userId);
        }
        String scope = groupId == null ? "globally" : "in group " + groupId;
        return CommandResult.success((blacklist ? "Blacklisted " : "Lifted blacklist of ") + userId + " " + scope);
    }

    private CommandResult handleResetCounts(ResolutionContext caller) {
        requireAdmin(caller, "Resetting counters");
        rateLimiter.reset();
        cooldownTracker.reset();
        return CommandResult.success("Rate limits and event cooldowns reset");
    }

    private void requireAdmin(ResolutionContext caller, String action) {
        if (!permissionRegistry.isAdmin(caller.userId())) {
            throw new PermissionDeniedException(action + " requires admin");
        }
    }

    private String defaultViewPath(ResolutionContext caller) {
        return caller.isGroup() ? "group." + caller.groupId() : "";
    }

    private ResolutionContext toContext(Map<String, Object> context) {
        String userId = stringValue(context, CONTEXT_USER_ID);
        String groupId = stringValue(context, CONTEXT_GROUP_ID);
        String channel = stringValue(context, CONTEXT_CHANNEL_TYPE);
        ChannelType channelType = channel != null
                ? ChannelType.fromToken(channel)
                : (groupId != null ? ChannelType.GROUP : ChannelType.PRIVATE);
        return new ResolutionContext(channelType, groupId, userId, null);
    }

    private static String stringValue(Map<String, Object> context, String key) {
        Object value = context != null ? context.get(key) : null;
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }
}
