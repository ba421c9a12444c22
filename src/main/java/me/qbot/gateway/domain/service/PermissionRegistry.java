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
import me.qbot.gateway.domain.model.ChannelType;
import me.qbot.gateway.domain.model.ConfigDocument;
import me.qbot.gateway.domain.model.ConfigDocument.PermissionEntry;
import me.qbot.gateway.domain.model.ConfigKey;
import me.qbot.gateway.domain.model.Role;
import me.qbot.gateway.domain.model.RoleType;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * User roles, managed groups and the scoped {@code (user, group)} blacklist,
 * stored under {@code permissions.users} in the gateway document.
 *
 * <p>
 * Mutations do not check who is asking; the command layer does that. The
 * configured admin id always holds {@link Role#ADMIN} and cannot be
 * blacklisted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PermissionRegistry {

    private final ConfigStore configStore;

    public Set<Role> roles(String userId) {
        String id = requireUserId(userId);
        Set<Role> roles = configStore.read(doc -> {
            PermissionEntry entry = doc.getPermissions().getUsers().get(id);
            return toRoleSet(entry != null ? entry.getRoles() : null);
        });
        if (!roles.contains(Role.ADMIN) && id.equals(configuredAdmin())) {
            boolean repaired = configStore.apply(doc -> repairAdmin(doc, id));
            if (repaired) {
                log.info("[Permissions] Restored admin role for configured admin {}", id);
            }
            roles.add(Role.ADMIN);
        }
        return roles;
    }

    public boolean hasRole(String userId, Role role) {
        return roles(userId).contains(role);
    }

    public boolean isAdmin(String userId) {
        return hasRole(userId, Role.ADMIN);
    }

    public boolean isGloballyBlacklisted(String userId) {
        return hasRole(userId, Role.GLOBAL_BLACKLISTED);
    }

    /**
     * The scoped relation only; global blacklisting is not consulted.
     */
    public boolean isBlacklistedInGroup(String userId, String groupId) {
        if (groupId == null) {
            return false;
        }
        String id = requireUserId(userId);
        return configStore.read(doc -> {
            PermissionEntry entry = doc.getPermissions().getUsers().get(id);
            return entry != null && contains(entry.getBlacklistedIn(), groupId);
        });
    }

    /**
     * Global blacklist, or the scoped relation when {@code groupId} is given.
     */
    public boolean isBlacklisted(String userId, String groupId) {
        return isGloballyBlacklisted(userId) || isBlacklistedInGroup(userId, groupId);
    }

    public boolean managesGroup(String userId, String groupId) {
        if (groupId == null || !hasRole(userId, Role.GROUP_MANAGER)) {
            return false;
        }
        String id = requireUserId(userId);
        return configStore.read(doc -> {
            PermissionEntry entry = doc.getPermissions().getUsers().get(id);
            return entry != null && contains(entry.getManagedGroups(), groupId);
        });
    }

    /**
     * Which role block applies to a user in a scope. Blacklisting wins; admins
     * read the manager block in groups; managers read it in their own groups.
     */
    public RoleType roleTypeFor(String userId, ChannelType channelType, String groupId) {
        String scopedGroup = channelType == ChannelType.GROUP ? groupId : null;
        if (isBlacklisted(userId, scopedGroup)) {
            return RoleType.BLACKLISTED;
        }
        if (scopedGroup == null) {
            return RoleType.USER;
        }
        if (isAdmin(userId) || managesGroup(userId, scopedGroup)) {
            return RoleType.MANAGER;
        }
        return RoleType.USER;
    }

    /**
     * Read-only copy of a user's stored entry; empty when none exists.
     */
    public PermissionEntry entry(String userId) {
        String id = requireUserId(userId);
        return configStore.read(doc -> {
            PermissionEntry entry = doc.getPermissions().getUsers().get(id);
            return entry != null ? entry.copy() : new PermissionEntry();
        });
    }

    public boolean grantRole(String userId, String roleToken) {
        Role role = Role.fromToken(roleToken);
        String id = requireUserId(userId);
        if (role == Role.GLOBAL_BLACKLISTED) {
            return setGlobalBlacklist(id, true);
        }
        boolean changed = update(id, entry -> {
            if (entry.getRoles().contains(Role.GLOBAL_BLACKLISTED)) {
                throw new IllegalArgumentException("User " + id + " is globally blacklisted; remove the blacklist first");
            }
            return entry.getRoles().add(role);
        });
        if (changed) {
            log.info("[Permissions] Granted {} to {}", role.getToken(), id);
        }
        return changed;
    }

    public boolean revokeRole(String userId, String roleToken) {
        Role role = Role.fromToken(roleToken);
        String id = requireUserId(userId);
        if (role == Role.ADMIN && id.equals(configuredAdmin())) {
            throw new IllegalArgumentException("The configured admin always holds the admin role");
        }
        boolean changed = update(id, entry -> {
            boolean removed = entry.getRoles().remove(role);
            if (role == Role.GROUP_MANAGER && !entry.getManagedGroups().isEmpty()) {
                entry.getManagedGroups().clear();
                removed = true;
            }
            return removed;
        });
        if (changed) {
            log.info("[Permissions] Revoked {} from {}", role.getToken(), id);
        }
        return changed;
    }

    /**
     * Make a user manager of a group. Grants {@code group_manager} and lifts a
     * blacklist the user had in that group.
     */
    public boolean addManagedGroup(String userId, String groupId) {
        String id = requireUserId(userId);
        String group = requireGroupId(groupId);
        boolean changed = update(id, entry -> {
            if (entry.getRoles().contains(Role.GLOBAL_BLACKLISTED)) {
                throw new IllegalArgumentException("User " + id + " is globally blacklisted; remove the blacklist first");
            }
            boolean roleAdded = entry.getRoles().add(Role.GROUP_MANAGER);
            boolean groupAdded = entry.getManagedGroups().add(group);
            boolean unblocked = entry.getBlacklistedIn().remove(group);
            return roleAdded || groupAdded || unblocked;
        });
        if (changed) {
            log.info("[Permissions] {} now manages group {}", id, group);
        }
        return changed;
    }

    /**
     * Drop management of one group; the {@code group_manager} role goes with
     * the last managed group.
     */
    public boolean removeManagedGroup(String userId, String groupId) {
        String id = requireUserId(userId);
        String group = requireGroupId(groupId);
        boolean changed = update(id, entry -> {
            if (!entry.getManagedGroups().remove(group)) {
                return false;
            }
            if (entry.getManagedGroups().isEmpty()) {
                entry.getRoles().remove(Role.GROUP_MANAGER);
            }
            return true;
        });
        if (changed) {
            log.info("[Permissions] {} no longer manages group {}", id, group);
        }
        return changed;
    }

    /**
     * Blacklist a user in one group. Management of that group is dropped.
     */
    public boolean blacklistInGroup(String userId, String groupId) {
        String id = requireUserId(userId);
        String group = requireGroupId(groupId);
        rejectAdmin(id);
        boolean changed = update(id, entry -> {
            boolean unmanaged = entry.getManagedGroups().remove(group);
            if (unmanaged && entry.getManagedGroups().isEmpty()) {
                entry.getRoles().remove(Role.GROUP_MANAGER);
            }
            return entry.getBlacklistedIn().add(group) || unmanaged;
        });
        if (changed) {
            log.info("[Permissions] Blacklisted {} in group {}", id, group);
        }
        return changed;
    }

    public boolean unblacklist(String userId, String groupId) {
        String id = requireUserId(userId);
        String group = requireGroupId(groupId);
        boolean changed = update(id, entry -> entry.getBlacklistedIn().remove(group));
        if (changed) {
            log.info("[Permissions] Lifted blacklist of {} in group {}", id, group);
        }
        return changed;
    }

    /**
     * Set or clear the global blacklist. Setting it clears every other role,
     * managed group and scoped blacklist of the user.
     */
    public boolean setGlobalBlacklist(String userId, boolean blacklisted) {
        String id = requireUserId(userId);
        if (blacklisted) {
            rejectAdmin(id);
        }
        boolean changed = update(id, entry -> {
            if (!blacklisted) {
                return entry.getRoles().remove(Role.GLOBAL_BLACKLISTED);
            }
            if (entry.getRoles().size() == 1 && entry.getRoles().contains(Role.GLOBAL_BLACKLISTED)
                    && entry.getManagedGroups().isEmpty() && entry.getBlacklistedIn().isEmpty()) {
                return false;
            }
            entry.getRoles().clear();
            entry.getRoles().add(Role.GLOBAL_BLACKLISTED);
            entry.getManagedGroups().clear();
            entry.getBlacklistedIn().clear();
            return true;
        });
        if (changed) {
            log.info("[Permissions] Global blacklist of {} set to {}", id, blacklisted);
        }
        return changed;
    }

    /**
     * Replace one field of a user's entry wholesale, as written by a
     * {@code permissions.users.<id>.<field>} settings path.
     */
    public void replaceEntryField(String userId, String field, Collection<String> values) {
        String id = requireUserId(userId);
        Set<String> cleaned = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                cleaned.add(value.trim());
            }
        }
        Set<Role> parsedRoles = EnumSet.noneOf(Role.class);
        if ("roles".equals(field)) {
            for (String token : cleaned) {
                parsedRoles.add(Role.fromToken(token));
            }
            boolean dropsAdmin = parsedRoles.contains(Role.GLOBAL_BLACKLISTED) || !parsedRoles.contains(Role.ADMIN);
            if (dropsAdmin && id.equals(configuredAdmin())) {
                throw new IllegalArgumentException(
                        "The configured admin must keep the admin role and cannot be blacklisted");
            }
        } else if ("blacklisted_in".equals(field) && !cleaned.isEmpty()) {
            rejectAdmin(id);
        } else if (!"managed_groups".equals(field) && !"blacklisted_in".equals(field)) {
            throw new IllegalArgumentException("Unknown permission field: " + field
                    + ". Valid fields: roles, managed_groups, blacklisted_in");
        }
        update(id, entry -> {
            switch (field) {
            case "roles":
                entry.getRoles().clear();
                if (parsedRoles.contains(Role.GLOBAL_BLACKLISTED)) {
                    entry.getRoles().add(Role.GLOBAL_BLACKLISTED);
                    entry.getManagedGroups().clear();
                    entry.getBlacklistedIn().clear();
                } else {
                    entry.getRoles().addAll(parsedRoles);
                }
                break;
            case "managed_groups":
                entry.getManagedGroups().clear();
                entry.getManagedGroups().addAll(cleaned);
                break;
            default:
                entry.getBlacklistedIn().clear();
                entry.getBlacklistedIn().addAll(cleaned);
                break;
            }
            return true;
        });
        log.info("[Permissions] Set {} of {} to {}", field, id, cleaned);
    }

    private boolean update(String userId, Predicate<PermissionEntry> change) {
        return configStore.apply(doc -> {
            Map<String, PermissionEntry> users = doc.getPermissions().getUsers();
            PermissionEntry entry = users.computeIfAbsent(userId, id -> new PermissionEntry());
            normalize(entry);
            try {
                return change.test(entry);
            } finally {
                if (entry.isEmpty()) {
                    users.remove(userId);
                }
            }
        });
    }

    private boolean repairAdmin(ConfigDocument doc, String adminId) {
        PermissionEntry entry = doc.getPermissions().getUsers().computeIfAbsent(adminId, id -> new PermissionEntry());
        normalize(entry);
        entry.getRoles().remove(Role.GLOBAL_BLACKLISTED);
        return entry.getRoles().add(Role.ADMIN);
    }

    private void rejectAdmin(String userId) {
        if (userId.equals(configuredAdmin())) {
            throw new IllegalArgumentException("The configured admin cannot be blacklisted");
        }
    }

    private String configuredAdmin() {
        String admin = configStore.read(doc -> doc.getQqBot().getAdminQq());
        if (admin == null || ConfigKey.REQUIRED_PLACEHOLDER.equals(admin)) {
            return null;
        }
        return admin.trim();
    }

    private static void normalize(PermissionEntry entry) {
        if (entry.getRoles() == null) {
            entry.setRoles(new LinkedHashSet<>());
        }
        if (entry.getManagedGroups() == null) {
            entry.setManagedGroups(new LinkedHashSet<>());
        }
        if (entry.getBlacklistedIn() == null) {
            entry.setBlacklistedIn(new LinkedHashSet<>());
        }
    }

    private static Set<Role> toRoleSet(Set<Role> stored) {
        Set<Role> roles = EnumSet.noneOf(Role.class);
        if (stored != null) {
            roles.addAll(stored);
        }
        return roles;
    }

    private static boolean contains(Set<String> values, String groupId) {
        return values != null && values.contains(groupId.trim());
    }

    private static String requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id is required");
        }
        return userId.trim();
    }

    private static String requireGroupId(String groupId) {
        if (groupId == null || groupId.isBlank()) {
            throw new IllegalArgumentException("Group id is required");
        }
        return groupId.trim();
    }
}
