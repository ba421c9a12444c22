package me.qbot.gateway.domain.service;

import me.qbot.gateway.domain.exception.InvalidRoleException;
import me.qbot.gateway.domain.model.ChannelType;
import me.qbot.gateway.domain.model.ConfigDocument;
import me.qbot.gateway.domain.model.ConfigDocument.PermissionEntry;
import me.qbot.gateway.domain.model.Role;
import me.qbot.gateway.domain.model.RoleType;
import me.qbot.gateway.testsupport.InMemoryConfigDocumentPort;
import me.qbot.gateway.testsupport.TestDocuments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PermissionRegistryTest {

    private static final String ADMIN = TestDocuments.ADMIN_ID;
    private static final String USER = "30003";
    private static final String GROUP_A = "111";
    private static final String GROUP_B = "222";

    private ConfigDocument document;
    private InMemoryConfigDocumentPort port;
    private ConfigStore store;
    private PermissionRegistry registry;

    @BeforeEach
    void setUp() {
        document = TestDocuments.valid();
        port = new InMemoryConfigDocumentPort(document);
        store = TestDocuments.loadedStore(port);
        registry = new PermissionRegistry(store);
    }

    // ===== Admin =====

    @Test
    void shouldTreatConfiguredAdminAsAdminWithEmptyPermissions() {
        document.getPermissions().getUsers().clear();

        assertTrue(registry.isAdmin(ADMIN));
        assertTrue(store.<Boolean>read(doc -> doc.getPermissions().getUsers().get(ADMIN).getRoles().contains(Role.ADMIN)));
        assertEquals(1, port.getSaves().size());
    }

    @Test
    void shouldRefuseToBlacklistConfiguredAdmin() {
        assertThrows(IllegalArgumentException.class, () -> registry.setGlobalBlacklist(ADMIN, true));
        assertThrows(IllegalArgumentException.class, () -> registry.blacklistInGroup(ADMIN, GROUP_A));
        assertThrows(IllegalArgumentException.class, () -> registry.revokeRole(ADMIN, "admin"));
        assertTrue(registry.isAdmin(ADMIN));
    }

    @Test
    void shouldNotTreatOtherUsersAsAdmin() {
        assertFalse(registry.isAdmin(USER));
        assertTrue(registry.roles(USER).isEmpty());
    }

    // ===== Roles =====

    @Test
    void shouldGrantAndRevokeRoles() {
        assertTrue(registry.grantRole(USER, "private_user"));
        assertFalse(registry.grantRole(USER, "private_user"));
        assertEquals(Set.of(Role.PRIVATE_USER), registry.roles(USER));

        assertTrue(registry.revokeRole(USER, "private_user"));
        assertTrue(registry.roles(USER).isEmpty());
        assertFalse(store.<Boolean>read(doc -> doc.getPermissions().getUsers().containsKey(USER)));
    }

    @Test
    void shouldRejectUnknownRoleToken() {
        assertThrows(InvalidRoleException.class, () -> registry.grantRole(USER, "overlord"));
        assertFalse(store.<Boolean>read(doc -> doc.getPermissions().getUsers().containsKey(USER)));
    }

    @Test
    void shouldClearEverythingWhenGloballyBlacklisted() {
        registry.addManagedGroup(USER, GROUP_A);
        registry.grantRole(USER, "private_user");

        assertTrue(registry.grantRole(USER, "global_blacklisted"));

        PermissionEntry entry = registry.entry(USER);
        assertEquals(Set.of(Role.GLOBAL_BLACKLISTED), entry.getRoles());
        assertTrue(entry.getManagedGroups().isEmpty());
        assertTrue(registry.isBlacklisted(USER, GROUP_B));
        assertThrows(IllegalArgumentException.class, () -> registry.grantRole(USER, "private_user"));
    }

    @Test
    void shouldLiftGlobalBlacklist() {
        registry.setGlobalBlacklist(USER, true);

        assertTrue(registry.setGlobalBlacklist(USER, false));
        assertFalse(registry.isGloballyBlacklisted(USER));
        assertFalse(registry.setGlobalBlacklist(USER, false));
    }

    // ===== Group scope =====

    @Test
    void shouldScopeBlacklistToOneGroup() {
        registry.blacklistInGroup(USER, GROUP_A);

        assertTrue(registry.isBlacklistedInGroup(USER, GROUP_A));
        assertFalse(registry.isBlacklistedInGroup(USER, GROUP_B));
        assertFalse(registry.isBlacklistedInGroup(USER, null));
        assertFalse(registry.isGloballyBlacklisted(USER));
    }

    @Test
    void shouldManageGroupsIndividually() {
        registry.addManagedGroup(USER, GROUP_A);

        assertTrue(registry.managesGroup(USER, GROUP_A));
        assertFalse(registry.managesGroup(USER, GROUP_B));
        assertTrue(registry.hasRole(USER, Role.GROUP_MANAGER));
    }

    @Test
    void shouldDropManagerRoleWithLastGroup() {
        registry.addManagedGroup(USER, GROUP_A);
        registry.addManagedGroup(USER, GROUP_B);

        registry.removeManagedGroup(USER, GROUP_A);
        assertTrue(registry.hasRole(USER, Role.GROUP_MANAGER));

        registry.removeManagedGroup(USER, GROUP_B);
        assertFalse(registry.hasRole(USER, Role.GROUP_MANAGER));
    }

    @Test
    void shouldLiftGroupBlacklistWhenMadeManager() {
        registry.blacklistInGroup(USER, GROUP_A);

        registry.addManagedGroup(USER, GROUP_A);

        assertFalse(registry.isBlacklistedInGroup(USER, GROUP_A));
        assertTrue(registry.managesGroup(USER, GROUP_A));
    }

    @Test
    void shouldDropManagementWhenBlacklistedInGroup() {
        registry.addManagedGroup(USER, GROUP_A);

        registry.blacklistInGroup(USER, GROUP_A);

        assertFalse(registry.managesGroup(USER, GROUP_A));
        assertFalse(registry.hasRole(USER, Role.GROUP_MANAGER));
    }

    @Test
    void shouldClearManagedGroupsWhenManagerRoleRevoked() {
        registry.addManagedGroup(USER, GROUP_A);

        registry.revokeRole(USER, "group_manager");

        assertTrue(registry.entry(USER).getManagedGroups().isEmpty());
    }

    // ===== Role block selection =====

    @Test
    void shouldPickRoleBlockForScope() {
        registry.addManagedGroup(USER, GROUP_A);
        registry.blacklistInGroup("40004", GROUP_A);

        assertEquals(RoleType.MANAGER, registry.roleTypeFor(USER, ChannelType.GROUP, GROUP_A));
        assertEquals(RoleType.USER, registry.roleTypeFor(USER, ChannelType.GROUP, GROUP_B));
        assertEquals(RoleType.USER, registry.roleTypeFor(USER, ChannelType.PRIVATE, null));
        assertEquals(RoleType.BLACKLISTED, registry.roleTypeFor("40004", ChannelType.GROUP, GROUP_A));
        assertEquals(RoleType.USER, registry.roleTypeFor("40004", ChannelType.PRIVATE, null));
        assertEquals(RoleType.MANAGER, registry.roleTypeFor(ADMIN, ChannelType.GROUP, GROUP_B));
    }

    // ===== Field replacement =====

    @Test
    void shouldReplaceEntryFields() {
        registry.replaceEntryField(USER, "managed_groups", List.of(GROUP_A, " ", GROUP_B));
        registry.replaceEntryField(USER, "roles", List.of("group_manager"));

        assertTrue(registry.managesGroup(USER, GROUP_A));
        assertTrue(registry.managesGroup(USER, GROUP_B));
    }

    @Test
    void shouldProtectAdminInFieldReplacement() {
        assertThrows(IllegalArgumentException.class,
                () -> registry.replaceEntryField(ADMIN, "roles", List.of("private_user")));
        assertThrows(IllegalArgumentException.class,
                () -> registry.replaceEntryField(ADMIN, "blacklisted_in", List.of(GROUP_A)));
        assertThrows(IllegalArgumentException.class,
                () -> registry.replaceEntryField(USER, "nicknames", List.of("x")));
    }
}
