package me.qbot.gateway.domain.service;

import me.qbot.gateway.domain.exception.ConfigKeyMissingException;
import me.qbot.gateway.domain.model.ConfigDefaults;
import me.qbot.gateway.domain.model.ConfigDocument;
import me.qbot.gateway.domain.model.ConfigDocument.QqBotConfig;
import me.qbot.gateway.domain.model.ConfigDocument.RandomEventConfig;
import me.qbot.gateway.domain.model.ConfigDocument.RoleBlock;
import me.qbot.gateway.domain.model.ConfigDocument.ScopeNode;
import me.qbot.gateway.domain.model.ConfigDocument.SettingsBlock;
import me.qbot.gateway.domain.model.ConfigKeys;
import me.qbot.gateway.domain.model.ResolutionContext;
import me.qbot.gateway.domain.model.ResolutionLevel;
import me.qbot.gateway.domain.model.ResolvedValue;
import me.qbot.gateway.domain.model.RoleType;
import me.qbot.gateway.testsupport.InMemoryConfigDocumentPort;
import me.qbot.gateway.testsupport.TestDocuments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigResolverTest {

    private static final String GROUP_ID = "12345";
    private static final String USER_ID = "777";

    private ConfigDocument document;
    private InMemoryConfigDocumentPort port;
    private ConfigStore store;
    private ConfigResolver resolver;

    @BeforeEach
    void setUp() {
        document = TestDocuments.valid();
        port = new InMemoryConfigDocumentPort(document);
        store = TestDocuments.loadedStore(port);
        resolver = new ConfigResolver(store);
    }

    private static ResolutionContext groupUser() {
        return ResolutionContext.group(GROUP_ID, USER_ID).withRoleType(RoleType.USER);
    }

    private static ResolutionContext privateUser() {
        return ResolutionContext.privateChat(USER_ID).withRoleType(RoleType.USER);
    }

    // ===== Global veto =====

    @Test
    void shouldVetoGroupOverrideWhenTopLevelSwitchIsOff() {
        document.getSettings().setEnableAiChat(false);
        document.getGroup().put(GROUP_ID, ScopeNode.builder()
                .user(RoleBlock.builder()
                        .settings(SettingsBlock.builder().enableAiChat(true).build())
                        .build())
                .build());

        ResolvedValue value = resolver.resolve("settings.enable_ai_chat", groupUser());

        assertEquals(Boolean.FALSE, value.value());
        assertEquals(ResolutionLevel.GLOBAL_VETO, value.level());
    }

    @Test
    void shouldVetoSpecificUserOverride() {
        document.getSettings().setEnableChatCommands(false);
        document.getPrivateScope().setSpecificUsers(new LinkedHashMap<>(Map.of(USER_ID, RoleBlock.builder()
                .settings(SettingsBlock.builder().enableChatCommands(true).build())
                .build())));

        assertFalse(resolver.resolveBoolean(ConfigKeys.ENABLE_CHAT_COMMANDS, privateUser()));
    }

    @Test
    void shouldLetLowerLevelDisableWhenTopLevelSwitchIsOn() {
        ResolutionContext blacklisted = ResolutionContext.group(GROUP_ID, USER_ID).withRoleType(RoleType.BLACKLISTED);

        ResolvedValue value = resolver.resolve(ConfigKeys.ENABLE_AI_CHAT, blacklisted);

        assertEquals(Boolean.FALSE, value.value());
        assertEquals(ResolutionLevel.GROUP_ROLE, value.level());
    }

    @Test
    void shouldNotVetoWhenTopLevelSwitchIsAbsent() {
        document.getSettings().setEnableHistoryEdit(null);
        document.getGroup().put(GROUP_ID, ScopeNode.builder()
                .user(RoleBlock.builder()
                        .settings(SettingsBlock.builder().enableHistoryEdit(true).build())
                        .build())
                .build());

        ResolvedValue value = resolver.resolve(ConfigKeys.ENABLE_HISTORY_EDIT, groupUser());

        assertEquals(Boolean.TRUE, value.value());
        assertEquals(ResolutionLevel.GROUP_ROLE, value.level());
    }

    @Test
    void shouldVetoRepeatEventThroughItsSwitch() {
        ResolvedValue value = resolver.resolve("random_events.repeat.enabled", groupUser());

        assertEquals(Boolean.FALSE, value.value());
        assertEquals(ResolutionLevel.GLOBAL_VETO, value.level());
    }

    // ===== Precedence =====

    @Test
    void shouldPreferSpecificUserInGroupWithoutCopyDown() {
        Map<String, RoleBlock> specific = new LinkedHashMap<>();
        specific.put(USER_ID, RoleBlock.builder()
                .settings(SettingsBlock.builder().messageRateLimit(5).build())
                .build());
        document.getGroup().put(GROUP_ID, ScopeNode.builder().specificUsers(specific).build());

        ResolvedValue value = resolver.resolve(ConfigKeys.MESSAGE_RATE_LIMIT, groupUser());

        assertEquals(5, value.asInt());
        assertEquals(ResolutionLevel.SPECIFIC_USER_GROUP, value.level());
        assertNull(store.read(doc -> doc.getGroup().get(GROUP_ID).getUser()));
        assertTrue(port.getSaves().isEmpty());
    }

    @Test
    void shouldUseRoleBlockMatchingRoleType() {
        ResolutionContext manager = ResolutionContext.group(GROUP_ID, USER_ID).withRoleType(RoleType.MANAGER);

        assertEquals(100, resolver.resolveInt(ConfigKeys.MESSAGE_RATE_LIMIT, manager));
        assertEquals(20, resolver.resolveInt(ConfigKeys.MESSAGE_RATE_LIMIT, groupUser()));
    }

    @Test
    void shouldPreferRoleBlockOverGroupSettings() {
        document.getGroup().put(GROUP_ID, ScopeNode.builder()
                .user(RoleBlock.builder()
                        .settings(SettingsBlock.builder().messageRateLimit(9).build())
                        .build())
                .settings(SettingsBlock.builder().messageRateLimit(7).build())
                .build());

        assertEquals(9, resolver.resolveInt(ConfigKeys.MESSAGE_RATE_LIMIT, groupUser()));
    }

    @Test
    void shouldReadGroupSettingsWhenRoleBlockLacksField() {
        document.getGroup().put(GROUP_ID, ScopeNode.builder()
                .user(new RoleBlock())
                .settings(SettingsBlock.builder().messageRateLimit(7).build())
                .build());

        ResolvedValue value = resolver.resolve(ConfigKeys.MESSAGE_RATE_LIMIT, groupUser());

        assertEquals(7, value.asInt());
        assertEquals(ResolutionLevel.GROUP_SETTINGS, value.level());
    }

    @Test
    void shouldResolveEachFieldIndependently() {
        document.getGroup().put(GROUP_ID, ScopeNode.builder()
                .user(RoleBlock.builder()
                        .qqBot(QqBotConfig.builder().voice("zh-CN-XiaoxiaoNeural").build())
                        .build())
                .build());

        ResolvedValue voice = resolver.resolve(ConfigKeys.VOICE, groupUser());
        ResolvedValue rate = resolver.resolve(ConfigKeys.MESSAGE_RATE_LIMIT, groupUser());
        ResolvedValue model = resolver.resolve("gemini.model", groupUser());

        assertEquals("zh-CN-XiaoxiaoNeural", voice.asString());
        assertEquals(ResolutionLevel.GROUP_ROLE, voice.level());
        assertEquals(20, rate.asInt());
        assertEquals(ResolutionLevel.GROUP_DEFAULT_ROLE, rate.level());
        assertEquals(ConfigDefaults.DEFAULT_MODEL, model.asString());
        assertEquals(ResolutionLevel.TOP_LEVEL, model.level());
    }

    @Test
    void shouldWalkPrivateLevels() {
        document.getPrivateScope().setSpecificUsers(new LinkedHashMap<>(Map.of("888", RoleBlock.builder()
                .settings(SettingsBlock.builder().messageRateLimit(3).build())
                .build())));

        ResolvedValue specific = resolver.resolve(ConfigKeys.MESSAGE_RATE_LIMIT,
                ResolutionContext.privateChat("888"));
        ResolvedValue roleDefault = resolver.resolve(ConfigKeys.MESSAGE_RATE_LIMIT, privateUser());
        ResolvedValue top = resolver.resolve(ConfigKeys.VOICE, privateUser());

        assertEquals(3, specific.asInt());
        assertEquals(ResolutionLevel.SPECIFIC_USER_PRIVATE, specific.level());
        assertEquals(50, roleDefault.asInt());
        assertEquals(ResolutionLevel.PRIVATE_DEFAULT_ROLE, roleDefault.level());
        assertEquals(ConfigDefaults.DEFAULT_VOICE, top.asString());
        assertEquals(ResolutionLevel.TOP_LEVEL, top.level());
    }

    @Test
    void shouldNotReadGroupBlocksInPrivateScope() {
        document.getGroup().put(GROUP_ID, ScopeNode.builder()
                .user(RoleBlock.builder()
                        .settings(SettingsBlock.builder().messageRateLimit(1).build())
                        .build())
                .build());

        assertEquals(50, resolver.resolveInt(ConfigKeys.MESSAGE_RATE_LIMIT, privateUser()));
    }

    // ===== Copy-down =====

    @Test
    void shouldCopyDefaultRoleBlockOnFirstTouch() {
        ResolvedValue value = resolver.resolve(ConfigKeys.MESSAGE_RATE_LIMIT, groupUser());

        assertEquals(20, value.asInt());
        assertEquals(ResolutionLevel.GROUP_ROLE, value.level());
        RoleBlock copied = store.read(doc -> doc.getGroup().get(GROUP_ID).getUser());
        assertNotNull(copied);
        assertEquals(20, copied.getSettings().getMessageRateLimit());
        assertEquals(0.03, copied.getRandomEvents().get("repeat").getProbability());
        assertEquals(1, port.getSaves().size());
    }

    @Test
    void shouldCopyDownOnlyOnce() {
        resolver.resolve(ConfigKeys.MESSAGE_RATE_LIMIT, groupUser());
        ConfigDocument afterFirst = store.snapshot();

        resolver.resolve(ConfigKeys.MESSAGE_RATE_LIMIT, groupUser());
        resolver.resolve(ConfigKeys.VOICE, groupUser());

        assertEquals(afterFirst, store.snapshot());
        assertEquals(1, port.getSaves().size());
    }

    @Test
    void shouldNotPropagateLaterDefaultEdits() {
        resolver.resolve(ConfigKeys.MESSAGE_RATE_LIMIT, groupUser());
        store.mutate(doc -> {
            doc.defaultGroupNode().getUser().getSettings().setMessageRateLimit(99);
            return null;
        });

        assertEquals(20, resolver.resolveInt(ConfigKeys.MESSAGE_RATE_LIMIT, groupUser()));
        assertEquals(99, resolver.resolveInt(ConfigKeys.MESSAGE_RATE_LIMIT,
                ResolutionContext.group("54321", USER_ID).withRoleType(RoleType.USER)));
    }

    @Test
    void shouldCopyOnlyTheRoleBlockThatWasRead() {
        resolver.resolve(ConfigKeys.MESSAGE_RATE_LIMIT, groupUser());

        ScopeNode node = store.read(doc -> doc.getGroup().get(GROUP_ID));
        assertNotNull(node.getUser());
        assertNull(node.getManager());
        assertNull(node.getBlacklisted());
    }

    @Test
    void shouldNotCopyDownForGlobalKeys() {
        ResolvedValue value = resolver.resolve(ConfigKeys.QQ_NO, groupUser());

        assertEquals(TestDocuments.BOT_ID, value.asString());
        assertEquals(ResolutionLevel.TOP_LEVEL, value.level());
        assertFalse(store.<Boolean>read(doc -> doc.getGroup().containsKey(GROUP_ID)));
    }

    @Test
    void shouldFallThroughWhenNoDefaultBlockExists() {
        document.defaultGroupNode().setManager(null);
        ResolutionContext manager = ResolutionContext.group(GROUP_ID, USER_ID).withRoleType(RoleType.MANAGER);

        ResolvedValue value = resolver.resolve(ConfigKeys.MESSAGE_RATE_LIMIT, manager);

        assertEquals(30, value.asInt());
        assertEquals(ResolutionLevel.TOP_LEVEL, value.level());
        assertFalse(store.<Boolean>read(doc -> doc.getGroup().containsKey(GROUP_ID)));
    }

    // ===== Fallbacks =====

    @Test
    void shouldFailForMissingRequiredKey() {
        store.mutate(doc -> {
            doc.getGemini().setApiKeys(List.of("REQUIRED"));
            return null;
        });

        ConfigKeyMissingException error = assertThrows(ConfigKeyMissingException.class,
                () -> resolver.resolve(ConfigKeys.API_KEYS, privateUser()));

        assertEquals(ConfigKeys.API_KEYS, error.getKeyPath());
    }

    @Test
    void shouldUseCompiledDefaultForMissingOptionalKey() {
        store.mutate(doc -> {
            doc.getGemini().setModel(null);
            return null;
        });

        ResolvedValue value = resolver.resolve("gemini.model", privateUser());

        assertEquals(ConfigDefaults.DEFAULT_MODEL, value.asString());
        assertEquals(ResolutionLevel.COMPILED_DEFAULT, value.level());
    }

    @Test
    void shouldRejectUnknownKey() {
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve("settings.enable_magic", groupUser()));
    }

    // ===== Events =====

    @Test
    void shouldMergeEventFieldsAcrossLevels() {
        document.getSettings().setEnableRepeatEvent(true);

        RandomEventConfig event = resolver.resolveEvent("repeat", groupUser());

        assertTrue(event.getEnabled());
        assertEquals(0.03, event.getProbability());
        assertEquals(-1, event.getMinInterval());
        assertEquals(60, event.getSharedMinInterval());
        assertEquals("随机复读", event.getName());
    }

    @Test
    void shouldDefaultUnknownEventFields() {
        RandomEventConfig event = resolver.resolveEvent("fortune", privateUser());

        assertFalse(event.getEnabled());
        assertEquals(0.0, event.getProbability());
        assertEquals(-1, event.getMinInterval());
        assertEquals(0, event.getSharedMinInterval());
        assertNull(event.getName());
    }
}
