package me.qbot.gateway.domain.service;

import me.qbot.gateway.domain.model.ConfigDocument;
import me.qbot.gateway.domain.model.ConfigKeys;
import me.qbot.gateway.domain.model.MessagePolicy;
import me.qbot.gateway.domain.model.RateLimitResult;
import me.qbot.gateway.domain.model.ResolutionContext;
import me.qbot.gateway.domain.model.ResolutionLevel;
import me.qbot.gateway.domain.model.Role;
import me.qbot.gateway.domain.model.RoleType;
import me.qbot.gateway.infrastructure.config.AutoConfiguration;
import me.qbot.gateway.ratelimit.HourlyBucketRateLimiter;
import me.qbot.gateway.testsupport.InMemoryConfigDocumentPort;
import me.qbot.gateway.testsupport.MutableClock;
import me.qbot.gateway.testsupport.TestDocuments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolicyEngineTest {

    private static final String GROUP = "12345";
    private static final String MANAGER = "50005";
    private static final String MEMBER = "60006";
    private static final String TROLL = "66666";

    private ConfigDocument document;
    private MutableClock clock;
    private PermissionRegistry registry;
    private PolicyEngine engine;

    @BeforeEach
    void setUp() {
        document = TestDocuments.valid();
        ConfigStore store = TestDocuments.loadedStore(new InMemoryConfigDocumentPort(document));
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        registry = new PermissionRegistry(store);
        ConfigResolver resolver = new ConfigResolver(store);
        EventCooldownTracker tracker = new EventCooldownTracker(clock, () -> 0.0);
        RandomEventService randomEvents = new RandomEventService(store, resolver, registry, tracker);
        SettingsService settings = new SettingsService(store, registry, AutoConfiguration.objectMapper());
        engine = new PolicyEngine(resolver, registry, new HourlyBucketRateLimiter(clock), tracker, randomEvents,
                settings);

        registry.addManagedGroup(MANAGER, GROUP);
        registry.blacklistInGroup(TROLL, GROUP);
    }

    @Test
    void shouldEvaluateRegularMember() {
        MessagePolicy policy = engine.evaluate(ResolutionContext.group(GROUP, MEMBER));

        assertEquals(RoleType.USER, policy.getRoleType());
        assertFalse(policy.isBlacklisted());
        assertTrue(policy.isAiChatEnabled());
        assertTrue(policy.isCommandsEnabled());
        assertFalse(policy.isHistoryEditEnabled());
        assertEquals(20, policy.getMessageRateLimit());
    }

    @Test
    void shouldEvaluateManagerWithManagerBlock() {
        MessagePolicy policy = engine.evaluate(ResolutionContext.group(GROUP, MANAGER));

        assertEquals(RoleType.MANAGER, policy.getRoleType());
        assertEquals(100, policy.getMessageRateLimit());
    }

    @Test
    void shouldEvaluateScopedBlacklist() {
        MessagePolicy inGroup = engine.evaluate(ResolutionContext.group(GROUP, TROLL));
        MessagePolicy elsewhere = engine.evaluate(ResolutionContext.group("99999", TROLL));

        assertTrue(inGroup.isBlacklisted());
        assertFalse(inGroup.isAiChatEnabled());
        assertFalse(inGroup.isCommandsEnabled());
        assertFalse(elsewhere.isBlacklisted());
        assertTrue(elsewhere.isAiChatEnabled());
    }

    @Test
    void shouldEvaluatePrivateChat() {
        MessagePolicy policy = engine.evaluate(ResolutionContext.privateChat(MEMBER));

        assertEquals(RoleType.USER, policy.getRoleType());
        assertEquals(50, policy.getMessageRateLimit());
    }

    @Test
    void shouldRateLimitWithEffectiveLimit() {
        ResolutionContext member = ResolutionContext.group(GROUP, MEMBER);
        for (int i = 0; i < 20; i++) {
            assertTrue(engine.checkRate(member).isAllowed());
        }

        RateLimitResult denied = engine.checkRate(member);

        assertFalse(denied.isAllowed());
        assertTrue(engine.checkRate(ResolutionContext.group(GROUP, MANAGER)).isAllowed());
        clock.advance(Duration.ofHours(1));
        assertTrue(engine.checkRate(member).isAllowed());
    }

    @Test
    void shouldFireConfiguredEventWithSharedCooldown() {
        document.getSettings().setEnableRandomEvents(true);
        document.getSettings().setEnableRepeatEvent(true);

        assertTrue(engine.tryRandomEvent("repeat", ResolutionContext.group(GROUP, MEMBER)));
        assertFalse(engine.tryRandomEvent("repeat", ResolutionContext.group(GROUP, "60007")));

        clock.advance(Duration.ofSeconds(60));
        assertTrue(engine.tryRandomEvent("repeat", ResolutionContext.group(GROUP, "60007")));
    }

    @Test
    void shouldNotFireEventsWhenGloballyDisabled() {
        document.getSettings().setEnableRepeatEvent(true);

        assertFalse(engine.tryRandomEvent("repeat", ResolutionContext.group(GROUP, MEMBER)));
    }

    @Test
    void shouldNotFireEventsForBlacklistedUser() {
        document.getSettings().setEnableRandomEvents(true);
        document.getSettings().setEnableRepeatEvent(true);

        assertFalse(engine.tryRandomEvent("repeat", ResolutionContext.group(GROUP, TROLL)));
    }

    @Test
    void shouldTriggerWithExplicitParameters() {
        ResolutionContext member = ResolutionContext.group(GROUP, MEMBER);

        assertTrue(engine.tryRandomEvent("poke", member, 1.0, 30, 0));
        assertFalse(engine.tryRandomEvent("poke", member, 1.0, 30, 0));
    }

    @Test
    void shouldApplyManagerWriteToLaterResolution() {
        ResolutionContext member = ResolutionContext.group(GROUP, MEMBER);

        engine.setConfig("group.12345.user.settings.message_rate_limit", "5", member, MANAGER);

        assertEquals(5, engine.resolveInt(ConfigKeys.MESSAGE_RATE_LIMIT, member));
        assertEquals(ResolutionLevel.GROUP_ROLE, engine.resolve(ConfigKeys.MESSAGE_RATE_LIMIT, member).level());
    }

    @Test
    void shouldExposeRegistryQueries() {
        assertTrue(engine.managesGroup(MANAGER, GROUP));
        assertTrue(engine.isBlacklistedInGroup(TROLL, GROUP));
        assertTrue(engine.roles(TestDocuments.ADMIN_ID).contains(Role.ADMIN));
    }
}
