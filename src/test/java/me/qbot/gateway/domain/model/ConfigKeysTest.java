package me.qbot.gateway.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigKeysTest {

    @Test
    void shouldGateEverySettingsSwitchOnItself() {
        ConfigKey key = ConfigKeys.parse(ConfigKeys.ENABLE_AI_CHAT);

        assertTrue(key.isSettingsKey());
        assertEquals(ConfigKeys.ENABLE_AI_CHAT, key.getVetoSwitch());
        assertEquals(ValueType.BOOLEAN, key.getType());
        assertEquals(true, key.getFallback());
    }

    @Test
    void shouldNotGateRateLimit() {
        ConfigKey key = ConfigKeys.parse(ConfigKeys.MESSAGE_RATE_LIMIT);

        assertFalse(key.isVetoed());
        assertEquals(30, key.getFallback());
    }

    @Test
    void shouldMarkIdentityKeysGlobalAndRequired() {
        ConfigKey qqNo = ConfigKeys.parse(ConfigKeys.QQ_NO);
        ConfigKey apiKeys = ConfigKeys.parse(ConfigKeys.API_KEYS);

        assertTrue(qqNo.isGlobalOnly());
        assertTrue(qqNo.isRequired());
        assertFalse(apiKeys.isGlobalOnly());
        assertTrue(apiKeys.isRequired());
    }

    @Test
    void shouldListRequiredKeys() {
        List<String> required = ConfigKeys.requiredKeys().stream()
                .map(ConfigKey::getPath)
                .collect(Collectors.toList());

        assertEquals(List.of(ConfigKeys.API_KEYS, ConfigKeys.QQ_NO, ConfigKeys.ADMIN_QQ), required);
    }

    @Test
    void shouldParseDynamicEventKeys() {
        ConfigKey probability = ConfigKeys.parse("random_events.fortune.probability");
        ConfigKey repeatEnabled = ConfigKeys.parse("random_events.repeat.enabled");
        ConfigKey otherEnabled = ConfigKeys.parse("random_events.fortune.enabled");

        assertEquals(ValueType.DOUBLE, probability.getType());
        assertEquals(0.0, probability.getFallback());
        assertEquals(ConfigKeys.ENABLE_REPEAT_EVENT, repeatEnabled.getVetoSwitch());
        assertNull(otherEnabled.getVetoSwitch());
    }

    @Test
    void shouldParseProxyKeysAsGlobal() {
        ConfigKey proxy = ConfigKeys.parse("proxy.http");

        assertTrue(proxy.isGlobalOnly());
        assertEquals(ValueType.STRING, proxy.getType());
    }

    @Test
    void shouldRejectUnknownKeys() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> ConfigKeys.parse("settings.enable_teleport"));

        assertTrue(error.getMessage().contains("Unknown configuration key"));
        assertFalse(ConfigKeys.isKnown("random_events.repeat.colour"));
        assertFalse(ConfigKeys.isKnown("random_events..enabled"));
        assertTrue(ConfigKeys.isKnown("gemini.generation_config.top_k"));
    }

    @Test
    void shouldTreatPlaceholderAsMissingForRequiredKeys() {
        ConfigDocument document = ConfigDefaults.create();

        assertNull(ConfigKeys.parse(ConfigKeys.QQ_NO).readTop(document));
        assertNull(ConfigKeys.parse(ConfigKeys.API_KEYS).readTop(document));
        assertEquals(ConfigDefaults.DEFAULT_VOICE, ConfigKeys.parse(ConfigKeys.VOICE).readTop(document));
    }

    @Test
    void shouldRejectProbabilityOutsideUnitRange() {
        ConfigKey probability = ConfigKeys.parse("random_events.repeat.probability");

        assertEquals(0.25, probability.coerce("0.25"));
        assertThrows(IllegalArgumentException.class, () -> probability.coerce("1.5"));
    }

    @Test
    void shouldRefuseScopedWriteOfGlobalKey() {
        ConfigKey cqhttpUrl = ConfigKeys.parse("qq_bot.cqhttp_url");

        assertThrows(IllegalArgumentException.class,
                () -> cqhttpUrl.writeTo(new ConfigDocument.RoleBlock(), "http://example"));
    }
}
