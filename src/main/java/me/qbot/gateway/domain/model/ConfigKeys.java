package me.qbot.gateway.domain.model;

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

import me.qbot.gateway.domain.model.ConfigDocument.GeminiConfig;
import me.qbot.gateway.domain.model.ConfigDocument.GenerationConfig;
import me.qbot.gateway.domain.model.ConfigDocument.QqBotConfig;
import me.qbot.gateway.domain.model.ConfigDocument.RandomEventConfig;
import me.qbot.gateway.domain.model.ConfigDocument.RoleBlock;
import me.qbot.gateway.domain.model.ConfigDocument.SettingsBlock;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Closed schema of resolvable leaf keys. Static leaves are registered once;
 * {@code random_events.<id>.<field>} and {@code proxy.<name>} are validated
 * against a fixed field set and built on demand.
 */
public final class ConfigKeys {

    public static final String SETTINGS_PREFIX = "settings.";
    public static final String RANDOM_EVENTS_PREFIX = "random_events.";
    public static final String PROXY_PREFIX = "proxy.";

    public static final String ENABLE_PERSONALITY_RETRAIN = "settings.enable_personality_retrain";
    public static final String ENABLE_HISTORY_EDIT = "settings.enable_history_edit";
    public static final String ENABLE_AI_CHAT = "settings.enable_ai_chat";
    public static final String ENABLE_CHAT_COMMANDS = "settings.enable_chat_commands";
    public static final String ENABLE_RANDOM_EVENTS = "settings.enable_random_events";
    public static final String ENABLE_REPEAT_EVENT = "settings.enable_repeat_event";
    public static final String MESSAGE_RATE_LIMIT = "settings.message_rate_limit";
    public static final String QQ_NO = "qq_bot.qq_no";
    public static final String ADMIN_QQ = "qq_bot.admin_qq";
    public static final String VOICE = "qq_bot.voice";
    public static final String API_KEYS = "gemini.api_keys";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_\\-]+");
    private static final Map<String, ConfigKey> STATIC_KEYS = new LinkedHashMap<>();
    private static final Map<String, EventField> EVENT_FIELDS = new LinkedHashMap<>();

    private record EventField(ValueType type, Object fallback,
            Function<RandomEventConfig, Object> getter, BiConsumer<RandomEventConfig, Object> setter) {
    }

    static {
        settings("enable_personality_retrain", ValueType.BOOLEAN, false, true,
                SettingsBlock::getEnablePersonalityRetrain, (s, v) -> s.setEnablePersonalityRetrain((Boolean) v));
        settings("enable_history_edit", ValueType.BOOLEAN, false, true,
                SettingsBlock::getEnableHistoryEdit, (s, v) -> s.setEnableHistoryEdit((Boolean) v));
        settings("enable_ai_chat", ValueType.BOOLEAN, ConfigDefaults.DEFAULT_ENABLE_AI_CHAT, true,
                SettingsBlock::getEnableAiChat, (s, v) -> s.setEnableAiChat((Boolean) v));
        settings("enable_chat_commands", ValueType.BOOLEAN, ConfigDefaults.DEFAULT_ENABLE_CHAT_COMMANDS, true,
                SettingsBlock::getEnableChatCommands, (s, v) -> s.setEnableChatCommands((Boolean) v));
        settings("enable_random_events", ValueType.BOOLEAN, false, true,
                SettingsBlock::getEnableRandomEvents, (s, v) -> s.setEnableRandomEvents((Boolean) v));
        settings("enable_repeat_event", ValueType.BOOLEAN, false, true,
                SettingsBlock::getEnableRepeatEvent, (s, v) -> s.setEnableRepeatEvent((Boolean) v));
        settings("message_rate_limit", ValueType.INTEGER, ConfigDefaults.DEFAULT_MESSAGE_RATE_LIMIT, false,
                SettingsBlock::getMessageRateLimit, (s, v) -> s.setMessageRateLimit((Integer) v));

        register(cascading(API_KEYS, ValueType.STRING_LIST,
                b -> read(b.getGemini(), GeminiConfig::getApiKeys),
                (b, v) -> geminiOf(b).setApiKeys(castList(v)))
                .required(true)
                .build());
        gemini("model", ValueType.STRING, ConfigDefaults.DEFAULT_MODEL,
                GeminiConfig::getModel, (g, v) -> g.setModel((String) v));
        gemini("system_prompt", ValueType.STRING, ConfigDefaults.DEFAULT_SYSTEM_PROMPT,
                GeminiConfig::getSystemPrompt, (g, v) -> g.setSystemPrompt((String) v));
        gemini("safety_settings", ValueType.STRING_MAP, ConfigDefaults.defaultSafetySettings(),
                GeminiConfig::getSafetySettings, (g, v) -> g.setSafetySettings(castMap(v)));
        generation("top_p", ValueType.DOUBLE, ConfigDefaults.DEFAULT_TOP_P,
                GenerationConfig::getTopP, (g, v) -> g.setTopP((Double) v));
        generation("top_k", ValueType.INTEGER, ConfigDefaults.DEFAULT_TOP_K,
                GenerationConfig::getTopK, (g, v) -> g.setTopK((Integer) v));
        generation("temperature", ValueType.DOUBLE, ConfigDefaults.DEFAULT_TEMPERATURE,
                GenerationConfig::getTemperature, (g, v) -> g.setTemperature((Double) v));
        generation("max_output_tokens", ValueType.INTEGER, ConfigDefaults.DEFAULT_MAX_OUTPUT_TOKENS,
                GenerationConfig::getMaxOutputTokens, (g, v) -> g.setMaxOutputTokens((Integer) v));

        globalQqBot(QQ_NO, true, null, QqBotConfig::getQqNo, (q, v) -> q.setQqNo((String) v));
        globalQqBot(ADMIN_QQ, true, null, QqBotConfig::getAdminQq, (q, v) -> q.setAdminQq((String) v));
        globalQqBot("qq_bot.cqhttp_url", false, ConfigDefaults.DEFAULT_CQHTTP_URL,
                QqBotConfig::getCqhttpUrl, (q, v) -> q.setCqhttpUrl((String) v));
        globalQqBot("qq_bot.image_path", false, ConfigDefaults.DEFAULT_IMAGE_PATH,
                QqBotConfig::getImagePath, (q, v) -> q.setImagePath((String) v));
        globalQqBot("qq_bot.voice_path", false, ConfigDefaults.DEFAULT_VOICE_PATH,
                QqBotConfig::getVoicePath, (q, v) -> q.setVoicePath((String) v));
        qqBot("auto_confirm", ValueType.BOOLEAN, false,
                QqBotConfig::getAutoConfirm, (q, v) -> q.setAutoConfirm((Boolean) v));
        qqBot("voice", ValueType.STRING, ConfigDefaults.DEFAULT_VOICE,
                QqBotConfig::getVoice, (q, v) -> q.setVoice((String) v));
        qqBot("max_length", ValueType.INTEGER, ConfigDefaults.DEFAULT_MAX_LENGTH,
                QqBotConfig::getMaxLength, (q, v) -> q.setMaxLength((Integer) v));
        qqBot("bot_name", ValueType.STRING, ConfigDefaults.DEFAULT_BOT_NAME,
                QqBotConfig::getBotName, (q, v) -> q.setBotName((String) v));
        qqBot("group_keyword", ValueType.STRING, ConfigDefaults.DEFAULT_BOT_NAME,
                QqBotConfig::getGroupKeyword, (q, v) -> q.setGroupKeyword((String) v));

        register(global("log.level", ValueType.STRING,
                d -> d.getLog().getLevel(), (d, v) -> d.getLog().setLevel((String) v))
                .fallback(ConfigDefaults.DEFAULT_LOG_LEVEL).build());
        register(global("log.file_path", ValueType.STRING,
                d -> d.getLog().getFilePath(), (d, v) -> d.getLog().setFilePath((String) v))
                .fallback(ConfigDefaults.DEFAULT_LOG_FILE).build());
        register(global("service.host", ValueType.STRING,
                d -> d.getService().getHost(), (d, v) -> d.getService().setHost((String) v))
                .fallback(ConfigDefaults.DEFAULT_SERVICE_HOST).build());
        register(global("service.port", ValueType.INTEGER,
                d -> d.getService().getPort(), (d, v) -> d.getService().setPort((Integer) v))
                .fallback(ConfigDefaults.DEFAULT_SERVICE_PORT).build());
        register(global("service.use_reloader", ValueType.BOOLEAN,
                d -> d.getService().getUseReloader(), (d, v) -> d.getService().setUseReloader((Boolean) v))
                .fallback(false).build());

        EVENT_FIELDS.put("id", new EventField(ValueType.STRING, null,
                RandomEventConfig::getId, (e, v) -> e.setId((String) v)));
        EVENT_FIELDS.put("name", new EventField(ValueType.STRING, null,
                RandomEventConfig::getName, (e, v) -> e.setName((String) v)));
        EVENT_FIELDS.put("description", new EventField(ValueType.STRING, null,
                RandomEventConfig::getDescription, (e, v) -> e.setDescription((String) v)));
        EVENT_FIELDS.put("enabled", new EventField(ValueType.BOOLEAN, false,
                RandomEventConfig::getEnabled, (e, v) -> e.setEnabled((Boolean) v)));
        EVENT_FIELDS.put("probability", new EventField(ValueType.DOUBLE, ConfigDefaults.DEFAULT_EVENT_PROBABILITY,
                RandomEventConfig::getProbability, (e, v) -> e.setProbability((Double) v)));
        EVENT_FIELDS.put("min_interval", new EventField(ValueType.INTEGER, ConfigDefaults.DEFAULT_EVENT_MIN_INTERVAL,
                RandomEventConfig::getMinInterval, (e, v) -> e.setMinInterval((Integer) v)));
        EVENT_FIELDS.put("shared_min_interval", new EventField(ValueType.INTEGER,
                ConfigDefaults.DEFAULT_EVENT_SHARED_MIN_INTERVAL,
                RandomEventConfig::getSharedMinInterval, (e, v) -> e.setSharedMinInterval((Integer) v)));
    }

    private ConfigKeys() {
    }

    /**
     * Looks up a key path in the schema.
     *
     * @throws IllegalArgumentException
     *             if the path is not a known leaf
     */
    public static ConfigKey parse(String keyPath) {
        if (keyPath == null || keyPath.isBlank()) {
            throw new IllegalArgumentException("Key path is required");
        }
        String path = keyPath.trim();
        ConfigKey key = STATIC_KEYS.get(path);
        if (key != null) {
            return key;
        }
        if (path.startsWith(RANDOM_EVENTS_PREFIX)) {
            String[] parts = path.substring(RANDOM_EVENTS_PREFIX.length()).split("\\.", -1);
            if (parts.length == 2 && IDENTIFIER.matcher(parts[0]).matches() && EVENT_FIELDS.containsKey(parts[1])) {
                return eventKey(parts[0], parts[1]);
            }
        }
        if (path.startsWith(PROXY_PREFIX)) {
            String name = path.substring(PROXY_PREFIX.length());
            if (IDENTIFIER.matcher(name).matches()) {
                return proxyKey(name);
            }
        }
        throw new IllegalArgumentException("Unknown configuration key: " + keyPath);
    }

    public static boolean isKnown(String keyPath) {
        try {
            parse(keyPath);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public static List<ConfigKey> requiredKeys() {
        List<ConfigKey> required = new ArrayList<>();
        for (ConfigKey key : STATIC_KEYS.values()) {
            if (key.isRequired()) {
                required.add(key);
            }
        }
        return required;
    }

    public static String eventKeyPath(String eventId, String field) {
        return RANDOM_EVENTS_PREFIX + eventId + "." + field;
    }

    private static ConfigKey eventKey(String eventId, String fieldName) {
        EventField field = EVENT_FIELDS.get(fieldName);
        String path = eventKeyPath(eventId, fieldName);
        String vetoSwitch = "enabled".equals(fieldName) && ConfigDefaults.REPEAT_EVENT.equals(eventId)
                ? ENABLE_REPEAT_EVENT
                : null;
        return cascading(path, field.type(),
                b -> {
                    Map<String, RandomEventConfig> events = b.getRandomEvents();
                    return read(events != null ? events.get(eventId) : null, field.getter());
                },
                (b, v) -> {
                    if (b.getRandomEvents() == null) {
                        b.setRandomEvents(new LinkedHashMap<>());
                    }
                    field.setter().accept(b.getRandomEvents().computeIfAbsent(eventId, id -> new RandomEventConfig()), v);
                })
                .fallback(field.fallback())
                .vetoSwitch(vetoSwitch)
                .build();
    }

    private static ConfigKey proxyKey(String name) {
        return global(PROXY_PREFIX + name, ValueType.STRING,
                d -> d.getProxy() != null ? d.getProxy().get(name) : null,
                (d, v) -> d.getProxy().put(name, (String) v))
                .build();
    }

    private static void settings(String field, ValueType type, Object fallback, boolean gate,
            Function<SettingsBlock, Object> getter, BiConsumer<SettingsBlock, Object> setter) {
        String path = SETTINGS_PREFIX + field;
        register(cascading(path, type,
                b -> read(b.getSettings(), getter),
                (b, v) -> setter.accept(settingsOf(b), v))
                .fallback(fallback)
                .vetoSwitch(gate ? path : null)
                .settingsReader(getter)
                .settingsWriter(setter)
                .build());
    }

    private static void gemini(String field, ValueType type, Object fallback,
            Function<GeminiConfig, Object> getter, BiConsumer<GeminiConfig, Object> setter) {
        register(cascading("gemini." + field, type,
                b -> read(b.getGemini(), getter),
                (b, v) -> setter.accept(geminiOf(b), v))
                .fallback(fallback)
                .build());
    }

    private static void generation(String field, ValueType type, Object fallback,
            Function<GenerationConfig, Object> getter, BiConsumer<GenerationConfig, Object> setter) {
        register(cascading("gemini.generation_config." + field, type,
                b -> b.getGemini() != null ? read(b.getGemini().getGenerationConfig(), getter) : null,
                (b, v) -> {
                    GeminiConfig gemini = geminiOf(b);
                    if (gemini.getGenerationConfig() == null) {
                        gemini.setGenerationConfig(new GenerationConfig());
                    }
                    setter.accept(gemini.getGenerationConfig(), v);
                })
                .fallback(fallback)
                .build());
    }

    private static void qqBot(String field, ValueType type, Object fallback,
            Function<QqBotConfig, Object> getter, BiConsumer<QqBotConfig, Object> setter) {
        register(cascading("qq_bot." + field, type,
                b -> read(b.getQqBot(), getter),
                (b, v) -> setter.accept(qqBotOf(b), v))
                .fallback(fallback)
                .build());
    }

    private static void globalQqBot(String path, boolean required, Object fallback,
            Function<QqBotConfig, Object> getter, BiConsumer<QqBotConfig, Object> setter) {
        register(global(path, ValueType.STRING,
                d -> read(d.getQqBot(), getter),
                (d, v) -> setter.accept(d.getQqBot(), v))
                .required(required)
                .fallback(fallback)
                .build());
    }

    private static ConfigKey.ConfigKeyBuilder cascading(String path, ValueType type,
            Function<RoleBlock, Object> reader, BiConsumer<RoleBlock, Object> writer) {
        return ConfigKey.builder()
                .path(path)
                .type(type)
                .blockReader(reader)
                .blockWriter(writer)
                .documentReader(document -> reader.apply(document.topLevelBlock()))
                .documentWriter((document, value) -> {
                    document.ensureSections();
                    writer.accept(document.topLevelBlock(), value);
                });
    }

    private static ConfigKey.ConfigKeyBuilder global(String path, ValueType type,
            Function<ConfigDocument, Object> reader, BiConsumer<ConfigDocument, Object> writer) {
        return ConfigKey.builder()
                .path(path)
                .type(type)
                .globalOnly(true)
                .documentReader(reader)
                .documentWriter((document, value) -> {
                    document.ensureSections();
                    writer.accept(document, value);
                });
    }

    private static void register(ConfigKey key) {
        STATIC_KEYS.put(key.getPath(), key);
    }

    private static <T> Object read(T section, Function<T, Object> getter) {
        return section != null ? getter.apply(section) : null;
    }

    private static SettingsBlock settingsOf(RoleBlock block) {
        if (block.getSettings() == null) {
            block.setSettings(new SettingsBlock());
        }
        return block.getSettings();
    }

    private static GeminiConfig geminiOf(RoleBlock block) {
        if (block.getGemini() == null) {
            block.setGemini(new GeminiConfig());
        }
        return block.getGemini();
    }

    private static QqBotConfig qqBotOf(RoleBlock block) {
        if (block.getQqBot() == null) {
            block.setQqBot(new QqBotConfig());
        }
        return block.getQqBot();
    }

    @SuppressWarnings("unchecked")
    private static List<String> castList(Object value) {
        return (List<String>) value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> castMap(Object value) {
        return (Map<String, String>) value;
    }
}
