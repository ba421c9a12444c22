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
import me.qbot.gateway.domain.model.ConfigDocument.LogConfig;
import me.qbot.gateway.domain.model.ConfigDocument.PermissionsConfig;
import me.qbot.gateway.domain.model.ConfigDocument.PrivateScope;
import me.qbot.gateway.domain.model.ConfigDocument.QqBotConfig;
import me.qbot.gateway.domain.model.ConfigDocument.RandomEventConfig;
import me.qbot.gateway.domain.model.ConfigDocument.RoleBlock;
import me.qbot.gateway.domain.model.ConfigDocument.ScopeNode;
import me.qbot.gateway.domain.model.ConfigDocument.ServiceConfig;
import me.qbot.gateway.domain.model.ConfigDocument.SettingsBlock;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiled-in default document and the per-leaf fallback constants.
 */
public final class ConfigDefaults {

    public static final String REPEAT_EVENT = "repeat";

    public static final String DEFAULT_CQHTTP_URL = "http://127.0.0.1:5700";
    public static final String DEFAULT_IMAGE_PATH = "./data/images";
    public static final String DEFAULT_VOICE_PATH = "./data/voices";
    public static final String DEFAULT_VOICE = "zh-CN-YunxiNeural";
    public static final int DEFAULT_MAX_LENGTH = 2000;
    public static final String DEFAULT_BOT_NAME = "结衣";

    public static final String DEFAULT_MODEL = "gemini-1.5-pro";
    public static final String DEFAULT_SYSTEM_PROMPT = "你是一只超级傲娇的猫娘，名字是结衣。你喜欢嘲讽和吐槽，"
            + "说话的时候喜欢带喵~你充满天马行空的想法，总是有意想不到的点子。";
    public static final String DEFAULT_SAFETY_THRESHOLD = "BLOCK_NONE";
    public static final List<String> SAFETY_CATEGORIES = List.of(
            "HARM_CATEGORY_HATE_SPEECH",
            "HARM_CATEGORY_SEXUALLY_EXPLICIT",
            "HARM_CATEGORY_DANGEROUS_CONTENT",
            "HARM_CATEGORY_HARASSMENT");
    public static final double DEFAULT_TOP_P = 1.0;
    public static final int DEFAULT_TOP_K = 1;
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_OUTPUT_TOKENS = 2000;

    public static final String DEFAULT_LOG_LEVEL = "INFO";
    public static final String DEFAULT_LOG_FILE = "./logs/app.log";

    public static final String DEFAULT_SERVICE_HOST = "127.0.0.1";
    public static final int DEFAULT_SERVICE_PORT = 5555;

    public static final boolean DEFAULT_ENABLE_AI_CHAT = true;
    public static final boolean DEFAULT_ENABLE_CHAT_COMMANDS = true;
    public static final int DEFAULT_MESSAGE_RATE_LIMIT = 30;

    public static final double DEFAULT_EVENT_PROBABILITY = 0.0;
    public static final int DEFAULT_EVENT_MIN_INTERVAL = -1;
    public static final int DEFAULT_EVENT_SHARED_MIN_INTERVAL = 0;

    private ConfigDefaults() {
    }

    public static Map<String, String> defaultSafetySettings() {
        Map<String, String> settings = new LinkedHashMap<>();
        for (String category : SAFETY_CATEGORIES) {
            settings.put(category, DEFAULT_SAFETY_THRESHOLD);
        }
        return settings;
    }

    /**
     * Builds a fresh default document. Identity and credential values are the
     * {@value ConfigKey#REQUIRED_PLACEHOLDER} placeholder and must be replaced
     * before the gateway can start.
     */
    public static ConfigDocument create() {
        List<String> apiKeys = new ArrayList<>();
        apiKeys.add(ConfigKey.REQUIRED_PLACEHOLDER);

        Map<String, RandomEventConfig> events = new LinkedHashMap<>();
        events.put(REPEAT_EVENT, RandomEventConfig.builder()
                .id(REPEAT_EVENT)
                .name("随机复读")
                .description("随机复读群内消息")
                .enabled(false)
                .probability(0.05)
                .minInterval(-1)
                .sharedMinInterval(60)
                .build());

        Map<String, ScopeNode> groups = new LinkedHashMap<>();
        groups.put(ResolutionContext.DEFAULT_NODE, ScopeNode.builder()
                .user(roleDefaults(20, 0.03, 60))
                .manager(roleDefaults(100, 0.01, 30))
                .blacklisted(RoleBlock.builder()
                        .settings(SettingsBlock.builder()
                                .enableAiChat(false)
                                .enableChatCommands(false)
                                .enableRandomEvents(false)
                                .build())
                        .build())
                .build());

        ScopeNode privateDefaults = ScopeNode.builder()
                .user(RoleBlock.builder()
                        .settings(SettingsBlock.builder().messageRateLimit(50).build())
                        .randomEvents(new LinkedHashMap<>())
                        .build())
                .build();

        return ConfigDocument.builder()
                .qqBot(QqBotConfig.builder()
                        .qqNo(ConfigKey.REQUIRED_PLACEHOLDER)
                        .adminQq(ConfigKey.REQUIRED_PLACEHOLDER)
                        .autoConfirm(false)
                        .cqhttpUrl(DEFAULT_CQHTTP_URL)
                        .imagePath(DEFAULT_IMAGE_PATH)
                        .voicePath(DEFAULT_VOICE_PATH)
                        .voice(DEFAULT_VOICE)
                        .maxLength(DEFAULT_MAX_LENGTH)
                        .botName(DEFAULT_BOT_NAME)
                        .groupKeyword(DEFAULT_BOT_NAME)
                        .build())
                .gemini(GeminiConfig.builder()
                        .apiKeys(apiKeys)
                        .model(DEFAULT_MODEL)
                        .systemPrompt(DEFAULT_SYSTEM_PROMPT)
                        .safetySettings(defaultSafetySettings())
                        .generationConfig(GenerationConfig.builder()
                                .topP(DEFAULT_TOP_P)
                                .topK(DEFAULT_TOP_K)
                                .temperature(DEFAULT_TEMPERATURE)
                                .maxOutputTokens(DEFAULT_MAX_OUTPUT_TOKENS)
                                .build())
                        .build())
                .log(LogConfig.builder()
                        .level(DEFAULT_LOG_LEVEL)
                        .filePath(DEFAULT_LOG_FILE)
                        .build())
                .settings(SettingsBlock.builder()
                        .enablePersonalityRetrain(false)
                        .enableHistoryEdit(false)
                        .enableAiChat(DEFAULT_ENABLE_AI_CHAT)
                        .enableChatCommands(DEFAULT_ENABLE_CHAT_COMMANDS)
                        .enableRandomEvents(false)
                        .enableRepeatEvent(false)
                        .messageRateLimit(DEFAULT_MESSAGE_RATE_LIMIT)
                        .build())
                .randomEvents(events)
                .proxy(new LinkedHashMap<>())
                .permissions(new PermissionsConfig())
                .group(groups)
                .privateScope(PrivateScope.builder().defaults(privateDefaults).build())
                .service(ServiceConfig.builder()
                        .host(DEFAULT_SERVICE_HOST)
                        .port(DEFAULT_SERVICE_PORT)
                        .useReloader(false)
                        .build())
                .build();
    }

    private static RoleBlock roleDefaults(int rateLimit, double repeatProbability, int sharedInterval) {
        Map<String, RandomEventConfig> events = new LinkedHashMap<>();
        events.put(REPEAT_EVENT, RandomEventConfig.builder()
                .probability(repeatProbability)
                .sharedMinInterval(sharedInterval)
                .minInterval(-1)
                .enabled(true)
                .build());
        return RoleBlock.builder()
                .settings(SettingsBlock.builder().messageRateLimit(rateLimit).build())
                .randomEvents(events)
                .build();
    }
}
