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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The layered gateway document. Top-level sections hold the global values;
 * {@code group} and {@code private} hold per-scope role blocks that override
 * them. Persisted as {@code config.json} with snake_case keys.
 *
 * <p>
 * Leaf fields are nullable everywhere: {@code null} means "not set at this
 * level" and the resolver moves on to the next one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConfigDocument {

    @Builder.Default
    private QqBotConfig qqBot = new QqBotConfig();

    @Builder.Default
    private GeminiConfig gemini = new GeminiConfig();

    @Builder.Default
    private LogConfig log = new LogConfig();

    @Builder.Default
    private SettingsBlock settings = new SettingsBlock();

    @Builder.Default
    private Map<String, RandomEventConfig> randomEvents = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, String> proxy = new LinkedHashMap<>();

    @Builder.Default
    private PermissionsConfig permissions = new PermissionsConfig();

    @Builder.Default
    private Map<String, ScopeNode> group = new LinkedHashMap<>();

    @JsonProperty("private")
    @Builder.Default
    private PrivateScope privateScope = new PrivateScope();

    @Builder.Default
    private ServiceConfig service = new ServiceConfig();

    /**
     * View of the top-level sections shaped as a role block. The view shares
     * the document's section objects, so writes through it land in the
     * document once {@link #ensureSections()} has run.
     */
    public RoleBlock topLevelBlock() {
        return RoleBlock.builder()
                .settings(settings)
                .randomEvents(randomEvents)
                .gemini(gemini)
                .qqBot(qqBot)
                .build();
    }

    public void ensureSections() {
        if (qqBot == null) {
            qqBot = new QqBotConfig();
        }
        if (gemini == null) {
            gemini = new GeminiConfig();
        }
        if (log == null) {
            log = new LogConfig();
        }
        if (settings == null) {
            settings = new SettingsBlock();
        }
        if (randomEvents == null) {
            randomEvents = new LinkedHashMap<>();
        }
        if (proxy == null) {
            proxy = new LinkedHashMap<>();
        }
        if (permissions == null) {
            permissions = new PermissionsConfig();
        }
        if (permissions.getUsers() == null) {
            permissions.setUsers(new LinkedHashMap<>());
        }
        if (group == null) {
            group = new LinkedHashMap<>();
        }
        if (privateScope == null) {
            privateScope = new PrivateScope();
        }
        if (service == null) {
            service = new ServiceConfig();
        }
    }

    public ScopeNode defaultGroupNode() {
        return group != null ? group.get(ResolutionContext.DEFAULT_NODE) : null;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class QqBotConfig {
        private String qqNo;
        private String adminQq;
        private Boolean autoConfirm;
        private String cqhttpUrl;
        private String imagePath;
        private String voicePath;
        private String voice;
        private Integer maxLength;
        private String botName;
        private String groupKeyword;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class GeminiConfig {
        private List<String> apiKeys;
        private String model;
        private String systemPrompt;
        private Map<String, String> safetySettings;
        private GenerationConfig generationConfig;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class GenerationConfig {
        private Double topP;
        private Integer topK;
        private Double temperature;
        private Integer maxOutputTokens;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class LogConfig {
        private String level;
        private String filePath;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ServiceConfig {
        private String host;
        private Integer port;
        private Boolean useReloader;
    }

    /**
     * Feature switches and the hourly message budget. At the top level the
     * {@code enable_*} flags are global vetoes.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SettingsBlock {
        private Boolean enablePersonalityRetrain;
        private Boolean enableHistoryEdit;
        private Boolean enableAiChat;
        private Boolean enableChatCommands;
        private Boolean enableRandomEvents;
        private Boolean enableRepeatEvent;
        private Integer messageRateLimit;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RandomEventConfig {
        private String id;
        private String name;
        private String description;
        private Boolean enabled;
        private Double probability;
        /** Personal cooldown in seconds; -1 selects the shared cooldown. */
        private Integer minInterval;
        private Integer sharedMinInterval;
    }

    /**
     * Overrides for one role within one scope. Specific-user overrides use
     * the same shape.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RoleBlock {
        private SettingsBlock settings;
        private Map<String, RandomEventConfig> randomEvents;
        private GeminiConfig gemini;
        private QqBotConfig qqBot;
    }

    /**
     * A {@code group.<id>} or {@code group.__default__} node, also used as
     * {@code private.__default__}.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ScopeNode {
        private RoleBlock user;
        private RoleBlock manager;
        private RoleBlock blacklisted;

        @JsonProperty("__specific_user__")
        private Map<String, RoleBlock> specificUsers;

        private SettingsBlock settings;

        public RoleBlock roleBlock(RoleType roleType) {
            switch (roleType) {
            case MANAGER:
                return manager;
            case BLACKLISTED:
                return blacklisted;
            case USER:
            default:
                return user;
            }
        }

        public void putRoleBlock(RoleType roleType, RoleBlock block) {
            switch (roleType) {
            case MANAGER:
                manager = block;
                break;
            case BLACKLISTED:
                blacklisted = block;
                break;
            case USER:
            default:
                user = block;
                break;
            }
        }

        public RoleBlock specificUser(String userId) {
            return specificUsers != null ? specificUsers.get(userId) : null;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PrivateScope {
        @JsonProperty("__default__")
        private ScopeNode defaults;

        @JsonProperty("__specific_user__")
        private Map<String, RoleBlock> specificUsers;

        public RoleBlock specificUser(String userId) {
            return specificUsers != null ? specificUsers.get(userId) : null;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PermissionsConfig {
        @Builder.Default
        private Map<String, PermissionEntry> users = new LinkedHashMap<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class PermissionEntry {
        @Builder.Default
        private Set<Role> roles = new LinkedHashSet<>();
        @Builder.Default
        private Set<String> managedGroups = new LinkedHashSet<>();
        @Builder.Default
        private Set<String> blacklistedIn = new LinkedHashSet<>();

        @JsonIgnore
        public boolean isEmpty() {
            return (roles == null || roles.isEmpty())
                    && (managedGroups == null || managedGroups.isEmpty())
                    && (blacklistedIn == null || blacklistedIn.isEmpty());
        }

        public PermissionEntry copy() {
            return PermissionEntry.builder()
                    .roles(roles != null ? new LinkedHashSet<>(roles) : new LinkedHashSet<>())
                    .managedGroups(managedGroups != null ? new LinkedHashSet<>(managedGroups) : new LinkedHashSet<>())
                    .blacklistedIn(blacklistedIn != null ? new LinkedHashSet<>(blacklistedIn) : new LinkedHashSet<>())
                    .build();
        }
    }
}
