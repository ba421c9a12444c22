package me.qbot.gateway.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Gateway process settings, bound from application.properties under
 * {@code bot.*}. Behavioral settings live in the gateway document, not here.
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private StorageProperties storage = new StorageProperties();
    private ConfigProperties config = new ConfigProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.qbot/workspace";
    }

    @Data
    public static class ConfigProperties {
        private String directory = "config";
        private String file = "config.json";
        /** Keep the previous document as {@code config.json.bak} on every save. */
        private boolean backup = true;
    }
}
