package me.qbot.gateway;


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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the QQ bot gateway policy engine.
 *
 * <p>
 * The engine decides, for every inbound QQ message, which configuration values
 * apply, whether the sender may proceed, and whether a random event fires.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Cascading configuration</b> - six-level resolution from specific user
 * down to the top-level document, with a global veto for feature switches</li>
 * <li><b>Roles</b> - admin, group managers and per-group or global
 * blacklists</li>
 * <li><b>Rate limiting</b> - hourly message quota per user and scope</li>
 * <li><b>Random events</b> - probability draws guarded by personal and shared
 * cooldowns</li>
 * <li><b>Settings commands</b> - privilege-checked writes that persist to
 * {@code config.json}</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → SettingsCommandHandler
 * Domain Layer       → PolicyEngine, ConfigResolver, PermissionRegistry
 * Infrastructure     → JsonConfigDocumentAdapter, LocalStorageAdapter
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * Process settings live in {@code application.properties} under the
 * {@code bot.*} prefix. The policy document itself is {@code config.json} in
 * the workspace config directory.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BotApplication {

    public static void main(String[] args) {
        SpringApplication.run(BotApplication.class, args);
    }

}
