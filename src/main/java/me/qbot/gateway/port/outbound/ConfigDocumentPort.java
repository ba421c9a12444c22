package me.qbot.gateway.port.outbound;

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

import me.qbot.gateway.domain.model.ConfigDocument;

import java.util.concurrent.CompletableFuture;

/**
 * Persistence contract for the gateway document.
 */
public interface ConfigDocumentPort {

    /**
     * Load the document, merged over the compiled-in defaults. Writes the
     * defaults back when no document exists yet.
     *
     * @throws me.qbot.gateway.domain.exception.MalformedDocumentException
     *             if the stored document cannot be parsed
     * @throws me.qbot.gateway.domain.exception.ConfigKeyMissingException
     *             if an identity or credential key is still unset
     */
    ConfigDocument load();

    /**
     * Atomically replace the stored document.
     */
    CompletableFuture<Void> save(ConfigDocument document);
}
