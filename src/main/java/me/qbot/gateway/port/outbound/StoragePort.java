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

import java.util.concurrent.CompletableFuture;

/**
 * Port for file operations inside the local workspace, organized by
 * directory ({@code config}, ...).
 */
public interface StoragePort {

    /**
     * Read text content from file.
     *
     * @return the content, or {@code null} when the file does not exist
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Atomically replace a file's content.
     *
     * <p>
     * The content is written to a {@code .tmp} sibling and forced to disk. When
     * {@code backup} is set the previous version is copied to {@code .bak}. The
     * temporary file is then moved over the target in one step.
     *
     * @param directory
     *            subdirectory
     * @param path
     *            relative path within directory
     * @param content
     *            text content to write
     * @param backup
     *            if true, preserve previous version as .bak
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
