package me.qbot.gateway.adapter.outbound.storage;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.qbot.gateway.infrastructure.config.BotProperties;
import me.qbot.gateway.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.CompletableFuture;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Base path configured via {@code bot.storage.local.base-path}, defaults to
 * {@code ${user.home}/.qbot/workspace}. The configuration document lives in
 * the {@code config/} subdirectory.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final String USER_HOME_TOKEN = "${user.home}";

    private final BotProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(configured.replace(USER_HOME_TOKEN, System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        try {
            Files.createDirectories(basePath.resolve(properties.getConfig().getDirectory()));
            log.info("[Storage] Workspace initialized at: {}", basePath);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create workspace directory: " + basePath, e);
        }
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = resolvePath(directory, path);
            if (!Files.exists(file)) {
                return null;
            }
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            Path target = resolvePath(directory, path);
            Path temp = target.resolveSibling(target.getFileName() + ".tmp");
            try {
                Path parent = target.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                writeAndSync(temp, content.getBytes(StandardCharsets.UTF_8));
                if (backup && Files.exists(target)) {
                    Path backupFile = target.resolveSibling(target.getFileName() + ".bak");
                    Files.copy(target, backupFile, StandardCopyOption.REPLACE_EXISTING);
                    log.debug("[Storage] Backup written: {}", backupFile);
                }
                moveIntoPlace(temp, target);
                log.debug("[Storage] Replaced {}/{}", directory, path);
            } catch (IOException e) {
                deleteQuietly(temp);
                throw new IllegalStateException("Atomic write failed: " + directory + "/" + path, e);
            }
        });
    }

    private void writeAndSync(Path file, byte[] bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        if (Files.size(file) != bytes.length) {
            throw new IOException("Verification failed: size mismatch for " + file);
        }
    }

    private void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic move not supported, using regular move");
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException cleanupEx) {
            log.warn("[Storage] Failed to clean up temp file: {}", file, cleanupEx);
        }
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }
}
