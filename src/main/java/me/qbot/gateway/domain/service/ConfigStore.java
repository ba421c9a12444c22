package me.qbot.gateway.domain.service;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.qbot.gateway.domain.exception.ConcurrentMutationConflictException;
import me.qbot.gateway.domain.model.ConfigDocument;
import me.qbot.gateway.domain.model.ConfigDocument.RoleBlock;
import me.qbot.gateway.domain.model.ConfigDocument.ScopeNode;
import me.qbot.gateway.domain.model.ResolutionContext;
import me.qbot.gateway.domain.model.RoleType;
import me.qbot.gateway.port.outbound.ConfigDocumentPort;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Sole owner of the gateway document.
 *
 * <p>
 * All access goes through {@link #read(Function)} and
 * {@link #mutate(Function)}, which run under one coarse read/write lock.
 * Every committed mutation is copied while the write lock is held and handed
 * to {@link ConfigDocumentPort#save(ConfigDocument)} on a sequential chain
 * after the lock is released, so disk I/O never blocks resolution. Saves are
 * version-stamped; a snapshot older than one already handed to the port is
 * dropped, whether or not that newer save succeeded.
 */
@Service
@Slf4j
public class ConfigStore {

    private final ConfigDocumentPort documentPort;
    private final ObjectMapper objectMapper;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Object loadMonitor = new Object();
    private final Object saveMonitor = new Object();
    private final AtomicLong attemptedVersion = new AtomicLong();
    private final AtomicLong persistedVersion = new AtomicLong();

    private volatile ConfigDocument document;
    private long version;
    private CompletableFuture<Void> pendingSave = CompletableFuture.completedFuture(null);

    public ConfigStore(ConfigDocumentPort documentPort, ObjectMapper objectMapper) {
        this.documentPort = documentPort;
        this.objectMapper = objectMapper;
    }

    /**
     * Load (or reload) the document from storage. Errors propagate: a
     * malformed document or a missing identity key is fatal.
     */
    public void load() {
        ConfigDocument loaded = documentPort.load();
        lock.writeLock().lock();
        try {
            document = loaded;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[Config] Document ready ({} groups, {} permission entries)",
                loaded.getGroup().size(), loaded.getPermissions().getUsers().size());
    }

    public <T> T read(Function<ConfigDocument, T> reader) {
        ensureLoaded();
        lock.readLock().lock();
        try {
            return reader.apply(document);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Apply a mutation under the write lock and schedule a save.
     */
    public <T> T mutate(Function<ConfigDocument, T> mutation) {
        ensureLoaded();
        T result;
        Snapshot snapshot;
        lock.writeLock().lock();
        try {
            result = mutation.apply(document);
            snapshot = snapshotLocked();
        } finally {
            lock.writeLock().unlock();
        }
        scheduleSave(snapshot);
        return result;
    }

    /**
     * Apply a mutation that reports whether it changed anything; a save is
     * scheduled only when it did.
     */
    public boolean apply(Predicate<ConfigDocument> mutation) {
        ensureLoaded();
        Snapshot snapshot = null;
        boolean changed;
        lock.writeLock().lock();
        try {
            changed = mutation.test(document);
            if (changed) {
                snapshot = snapshotLocked();
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (snapshot != null) {
            scheduleSave(snapshot);
        }
        return changed;
    }

    /**
     * Copy {@code group.__default__.<role>} into {@code group.<groupId>.<role>}
     * if the group has no block for that role yet. The presence check is
     * repeated under the write lock, so concurrent first touches copy once.
     *
     * @return true if a block was copied
     */
    public boolean materializeRoleBlock(String groupId, RoleType roleType) {
        if (read(doc -> hasRoleBlock(doc, groupId, roleType))) {
            return false;
        }
        return apply(doc -> copyDown(doc, groupId, roleType));
    }

    /**
     * Deep copy of the current document.
     */
    public ConfigDocument snapshot() {
        return read(doc -> objectMapper.convertValue(doc, ConfigDocument.class));
    }

    public long getVersion() {
        lock.readLock().lock();
        try {
            return version;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Wait for every scheduled save to finish.
     */
    @PreDestroy
    public void flush() {
        CompletableFuture<Void> tail;
        synchronized (saveMonitor) {
            tail = pendingSave;
        }
        tail.join();
        log.debug("[Config] Pending saves flushed (version {})", persistedVersion.get());
    }

    private void ensureLoaded() {
        if (document == null) {
            synchronized (loadMonitor) {
                if (document == null) {
                    load();
                }
            }
        }
    }

    private boolean hasRoleBlock(ConfigDocument doc, String groupId, RoleType roleType) {
        ScopeNode node = doc.getGroup().get(groupId);
        return node != null && node.roleBlock(roleType) != null;
    }

    private boolean copyDown(ConfigDocument doc, String groupId, RoleType roleType) {
        if (hasRoleBlock(doc, groupId, roleType)) {
            return false;
        }
        ScopeNode defaults = doc.defaultGroupNode();
        RoleBlock source = defaults != null ? defaults.roleBlock(roleType) : null;
        if (source == null) {
            log.debug("[Config] No group.{}.{} to copy into group {}", ResolutionContext.DEFAULT_NODE,
                    roleType.getToken(), groupId);
            return false;
        }
        ScopeNode node = doc.getGroup().computeIfAbsent(groupId, id -> new ScopeNode());
        node.putRoleBlock(roleType, objectMapper.convertValue(source, RoleBlock.class));
        log.info("[Config] Copied group.{}.{} to group.{}.{}", ResolutionContext.DEFAULT_NODE,
                roleType.getToken(), groupId, roleType.getToken());
        return true;
    }

    private Snapshot snapshotLocked() {
        version++;
        return new Snapshot(version, objectMapper.convertValue(document, ConfigDocument.class));
    }

    void scheduleSave(Snapshot snapshot) {
        synchronized (saveMonitor) {
            pendingSave = pendingSave
                    .handle((ignored, error) -> (Void) null)
                    .thenCompose(ignored -> persist(snapshot));
        }
    }

    private CompletableFuture<Void> persist(Snapshot snapshot) {
        long newest = attemptedVersion.getAndAccumulate(snapshot.version(), Math::max);
        if (snapshot.version() <= newest) {
            log.error("[Config] Dropping stale save", new ConcurrentMutationConflictException(
                    "Snapshot v" + snapshot.version() + " is older than attempted v" + newest));
            return CompletableFuture.completedFuture(null);
        }
        try {
            return documentPort.save(snapshot.document())
                    .thenRun(() -> {
                        persistedVersion.accumulateAndGet(snapshot.version(), Math::max);
                        log.debug("[Config] Persisted document v{}", snapshot.version());
                    })
                    .exceptionally(error -> {
                        log.error("[Config] Failed to persist document v{}", snapshot.version(), error);
                        return null;
                    });
        } catch (RuntimeException e) {
            log.error("[Config] Failed to persist document v{}", snapshot.version(), e);
            return CompletableFuture.completedFuture(null);
        }
    }

    record Snapshot(long version, ConfigDocument document) {
    }
}
