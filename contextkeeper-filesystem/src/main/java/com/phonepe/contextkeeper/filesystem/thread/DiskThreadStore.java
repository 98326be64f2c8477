/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.contextkeeper.filesystem.thread;

import com.fasterxml.jackson.databind.ObjectMapper;

import com.phonepe.contextkeeper.core.errors.ErrorType;
import com.phonepe.contextkeeper.core.errors.ThreadStoreException;
import com.phonepe.contextkeeper.core.thread.AgentThread;
import com.phonepe.contextkeeper.core.thread.ThreadStore;
import com.phonepe.contextkeeper.core.thread.ThreadSummary;
import com.phonepe.contextkeeper.core.utils.JsonUtils;
import com.phonepe.contextkeeper.filesystem.utils.FileUtils;

import com.google.common.base.Strings;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.StampedLock;

/**
 * Stores each thread as a JSON file under a base directory. The most recently loaded or saved threads are cached
 * in memory.
 */
@Slf4j
public class DiskThreadStore implements ThreadStore {
    public static final int DEFAULT_CACHE_SIZE = 32;
    private static final String EXTENSION = ".json";

    @Getter
    private final Path baseDir;
    private final ObjectMapper mapper;
    private final Map<String, AgentThread> cache;
    private final StampedLock cacheLock = new StampedLock();

    public DiskThreadStore() {
        this(defaultPath(), JsonUtils.createMapper(), DEFAULT_CACHE_SIZE);
    }

    public DiskThreadStore(@NonNull Path baseDir) {
        this(baseDir, JsonUtils.createMapper(), DEFAULT_CACHE_SIZE);
    }

    public DiskThreadStore(@NonNull Path baseDir, @NonNull ObjectMapper mapper, int cacheSize) {
        try {
            this.baseDir = FileUtils.ensurePath(baseDir, true);
        }
        catch (IllegalArgumentException e) {
            throw ThreadStoreException.of(ErrorType.STORE_INITIALIZATION_FAILURE, e, baseDir);
        }
        this.mapper = mapper;
        // Insertion ordered. Lookups run under the shared read lock and must not reorder the map
        this.cache = new LinkedHashMap<>(cacheSize, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, AgentThread> eldest) {
                return size() > cacheSize;
            }
        };
    }

    /**
     * {@code $XDG_CONFIG_HOME/contextkeeper/threads}, or {@code ~/.config/contextkeeper/threads} if the variable
     * is not set
     */
    public static Path defaultPath() {
        final var configHome = System.getenv("XDG_CONFIG_HOME");
        final var root = Strings.isNullOrEmpty(configHome)
                         ? Path.of(System.getProperty("user.home"), ".config")
                         : Path.of(configHome);
        return root.resolve("contextkeeper").resolve("threads");
    }

    public Path threadPath(String id) {
        return baseDir.resolve(FileUtils.sanitize(id) + EXTENSION);
    }

    @Override
    public Optional<AgentThread> get(String id) {
        var stamp = cacheLock.readLock();
        try {
            final var cached = cache.get(id);
            if (cached != null) {
                return Optional.of(cached.copy());
            }
            final var writeStamp = cacheLock.tryConvertToWriteLock(stamp);
            if (writeStamp == 0L) {
                cacheLock.unlockRead(stamp);
                stamp = cacheLock.writeLock();
            }
            else {
                stamp = writeStamp;
            }
            final var loaded = cache.computeIfAbsent(id, this::readThread);
            return Optional.ofNullable(loaded).map(AgentThread::copy);
        }
        finally {
            cacheLock.unlock(stamp);
        }
    }

    @Override
    public void save(@NonNull AgentThread thread) {
        final var snapshot = thread.copy();
        final byte[] data;
        try {
            data = mapper.writeValueAsBytes(snapshot);
        }
        catch (IOException e) {
            throw ThreadStoreException.of(ErrorType.SERIALIZATION_ERROR, e, snapshot.getId());
        }
        final var stamp = cacheLock.writeLock();
        try {
            FileUtils.writeAtomically(threadPath(snapshot.getId()), data);
            cache.put(snapshot.getId(), snapshot);
            log.debug("Saved thread {} to {}", snapshot.getId(), threadPath(snapshot.getId()));
        }
        catch (IOException e) {
            throw ThreadStoreException.of(ErrorType.THREAD_WRITE_FAILURE, e, snapshot.getId());
        }
        finally {
            cacheLock.unlockWrite(stamp);
        }
    }

    @Override
    public boolean delete(String id) {
        final var stamp = cacheLock.writeLock();
        try {
            cache.remove(id);
            return Files.deleteIfExists(threadPath(id));
        }
        catch (IOException e) {
            throw ThreadStoreException.of(ErrorType.THREAD_DELETE_FAILURE, e, id);
        }
        finally {
            cacheLock.unlockWrite(stamp);
        }
    }

    @Override
    public List<String> list() {
        try (final var files = Files.list(baseDir)) {
            return files
                    .filter(path -> Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS))
                    .map(path -> path.getFileName().toString())
                    .filter(name -> !name.startsWith(".") && name.endsWith(EXTENSION))
                    .map(name -> name.substring(0, name.length() - EXTENSION.length()))
                    .sorted()
                    .toList();
        }
        catch (IOException e) {
            throw ThreadStoreException.of(ErrorType.THREAD_READ_FAILURE, e, baseDir);
        }
    }

    @Override
    public List<ThreadSummary> listSummary() {
        return list().stream()
                .map(id -> get(id).orElse(null))
                .filter(Objects::nonNull)
                .map(ThreadSummary::of)
                .sorted(Comparator.comparingLong(ThreadSummary::getUpdatedAt).reversed())
                .toList();
    }

    private AgentThread readThread(String id) {
        final var path = threadPath(id);
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            return null;
        }
        try {
            return mapper.readValue(path.toFile(), AgentThread.class);
        }
        catch (IOException e) {
            log.warn("Ignoring unreadable thread file {}: {}", path, e.getMessage());
            return null;
        }
    }
}
