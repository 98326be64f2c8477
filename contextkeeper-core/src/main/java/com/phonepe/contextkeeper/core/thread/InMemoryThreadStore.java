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

package com.phonepe.contextkeeper.core.thread;

import com.phonepe.contextkeeper.core.errors.ErrorType;
import com.phonepe.contextkeeper.core.errors.ThreadStoreException;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Thread store backed by a map. Readers share the lock, writers hold it exclusively. Lock waits are bounded.
 */
@Slf4j
public class InMemoryThreadStore implements ThreadStore {
    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);

    private final Map<String, AgentThread> threads = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Duration lockTimeout;

    public InMemoryThreadStore() {
        this(DEFAULT_LOCK_TIMEOUT);
    }

    public InMemoryThreadStore(@NonNull Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    @Override
    public Optional<AgentThread> get(String id) {
        return withLock(lock.readLock(), "read", () -> Optional.ofNullable(threads.get(id)).map(AgentThread::copy));
    }

    @Override
    public void save(@NonNull AgentThread thread) {
        final var snapshot = thread.copy();
        withLock(lock.writeLock(), "write", () -> threads.put(snapshot.getId(), snapshot));
        log.debug("Saved thread {} with {} segments", snapshot.getId(), snapshot.getSegments().size());
    }

    @Override
    public boolean delete(String id) {
        return withLock(lock.writeLock(), "write", () -> threads.remove(id) != null);
    }

    @Override
    public List<String> list() {
        return withLock(lock.readLock(), "read", () -> threads.keySet().stream().sorted().toList());
    }

    @Override
    public List<ThreadSummary> listSummary() {
        return withLock(lock.readLock(), "read", () -> threads.values()
                .stream()
                .map(ThreadSummary::of)
                .sorted(Comparator.comparingLong(ThreadSummary::getUpdatedAt).reversed())
                .toList());
    }

    private <T> T withLock(final Lock target, final String mode, final Supplier<T> action) {
        try {
            if (!target.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw ThreadStoreException.of(ErrorType.LOCK_ACQUISITION_FAILED,
                                              mode, "timed out after " + lockTimeout);
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ThreadStoreException.of(ErrorType.LOCK_ACQUISITION_FAILED, e, mode);
        }
        try {
            return action.get();
        }
        finally {
            target.unlock();
        }
    }
}
