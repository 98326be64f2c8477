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

import java.util.List;
import java.util.Optional;

/**
 * A storage system for agent threads. Implementations must allow concurrent readers and serialize writers.
 * Failures are reported as {@link com.phonepe.contextkeeper.core.errors.ThreadStoreException}.
 */
public interface ThreadStore {
    Optional<AgentThread> get(String id);

    /**
     * Persists a snapshot of the thread. Later changes to the passed object are not visible to the store.
     */
    void save(AgentThread thread);

    /**
     * @return true if a thread was deleted
     */
    boolean delete(String id);

    List<String> list();

    /**
     * Summaries of all stored threads, most recently updated first
     */
    List<ThreadSummary> listSummary();
}
