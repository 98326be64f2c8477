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

package com.phonepe.contextkeeper.core;

import com.phonepe.contextkeeper.core.context.BuildContextOptions;
import com.phonepe.contextkeeper.core.context.BuildContextParams;
import com.phonepe.contextkeeper.core.context.BuiltContext;
import com.phonepe.contextkeeper.core.context.ContextManager;
import com.phonepe.contextkeeper.core.context.ContextSegment;
import com.phonepe.contextkeeper.core.errors.ContextKeeperError;
import com.phonepe.contextkeeper.core.errors.ErrorType;
import com.phonepe.contextkeeper.core.thread.AgentThread;
import com.phonepe.contextkeeper.core.thread.ThreadRepairer;
import com.phonepe.contextkeeper.core.thread.ThreadStore;
import com.phonepe.contextkeeper.core.transport.LlmTransport;
import com.phonepe.contextkeeper.core.transport.TransportResponse;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for an agent loop: appends to threads, builds bounded requests from them and keeps persisted threads
 * consistent.
 */
@Slf4j
public class ThreadContextService {
    private final ContextManager contextManager;
    private final ThreadStore threadStore;
    private final LlmTransport transport;

    public ThreadContextService(@NonNull ContextManager contextManager,
                                @NonNull ThreadStore threadStore,
                                @NonNull LlmTransport transport) {
        this.contextManager = contextManager;
        this.threadStore = threadStore;
        this.transport = transport;
    }

    public long appendSegment(@NonNull AgentThread thread, @NonNull ContextSegment segment) {
        return thread.addSegment(segment);
    }

    public BuiltContext buildRequest(@NonNull AgentThread thread, @NonNull BuildContextOptions options) {
        return contextManager.buildRequest(BuildContextParams.builder()
                                                   .model(thread.getModel())
                                                   .systemPrompt(options.getSystemPrompt())
                                                   .shortSystemPrompt(options.getShortSystemPrompt())
                                                   .tools(options.getTools())
                                                   .segments(thread.getSegments())
                                                   .maxOutputTokens(options.getMaxOutputTokens())
                                                   .build());
    }

    /**
     * Loads a thread and repairs it. A repaired thread is written back to the store.
     */
    public Optional<AgentThread> loadThread(String id) {
        return threadStore.get(id)
                .map(thread -> {
                    final var updatedAt = thread.getUpdatedAt();
                    final var removed = ThreadRepairer.repair(thread);
                    if (thread.getUpdatedAt() != updatedAt) {
                        log.info("Thread {} was repaired on load ({} tool results removed). Saving",
                                 id, removed);
                        threadStore.save(thread);
                    }
                    return thread;
                });
    }

    public void saveThread(@NonNull AgentThread thread) {
        threadStore.save(thread);
    }

    public CompletableFuture<TransportResponse> send(@NonNull AgentThread thread,
                                                     @NonNull BuildContextOptions options) {
        final var built = buildRequest(thread, options);
        final var request = built.getRequest();
        return transport.send(request)
                .exceptionally(error -> {
                    log.error("Error sending request for model {}: {}", request.getModel(), error.getMessage());
                    return TransportResponse.failure(ContextKeeperError.error(ErrorType.TRANSPORT_FAILURE,
                                                                              error,
                                                                              request.getModel()));
                });
    }
}
