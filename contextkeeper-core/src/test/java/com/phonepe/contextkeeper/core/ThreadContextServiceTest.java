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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.phonepe.contextkeeper.core.context.BuildContextOptions;
import com.phonepe.contextkeeper.core.context.ContextManager;
import com.phonepe.contextkeeper.core.context.ContextSegment;
import com.phonepe.contextkeeper.core.errors.ErrorType;
import com.phonepe.contextkeeper.core.llm.LlmRequest;
import com.phonepe.contextkeeper.core.llm.Message;
import com.phonepe.contextkeeper.core.model.ModelCatalog;
import com.phonepe.contextkeeper.core.thread.AgentThread;
import com.phonepe.contextkeeper.core.thread.InMemoryThreadStore;
import com.phonepe.contextkeeper.core.tokens.DefaultTokenCounter;
import com.phonepe.contextkeeper.core.transport.LlmTransport;
import com.phonepe.contextkeeper.core.transport.TransportResponse;
import com.phonepe.contextkeeper.core.utils.JsonUtils;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ThreadContextServiceTest {
    private static final String MODEL = "claude-sonnet-4-5-20250929";

    @Mock
    private LlmTransport transport;

    private InMemoryThreadStore store;
    private ThreadContextService service;

    @BeforeEach
    void setUp() {
        final var catalog = new ModelCatalog();
        store = new InMemoryThreadStore();
        service = new ThreadContextService(new ContextManager(catalog, new DefaultTokenCounter(catalog)),
                                           store,
                                           transport);
    }

    @Test
    void testAppendAndBuild() {
        final var thread = new AgentThread(MODEL);
        assertEquals(0, service.appendSegment(thread, ContextSegment.chat(List.of(Message.user("hello"),
                                                                                    Message.assistant("hi")))));
        assertEquals(1, service.appendSegment(thread, ContextSegment.chat(List.of(Message.user("how are you?")))));

        final var built = service.buildRequest(thread, BuildContextOptions.builder()
                .systemPrompt("You are a helpful assistant")
                .build());
        final var request = built.getRequest();
        assertEquals(MODEL, request.getModel());
        assertEquals("You are a helpful assistant", request.getSystem());
        assertEquals(3, request.getMessages().size());
        assertEquals(16_384, request.getMaxTokens());
        assertEquals(2, built.getSegmentsIncluded());
        assertFalse(built.isTruncated());
    }

    @Test
    void testLoadRepairsAndSaves() {
        final var thread = new AgentThread(MODEL);
        thread.addSegment(ContextSegment.chat(List.of(Message.user("q"))));
        thread.addSegment(ContextSegment.toolExchange(List.of(TestUtils.userToolResult("orphan"))));
        service.saveThread(thread);

        final var loaded = service.loadThread(thread.getId()).orElseThrow();
        assertEquals(1, loaded.getSegments().size());
        assertEquals(1, store.get(thread.getId()).orElseThrow().getSegments().size());
        assertTrue(store.get(thread.getId()).orElseThrow().getUpdatedAt() > thread.getUpdatedAt());
    }

    @Test
    void testLoadMissingThread() {
        assertFalse(service.loadThread("T-missing").isPresent());
    }

    @Test
    void testSend() {
        final var event = JsonUtils.createMapper().createObjectNode().put("type", "message_stop");
        when(transport.send(any())).thenReturn(CompletableFuture.completedFuture(
                TransportResponse.success(List.of(event))));
        final var thread = new AgentThread(MODEL);
        thread.addSegment(ContextSegment.chat(List.of(Message.user("hello"))));

        final var response = service.send(thread, BuildContextOptions.builder().systemPrompt("sys").build()).join();
        assertTrue(response.isSuccess());
        assertEquals(List.of(event), response.getEvents());

        final var captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(transport).send(captor.capture());
        assertEquals(MODEL, captor.getValue().getModel());
        assertTrue(captor.getValue().isStream());
    }

    @Test
    void testSendFailure() {
        when(transport.send(any())).thenReturn(CompletableFuture.failedFuture(new IOException("connection reset")));
        final var thread = new AgentThread(MODEL);
        thread.addSegment(ContextSegment.chat(List.of(Message.user("hello"))));

        final var response = service.send(thread, BuildContextOptions.builder().build()).join();
        assertFalse(response.isSuccess());
        assertEquals(ErrorType.TRANSPORT_FAILURE, response.getError().getErrorType());
        assertTrue(response.getError().getMessage().contains("connection reset"));
        assertTrue(response.getEvents().isEmpty());
    }
}
