/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.sequent.eventstore.inmemory;

import com.fasterxml.jackson.databind.JsonNode;
import org.sequent.eventstore.api.*;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * This is an {@link EventStore} that stores messages in-memory. This is mainly useful for testing
 * and/or demo purposes. Inline projections are kept per stream and can be read with {@link #findInlineProjection(String, String)}.
 */
public class InMemoryEventStore implements EventStore {

    // We cannot use ConcurrentMap since it doesn't maintain insertion order
    private final Map<String, List<RecordedMessage>> state = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, Map<String, JsonNode>> inlineProjections = new ConcurrentHashMap<>();
    private final AtomicLong globalPosition = new AtomicLong();
    // Held from assigning global positions until the after-commit hooks returned, hooks observe appends in global order
    private final ReentrantLock commitLock = new ReentrantLock();

    private final List<InlineProjection<JsonNode>> projections;
    private final List<AfterCommitHook> afterCommitHooks;
    private final Clock clock;

    /**
     * Create an instance of {@link InMemoryEventStore} without projections or hooks
     */
    public InMemoryEventStore() {
        this(Collections.emptyList(), Collections.emptyList());
    }

    /**
     * Create an instance of {@link InMemoryEventStore}
     *
     * @param projections      Projections that are updated atomically with each append
     * @param afterCommitHooks Hooks that will be invoked after messages have been written to the store (synchronously!). Appends
     *                         are serialized until the hooks return, so hooks receive messages in global position order.
     */
    public InMemoryEventStore(List<InlineProjection<JsonNode>> projections, List<AfterCommitHook> afterCommitHooks) {
        this(projections, afterCommitHooks, Clock.systemUTC());
    }

    public InMemoryEventStore(List<InlineProjection<JsonNode>> projections, List<AfterCommitHook> afterCommitHooks, Clock clock) {
        requireNonNull(projections, "projections cannot be null");
        requireNonNull(afterCommitHooks, "afterCommitHooks cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.projections = List.copyOf(projections);
        this.afterCommitHooks = List.copyOf(afterCommitHooks);
        this.clock = clock;
    }

    @Override
    public AppendResult appendToStream(String streamName, List<Message> messages, ExpectedStreamVersion expectedVersion) {
        StreamName.requireValid(streamName);
        requireNonNull(messages, "messages cannot be null");
        requireNonNull(expectedVersion, ExpectedStreamVersion.class.getSimpleName() + " cannot be null");

        commitLock.lock();
        try {
            return appendAndPublish(streamName, messages, expectedVersion);
        } finally {
            commitLock.unlock();
        }
    }

    private AppendResult appendAndPublish(String streamName, List<Message> messages, ExpectedStreamVersion expectedVersion) {
        final AtomicReference<List<RecordedMessage>> appended = new AtomicReference<>(Collections.emptyList());
        final AtomicReference<AppendResult> appendResult = new AtomicReference<>();
        state.compute(streamName, (__, currentMessages) -> {
            boolean streamExists = currentMessages != null;
            long currentStreamVersion = streamExists ? currentMessages.size() : 0;
            if (!expectedVersion.isFulfilledBy(streamExists, currentStreamVersion)) {
                throw new ExpectedVersionConflictException(streamName, expectedVersion, currentStreamVersion);
            }
            if (messages.isEmpty()) {
                appendResult.set(new AppendResult(currentStreamVersion, false));
                return currentMessages;
            }

            List<RecordedMessage> newMessages = new ArrayList<>(messages.size());
            for (int i = 0; i < messages.size(); i++) {
                newMessages.add(new RecordedMessage(messages.get(i), streamName, currentStreamVersion + i + 1, GlobalPosition.of(globalPosition.incrementAndGet()), clock.instant()));
            }
            applyInlineProjections(streamName, newMessages);

            List<RecordedMessage> messageList = streamExists ? new ArrayList<>(currentMessages) : new ArrayList<>();
            messageList.addAll(newMessages);
            appended.set(newMessages);
            appendResult.set(new AppendResult(messageList.size(), !streamExists));
            return Collections.unmodifiableList(messageList);
        });

        if (!appended.get().isEmpty()) {
            AfterCommitHook.invokeAll(afterCommitHooks, streamName, appended.get());
        }
        return appendResult.get();
    }

    @Override
    public ReadStreamResult readStream(String streamName, ReadStreamOptions options) {
        StreamName.requireValid(streamName);
        requireNonNull(options, ReadStreamOptions.class.getSimpleName() + " cannot be null");
        List<RecordedMessage> messages = state.get(streamName);
        boolean streamExists = messages != null;
        long currentStreamVersion = streamExists ? messages.size() : 0;
        if (!options.expectedVersion().isFulfilledBy(streamExists, currentStreamVersion)) {
            throw new ExpectedVersionConflictException(streamName, options.expectedVersion(), currentStreamVersion);
        } else if (!streamExists) {
            return ReadStreamResult.streamNotFound();
        }
        List<RecordedMessage> range = messages.stream().filter(m -> options.includes(m.streamPosition())).collect(Collectors.toList());
        return new ReadStreamResult(range, currentStreamVersion, true);
    }

    /**
     * @return The document of the inline projection with the given {@code name} for the given stream
     */
    public Optional<JsonNode> findInlineProjection(String name, String streamName) {
        return Optional.ofNullable(inlineProjections.getOrDefault(name, Collections.emptyMap()).get(streamName));
    }

    public boolean exists(String streamName) {
        return state.containsKey(streamName);
    }

    // Runs while holding the lock of the stream map so projections observe appends in commit order
    private void applyInlineProjections(String streamName, List<RecordedMessage> newMessages) {
        Map<String, Optional<JsonNode>> changes = new LinkedHashMap<>();
        for (InlineProjection<JsonNode> projection : projections) {
            if (projection.canHandleAny(newMessages)) {
                JsonNode current = findInlineProjection(projection.name(), streamName).orElse(null);
                changes.put(projection.name(), Optional.ofNullable(projection.project(current, newMessages)));
            }
        }
        changes.forEach((name, document) -> {
            Map<String, JsonNode> documents = inlineProjections.computeIfAbsent(name, ___ -> new ConcurrentHashMap<>());
            if (document.isPresent()) {
                documents.put(streamName, document.get());
            } else {
                documents.remove(streamName);
            }
        });
    }
}
