/*
 * Copyright 2023 Johan Haleby
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

package org.sequent.processor.inmemory;

import org.sequent.eventstore.api.AfterCommitHook;
import org.sequent.eventstore.api.PositionToken;
import org.sequent.eventstore.api.RecordedMessage;
import org.sequent.processor.MessageFeed;
import org.sequent.processor.StartFrom;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;

/**
 * A {@link MessageFeed} that is fed by registering it as an {@link AfterCommitHook} of an in-memory event store. It keeps
 * every message it has received so that it can be read from the beginning.
 * <p>
 * Messages are kept in the order the hooks are invoked. The in-memory event store invokes its hooks in global position
 * order, also for concurrent appends.
 */
public class InMemoryMessageFeed implements MessageFeed, AfterCommitHook {
    private static final int DEFAULT_BATCH_SIZE = 100;
    private static final Duration DEFAULT_MAX_WAIT = Duration.ofMillis(200);

    private final int batchSize;
    private final Duration maxWait;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final List<RecordedMessage> messages = new ArrayList<>();
    private int nextIndex;
    private boolean open;

    public InMemoryMessageFeed() {
        this(DEFAULT_BATCH_SIZE, DEFAULT_MAX_WAIT);
    }

    public InMemoryMessageFeed(int batchSize, Duration maxWait) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be greater than 0");
        }
        this.batchSize = batchSize;
        this.maxWait = requireNonNull(maxWait, "maxWait cannot be null");
    }

    @Override
    public void afterCommit(String streamName, List<RecordedMessage> recordedMessages) {
        lock.lock();
        try {
            messages.addAll(recordedMessages);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void open(StartFrom startFrom) {
        requireNonNull(startFrom, StartFrom.class.getSimpleName() + " cannot be null");
        lock.lock();
        try {
            if (startFrom instanceof StartFrom.Beginning) {
                nextIndex = 0;
            } else if (startFrom instanceof StartFrom.End) {
                nextIndex = messages.size();
            } else if (startFrom instanceof StartFrom.Checkpoint checkpoint) {
                nextIndex = indexAfter(checkpoint.token());
            } else {
                throw new IllegalArgumentException("Cannot open feed from " + startFrom);
            }
            open = true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<RecordedMessage> nextBatch() {
        lock.lock();
        try {
            if (open && nextIndex >= messages.size()) {
                changed.await(maxWait.toMillis(), TimeUnit.MILLISECONDS);
            }
            if (!open || nextIndex >= messages.size()) {
                return Collections.emptyList();
            }
            int end = Math.min(messages.size(), nextIndex + batchSize);
            List<RecordedMessage> batch = new ArrayList<>(messages.subList(nextIndex, end));
            nextIndex = end;
            return batch;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Collections.emptyList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            open = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private int indexAfter(PositionToken checkpoint) {
        for (int i = 0; i < messages.size(); i++) {
            if (!PositionToken.isAtOrBefore(messages.get(i).globalPosition(), checkpoint)) {
                return i;
            }
        }
        return messages.size();
    }
}
