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

package org.sequent.processor;

import org.jspecify.annotations.Nullable;
import org.sequent.eventstore.api.PositionToken;
import org.sequent.eventstore.api.RecordedMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.Objects.requireNonNull;
import static org.sequent.processor.ProcessorStatus.*;

/**
 * The runtime of a {@link ProcessorDefinition} inside an {@link EventStoreConsumer}. Messages are handled one by one in the
 * order of the feed and the checkpoint is stored after each message, in the same {@link ProcessingScope} as the handler.
 * Messages at or before the stored checkpoint are filtered out so that several processors can share one feed.
 * <p>
 * All methods that change the state are invoked by the consumer thread only, except {@link #refreshLock()}. The state can be
 * observed from any thread.
 */
public class MessageProcessor {
    private static final Logger log = LoggerFactory.getLogger(MessageProcessor.class);

    private final ProcessorDefinition definition;
    private final CheckpointStore checkpointStore;
    private final ProcessorLock lock;
    private final LockPolicy lockPolicy;
    private final ProcessingScope processingScope;

    private final AtomicReference<ProcessorStatus> status = new AtomicReference<>(IDLE);
    private volatile @Nullable PositionToken lastCheckpoint;
    private volatile @Nullable Throwable failure;

    MessageProcessor(ProcessorDefinition definition, CheckpointStore checkpointStore, ProcessorLock lock, LockPolicy lockPolicy, ProcessingScope processingScope) {
        this.definition = requireNonNull(definition, ProcessorDefinition.class.getSimpleName() + " cannot be null");
        this.checkpointStore = requireNonNull(checkpointStore, CheckpointStore.class.getSimpleName() + " cannot be null");
        this.lock = requireNonNull(lock, ProcessorLock.class.getSimpleName() + " cannot be null");
        this.lockPolicy = requireNonNull(lockPolicy, LockPolicy.class.getSimpleName() + " cannot be null");
        this.processingScope = requireNonNull(processingScope, ProcessingScope.class.getSimpleName() + " cannot be null");
    }

    public String processorId() {
        return definition.processorId();
    }

    public ProcessorDefinition definition() {
        return definition;
    }

    public ProcessorStatus status() {
        return status.get();
    }

    public boolean isActive() {
        return status.get() == ACTIVE;
    }

    /**
     * @return The last checkpoint stored by, or read by, this processor
     */
    public Optional<PositionToken> lastCheckpoint() {
        return Optional.ofNullable(lastCheckpoint);
    }

    /**
     * @return The error that made this processor fail, if it failed during its latest run
     */
    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Acquire the lock and resolve where the processor starts.
     *
     * @return The resolved start position or {@code Optional.empty()} if the lock wasn't acquired or the projection couldn't be truncated
     * @throws LockAcquisitionFailedException If the lock wasn't acquired and the lock policy is {@link LockPolicy#fail()}
     */
    Optional<StartFrom> start() {
        failure = null;
        if (!lockPolicy.acquire(lock, processorId())) {
            log.info("Processor '{}' didn't acquire its lock and stays idle", processorId());
            status.set(IDLE);
            return Optional.empty();
        }

        boolean truncated = false;
        if (definition instanceof ProcessorDefinition.Projector projector && projector.truncateOnStart()) {
            try {
                truncate(projector.projection());
                truncated = true;
            } catch (RuntimeException e) {
                Throwable cause = e instanceof MessageHandlingException ? e.getCause() : e;
                log.error("Processor '{}' failed to truncate its projection", processorId(), cause);
                failure = cause;
                status.set(FAILED);
                return Optional.empty();
            }
        }

        PositionToken storedCheckpoint = checkpointStore.read(definition.key());
        lastCheckpoint = storedCheckpoint;
        StartFrom startFrom = truncated ? StartFrom.beginning() : resolve(definition.startFrom(), storedCheckpoint);
        status.set(ACTIVE);
        log.info("Started processor '{}' from {} (stored checkpoint {})", processorId(), startFrom, storedCheckpoint);
        return Optional.of(startFrom);
    }

    /**
     * Handle the messages of a batch in order until the processor stops.
     */
    void handle(List<RecordedMessage> batch) {
        for (RecordedMessage message : batch) {
            if (!isActive()) {
                return;
            }
            PositionToken position = requireNonNull(message.globalPosition(), "Messages in the feed must have a global position");
            if (PositionToken.isAtOrBefore(position, lastCheckpoint)) {
                continue;
            }

            final MessageHandlerResult result;
            try {
                result = processingScope.execute(() -> {
                    MessageHandlerResult handlerResult = definition.canHandle(message) ? invokeHandler(message) : MessageHandlerResult.skip();
                    storeCheckpoint(position);
                    return handlerResult;
                });
            } catch (MessageHandlingException e) {
                fail(e.getCause(), message);
                return;
            } catch (RuntimeException e) {
                fail(e, message);
                return;
            }

            if (result instanceof MessageHandlerResult.Stop stop) {
                log.info("Processor '{}' was stopped by its handler at {} ({})", processorId(), position, stop.reason());
                status.set(STOPPED);
            } else if (definition.stopAfter().test(message)) {
                log.info("Stop condition of processor '{}' reached at {}", processorId(), position);
                status.set(STOPPED);
            }
        }
    }

    /**
     * Refresh the lock of an active processor. Invoked by the lock refresh thread, mutually exclusive with {@link #stop()}
     * so that a released lock is never acquired again by a refresh that was already running.
     */
    synchronized void refreshLock() {
        if (isActive() && !lock.tryAcquire()) {
            log.warn("Processor '{}' lost its lock, another instance may have taken over", processorId());
        }
    }

    /**
     * Stop the processor, if active, and release its lock
     */
    synchronized void stop() {
        status.compareAndSet(ACTIVE, STOPPED);
        try {
            lock.release();
        } catch (RuntimeException e) {
            log.warn("Failed to release lock of processor '{}'", processorId(), e);
        }
    }

    private MessageHandlerResult invokeHandler(RecordedMessage message) {
        try {
            if (definition instanceof ProcessorDefinition.Reactor reactor) {
                MessageHandlerResult result = reactor.eachMessage().handle(message);
                return result == null ? MessageHandlerResult.ack() : result;
            } else if (definition instanceof ProcessorDefinition.Projector projector) {
                projector.projection().handle(message);
                return MessageHandlerResult.ack();
            }
            throw new IllegalStateException("Unsupported processor definition: " + definition.getClass().getName());
        } catch (Throwable e) {
            // Errors too, they fail this processor only
            throw new MessageHandlingException(e);
        }
    }

    private void truncate(Projection projection) {
        processingScope.execute(() -> {
            try {
                projection.truncate();
            } catch (Exception e) {
                throw new MessageHandlingException(e);
            }
            checkpointStore.reset(definition.key());
            return null;
        });
        log.info("Truncated projection '{}' of processor '{}'", projection.name(), processorId());
    }

    private void storeCheckpoint(PositionToken position) {
        StoreCheckpointResult result = checkpointStore.store(definition.key(), lastCheckpoint, position);
        if (result instanceof StoreCheckpointResult.Success success) {
            lastCheckpoint = success.newCheckpoint();
        } else {
            StoreCheckpointResult.Reason reason = ((StoreCheckpointResult.Failure) result).reason();
            if (reason != StoreCheckpointResult.Reason.IGNORED) {
                throw new ProcessorCheckpointConflictException(processorId(), reason, position);
            }
            log.debug("Checkpoint {} of processor '{}' was ignored, already caught up", position, processorId());
        }
    }

    private void fail(Throwable e, RecordedMessage message) {
        log.error("Processor '{}' failed to handle message {} of type {} at global position {}", processorId(), message.messageId(), message.type(), message.globalPosition(), e);
        failure = e;
        status.set(FAILED);
    }

    private static StartFrom resolve(StartFrom startFrom, @Nullable PositionToken storedCheckpoint) {
        if (startFrom instanceof StartFrom.Current) {
            return storedCheckpoint == null ? StartFrom.beginning() : StartFrom.checkpoint(storedCheckpoint);
        }
        return startFrom;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", MessageProcessor.class.getSimpleName() + "[", "]")
                .add("processorId='" + processorId() + "'")
                .add("status=" + status.get())
                .add("lastCheckpoint=" + lastCheckpoint)
                .toString();
    }

    /**
     * Carries a handler exception through the {@link ProcessingScope} so that the scope rolls back
     */
    static class MessageHandlingException extends RuntimeException {
        MessageHandlingException(Throwable cause) {
            super(cause);
        }
    }
}
