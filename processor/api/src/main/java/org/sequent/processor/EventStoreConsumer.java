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

import org.sequent.eventstore.api.RecordedMessage;
import org.sequent.processor.internal.ScheduledRefresh;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.Objects.requireNonNull;

/**
 * Reads messages from a {@link MessageFeed} and dispatches them, in order, to each registered {@link MessageProcessor}.
 * <p>
 * The consumer runs its processing loop in a single thread that it creates on {@link #start()}. The feed is opened at the
 * earliest start position of all processors that acquired their lock, and each processor filters out what it has already
 * checkpointed. The loop ends when {@link #stop()} is called or when no processor is active anymore. A consumer created with
 * {@code stopWhenNoMessagesLeft} also ends the first time the feed has nothing more to return. The future returned by
 * {@link #start()} completes exceptionally with the error of the first processor that failed.
 * <p>
 * A consumer can be started again after it has stopped, the processors then resume from their stored checkpoints.
 */
public class EventStoreConsumer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventStoreConsumer.class);
    private static final AtomicInteger CONSUMER_COUNTER = new AtomicInteger();
    static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(30);

    private final MessageFeed messageFeed;
    private final CheckpointStore checkpointStore;
    private final ProcessorLockFactory lockFactory;
    private final ProcessingScope processingScope;
    private final ProcessorLockConfig lockConfig;
    private final String instanceId;
    private final List<AutoCloseable> ownedResources;
    private final boolean stopWhenNoMessagesLeft;

    private final List<MessageProcessor> processors = new CopyOnWriteArrayList<>();
    private final ExecutorService consumerThread;
    private final ScheduledRefresh lockRefresh;

    private volatile CompletableFuture<Void> runFuture;
    private volatile boolean running;
    private volatile boolean closed;

    public EventStoreConsumer(MessageFeed messageFeed, CheckpointStore checkpointStore, ProcessorLockFactory lockFactory) {
        this(messageFeed, checkpointStore, lockFactory, ProcessingScope.none(), ProcessorLockConfig.defaultConfig(), UUID.randomUUID().toString(), Collections.emptyList());
    }

    /**
     * @param ownedResources Resources that are closed, in order, when the consumer is closed
     */
    public EventStoreConsumer(MessageFeed messageFeed, CheckpointStore checkpointStore, ProcessorLockFactory lockFactory, ProcessingScope processingScope,
                              ProcessorLockConfig lockConfig, String instanceId, List<AutoCloseable> ownedResources) {
        this(messageFeed, checkpointStore, lockFactory, processingScope, lockConfig, instanceId, ownedResources, false);
    }

    /**
     * @param ownedResources         Resources that are closed, in order, when the consumer is closed
     * @param stopWhenNoMessagesLeft Stop the consumer the first time the feed returns an empty batch, that is once every
     *                               processor has caught up. Used to rebuild projections.
     */
    public EventStoreConsumer(MessageFeed messageFeed, CheckpointStore checkpointStore, ProcessorLockFactory lockFactory, ProcessingScope processingScope,
                              ProcessorLockConfig lockConfig, String instanceId, List<AutoCloseable> ownedResources, boolean stopWhenNoMessagesLeft) {
        this.messageFeed = requireNonNull(messageFeed, MessageFeed.class.getSimpleName() + " cannot be null");
        this.checkpointStore = requireNonNull(checkpointStore, CheckpointStore.class.getSimpleName() + " cannot be null");
        this.lockFactory = requireNonNull(lockFactory, ProcessorLockFactory.class.getSimpleName() + " cannot be null");
        this.processingScope = requireNonNull(processingScope, ProcessingScope.class.getSimpleName() + " cannot be null");
        this.lockConfig = requireNonNull(lockConfig, ProcessorLockConfig.class.getSimpleName() + " cannot be null");
        this.instanceId = requireNonNull(instanceId, "instanceId cannot be null");
        this.ownedResources = List.copyOf(requireNonNull(ownedResources, "ownedResources cannot be null"));
        this.stopWhenNoMessagesLeft = stopWhenNoMessagesLeft;
        int consumerNumber = CONSUMER_COUNTER.incrementAndGet();
        this.consumerThread = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "sequent-consumer-" + consumerNumber);
            thread.setDaemon(true);
            return thread;
        });
        this.lockRefresh = new ScheduledRefresh("sequent-consumer-" + consumerNumber + "-lock-refresh");
    }

    public MessageProcessor reactor(ProcessorDefinition.Reactor reactor) {
        return processor(reactor, LockMode.EXCLUSIVE);
    }

    public MessageProcessor projector(ProcessorDefinition.Projector projector) {
        return processor(projector, LockMode.EXCLUSIVE);
    }

    /**
     * Register a processor that is locked with the given {@code lockMode}.
     *
     * @throws IllegalStateException If the consumer is running or closed, or if a processor with the same id is already registered
     */
    public synchronized MessageProcessor processor(ProcessorDefinition definition, LockMode lockMode) {
        requireNonNull(definition, ProcessorDefinition.class.getSimpleName() + " cannot be null");
        requireNonNull(lockMode, LockMode.class.getSimpleName() + " cannot be null");
        assertNotClosed();
        if (isRunning()) {
            throw new IllegalStateException("Cannot add processor '" + definition.processorId() + "' to a running consumer");
        }
        if (processors.stream().anyMatch(p -> p.processorId().equals(definition.processorId()))) {
            throw new IllegalStateException("Processor '" + definition.processorId() + "' is already registered");
        }
        ProcessorLock lock = lockFactory.create(definition, instanceId, lockMode);
        MessageProcessor processor = new MessageProcessor(definition, checkpointStore, lock, lockConfig.lockPolicy, processingScope);
        processors.add(processor);
        return processor;
    }

    /**
     * Start consuming. Starting a consumer that is already running returns the future of the current run.
     *
     * @return A future that completes when the consumer stops, exceptionally if a processor failed
     * @throws IllegalStateException If no processor is registered or if the consumer is closed
     */
    public synchronized CompletableFuture<Void> start() {
        assertNotClosed();
        if (processors.isEmpty()) {
            throw new IllegalStateException("Cannot start consumer without at least a single processor");
        }
        if (isRunning()) {
            return runFuture;
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        running = true;
        runFuture = future;
        consumerThread.execute(() -> run(future));
        return future;
    }

    /**
     * Stop consuming and wait for the message that is being handled to finish. Stopping a consumer that isn't running does nothing.
     */
    public void stop() {
        final CompletableFuture<Void> future;
        synchronized (this) {
            running = false;
            future = runFuture;
        }
        if (future == null || future.isDone()) {
            return;
        }
        messageFeed.close();
        try {
            future.get(DEFAULT_STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            log.debug("Consumer {} stopped after a failure that is reported through the start future", instanceId, e.getCause());
        } catch (TimeoutException e) {
            log.warn("Consumer {} didn't stop within {}, a handler is probably still running", instanceId, DEFAULT_STOP_TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Stop the consumer and close the resources that it owns
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        stop();
        closed = true;
        lockRefresh.close();
        shutdownConsumerThread();
        for (AutoCloseable resource : ownedResources) {
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Failed to close {}", resource, e);
            }
        }
    }

    private void shutdownConsumerThread() {
        consumerThread.shutdown();
        try {
            if (!consumerThread.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Consumer thread of {} didn't terminate, interrupting it", instanceId);
                consumerThread.shutdownNow();
            }
        } catch (InterruptedException e) {
            consumerThread.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        CompletableFuture<Void> future = runFuture;
        return future != null && !future.isDone();
    }

    public List<MessageProcessor> processors() {
        return Collections.unmodifiableList(processors);
    }

    public String instanceId() {
        return instanceId;
    }

    private void run(CompletableFuture<Void> future) {
        Throwable loopFailure = null;
        try {
            List<StartFrom> startPositions = new ArrayList<>();
            for (MessageProcessor processor : processors) {
                processor.start().ifPresent(startPositions::add);
            }
            if (startPositions.isEmpty()) {
                log.info("No processor of consumer {} is active, nothing to consume", instanceId);
                return;
            }

            lockRefresh.scheduleInBackground(this::refreshLocks, lockConfig.lockTimeout);
            StartFrom startFrom = StartFrom.earliest(startPositions);
            log.info("Consumer {} reads from {}", instanceId, startFrom);
            messageFeed.open(startFrom);
            while (running && anyProcessorActive()) {
                List<RecordedMessage> batch = messageFeed.nextBatch();
                if (batch.isEmpty()) {
                    if (stopWhenNoMessagesLeft) {
                        log.info("No messages left for consumer {}, stopping", instanceId);
                        break;
                    }
                    continue;
                }
                for (MessageProcessor processor : processors) {
                    if (processor.isActive()) {
                        processor.handle(batch);
                    }
                }
            }
        } catch (Throwable e) {
            log.error("Consumer {} failed", instanceId, e);
            loopFailure = e;
        } finally {
            finish(future, loopFailure);
        }
    }

    private void finish(CompletableFuture<Void> future, Throwable loopFailure) {
        try {
            messageFeed.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close message feed of consumer {}", instanceId, e);
        }
        lockRefresh.cancel();
        processors.forEach(MessageProcessor::stop);
        running = false;

        Throwable failure = loopFailure != null ? loopFailure : processors.stream()
                .map(MessageProcessor::failure)
                .flatMap(Optional::stream)
                .findFirst()
                .orElse(null);
        if (failure == null) {
            future.complete(null);
        } else {
            future.completeExceptionally(failure);
        }
    }

    private void refreshLocks() {
        for (MessageProcessor processor : processors) {
            try {
                processor.refreshLock();
            } catch (RuntimeException e) {
                log.warn("Failed to refresh lock of processor '{}'", processor.processorId(), e);
            }
        }
    }

    private boolean anyProcessorActive() {
        return processors.stream().anyMatch(MessageProcessor::isActive);
    }

    private void assertNotClosed() {
        if (closed) {
            throw new IllegalStateException("Consumer " + instanceId + " is closed");
        }
    }
}
