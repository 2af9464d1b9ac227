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

package org.sequent.processor.mongodb;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoCommandException;
import com.mongodb.WriteConcern;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.ReturnDocument;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.sequent.processor.LockMode;
import org.sequent.processor.ProcessorDefinition;
import org.sequent.processor.ProcessorLock;
import org.sequent.processor.ProcessorLockFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Date;

import static com.mongodb.ErrorCategory.DUPLICATE_KEY;
import static com.mongodb.client.model.Filters.*;
import static com.mongodb.client.model.Updates.combine;
import static com.mongodb.client.model.Updates.set;
import static java.util.Objects.requireNonNull;

/**
 * Creates lease based locks stored in the {@value #COLLECTION} collection. An exclusive lock is a lease that its owner
 * extends by acquiring it again, and that any instance may take over once it has expired. A shared lock is only a check
 * that no other instance holds an unexpired exclusive lease.
 */
public class MongoProcessorLockFactory implements ProcessorLockFactory {
    private static final Logger log = LoggerFactory.getLogger(MongoProcessorLockFactory.class);

    public static final String COLLECTION = "emt_processor_locks";

    private static final String ID = "_id";
    private static final String OWNER = "owner";
    private static final String PROCESSOR_ID = "processorId";
    private static final String EXPIRES_AT = "expiresAt";

    private final MongoCollection<Document> collection;
    private final Duration leaseTime;
    private final Clock clock;

    public MongoProcessorLockFactory(MongoDatabase database, Duration leaseTime) {
        this(database, leaseTime, Clock.systemUTC());
    }

    public MongoProcessorLockFactory(MongoDatabase database, Duration leaseTime, Clock clock) {
        requireNonNull(database, MongoDatabase.class.getSimpleName() + " cannot be null");
        this.collection = database.getCollection(COLLECTION).withWriteConcern(WriteConcern.MAJORITY);
        this.leaseTime = requireNonNull(leaseTime, "leaseTime cannot be null");
        this.clock = requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
    }

    @Override
    public ProcessorLock create(ProcessorDefinition definition, String instanceId, LockMode lockMode) {
        requireNonNull(definition, ProcessorDefinition.class.getSimpleName() + " cannot be null");
        requireNonNull(instanceId, "instanceId cannot be null");
        requireNonNull(lockMode, LockMode.class.getSimpleName() + " cannot be null");
        String lockId = definition.partition() + ":" + definition.lockName() + ":" + definition.version();
        return new MongoProcessorLock(lockId, definition.processorId(), instanceId, lockMode);
    }

    private boolean acquireOrRefresh(String lockId, String processorId, String instanceId) {
        try {
            Document found = collection.findOneAndUpdate(
                    and(eq(ID, lockId), or(lockIsExpired(), eq(OWNER, instanceId))),
                    combine(set(OWNER, instanceId), set(PROCESSOR_ID, processorId), set(EXPIRES_AT, Date.from(clock.instant().plus(leaseTime)))),
                    new FindOneAndUpdateOptions().returnDocument(ReturnDocument.AFTER).upsert(true));
            return found != null && instanceId.equals(found.getString(OWNER));
        } catch (MongoCommandException e) {
            if (ErrorCategory.fromErrorCode(e.getErrorCode()) == DUPLICATE_KEY) {
                // The lease is held by another instance
                return false;
            }
            throw e;
        }
    }

    private boolean isFreeFor(String lockId, String instanceId) {
        Document lock = collection.find(and(eq(ID, lockId), not(lockIsExpired()), ne(OWNER, instanceId))).first();
        return lock == null;
    }

    private void release(String lockId, String instanceId) {
        collection.deleteOne(and(eq(ID, lockId), eq(OWNER, instanceId)));
    }

    private Bson lockIsExpired() {
        return or(eq(EXPIRES_AT, null), lte(EXPIRES_AT, Date.from(clock.instant())));
    }

    private class MongoProcessorLock implements ProcessorLock {
        private final String lockId;
        private final String processorId;
        private final String instanceId;
        private final LockMode lockMode;

        private MongoProcessorLock(String lockId, String processorId, String instanceId, LockMode lockMode) {
            this.lockId = lockId;
            this.processorId = processorId;
            this.instanceId = instanceId;
            this.lockMode = lockMode;
        }

        @Override
        public boolean tryAcquire() {
            boolean acquired = lockMode == LockMode.EXCLUSIVE ? acquireOrRefresh(lockId, processorId, instanceId) : isFreeFor(lockId, instanceId);
            if (!acquired && log.isDebugEnabled()) {
                log.debug("Lock {} of processor '{}' is held by another instance (instanceId={})", lockId, processorId, instanceId);
            }
            return acquired;
        }

        @Override
        public void release() {
            if (lockMode == LockMode.EXCLUSIVE) {
                MongoProcessorLockFactory.this.release(lockId, instanceId);
            }
        }

        @Override
        public String toString() {
            return "MongoProcessorLock[" + lockId + ", " + lockMode + ", " + instanceId + "]";
        }
    }
}
