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

/**
 * Thrown when the lock of a processor is held by another instance and the {@link LockPolicy} is {@link LockPolicy#fail()}
 */
public class LockAcquisitionFailedException extends RuntimeException {
    public final String processorId;

    public LockAcquisitionFailedException(String processorId) {
        super("Failed to acquire lock for processor '" + processorId + "'");
        this.processorId = processorId;
    }
}
