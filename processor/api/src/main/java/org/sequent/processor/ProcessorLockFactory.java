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

@FunctionalInterface
public interface ProcessorLockFactory {

    /**
     * @param definition The processor to lock
     * @param instanceId The id of the consumer instance that will own the lock
     * @param lockMode   Whether the lock is exclusive or shared
     */
    ProcessorLock create(ProcessorDefinition definition, String instanceId, LockMode lockMode);
}
