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
 * A lock that decides which consumer instance may run a processor.
 */
public interface ProcessorLock {

    /**
     * Acquire the lock, or refresh it if it's already held by this instance.
     *
     * @return {@code true} if this instance holds the lock
     */
    boolean tryAcquire();

    /**
     * Release the lock if it's held by this instance, otherwise this is a no-op.
     */
    void release();
}
