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

public enum ProcessorStatus {
    /**
     * Not started, or started without acquiring its lock
     */
    IDLE,
    ACTIVE,
    /**
     * Stopped by the consumer, by a {@link MessageHandlerResult.Stop} result or by the stop condition of the processor
     */
    STOPPED,
    /**
     * Stopped because the handler threw an exception or the checkpoint couldn't be stored
     */
    FAILED
}
