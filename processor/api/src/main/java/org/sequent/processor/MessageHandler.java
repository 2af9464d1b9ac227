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

/**
 * Handles a message delivered to a reactor. Throwing an exception stops the processor without storing a checkpoint for the message.
 */
@FunctionalInterface
public interface MessageHandler {

    MessageHandlerResult handle(RecordedMessage message) throws Exception;
}
