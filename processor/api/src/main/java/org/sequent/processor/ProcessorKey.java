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

import static java.util.Objects.requireNonNull;

/**
 * Identifies the checkpoint and lock of a processor.
 */
public record ProcessorKey(String processorId, String partition, int version) {

    public ProcessorKey {
        requireNonNull(processorId, "processorId cannot be null");
        requireNonNull(partition, "partition cannot be null");
        if (version < 1) {
            throw new IllegalArgumentException("version must be greater than 0");
        }
    }
}
