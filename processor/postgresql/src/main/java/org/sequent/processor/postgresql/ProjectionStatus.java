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

package org.sequent.processor.postgresql;

/**
 * The status of a projection in {@code emt_projections}
 */
public enum ProjectionStatus {
    ACTIVE("active"),
    INACTIVE("inactive"),
    /**
     * An exclusive projector is running, set when its lock is acquired and cleared when it's released
     */
    ASYNC_PROCESSING("async_processing");

    final String value;

    ProjectionStatus(String value) {
        this.value = value;
    }

    static ProjectionStatus parse(String value) {
        for (ProjectionStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown projection status: " + value);
    }
}
