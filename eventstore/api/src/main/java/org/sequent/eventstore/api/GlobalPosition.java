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

package org.sequent.eventstore.api;

import java.util.Objects;

/**
 * A {@link PositionToken} backed by a monotonically increasing global sequence number.
 */
public record GlobalPosition(long value) implements PositionToken {
    private static final String FORMAT = "%019d";

    public GlobalPosition {
        if (value < 0) {
            throw new IllegalArgumentException("Global position cannot be negative");
        }
    }

    public static GlobalPosition of(long value) {
        return new GlobalPosition(value);
    }

    public static GlobalPosition parse(String value) {
        Objects.requireNonNull(value, "value cannot be null");
        try {
            return new GlobalPosition(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid global position: " + value, e);
        }
    }

    /**
     * @return The global position as a fixed-width zero-padded string, which sorts lexicographically in the same
     * order as the numbers themselves.
     */
    @Override
    public String asString() {
        return String.format(FORMAT, value);
    }

    @Override
    public int compareTo(PositionToken other) {
        if (!(other instanceof GlobalPosition globalPosition)) {
            throw new IllegalStateException("Type of tokens is not comparable: " + getClass().getSimpleName() + " and " + other.getClass().getSimpleName());
        }
        return Long.compare(value, globalPosition.value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
