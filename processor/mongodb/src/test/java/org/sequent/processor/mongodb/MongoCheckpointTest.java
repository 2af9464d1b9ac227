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

import org.bson.BsonDocument;
import org.bson.BsonString;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.sequent.eventstore.api.GlobalPosition;
import org.sequent.eventstore.api.PositionToken;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class MongoCheckpointTest {

    @Test
    void string_form_can_be_parsed_back() {
        // Given
        MongoCheckpoint checkpoint = MongoCheckpoint.of(new BsonDocument("_data", new BsonString("8263F1A2B3000000012B")), 2);

        // When
        MongoCheckpoint parsed = MongoCheckpoint.parse(checkpoint.asString());

        // Then
        assertAll(
                () -> assertThat(checkpoint.asString()).isEqualTo("emt:chkpt:mongodb:8263F1A2B3000000012B:2"),
                () -> assertThat(parsed).isEqualTo(checkpoint),
                () -> assertThat(parsed.resumeTokenDocument()).isEqualTo(new BsonDocument("_data", new BsonString("8263F1A2B3000000012B")))
        );
    }

    @Test
    void checkpoints_are_ordered_by_unsigned_resume_token_bytes_and_then_by_index() {
        // Given
        MongoCheckpoint low = new MongoCheckpoint("7F00", 5);
        MongoCheckpoint high = new MongoCheckpoint("8000", 0);
        MongoCheckpoint higherIndex = new MongoCheckpoint("8000", 1);

        // Then
        assertAll(
                () -> assertThat(low.compareTo(high)).isNegative(),
                () -> assertThat(high.compareTo(higherIndex)).isNegative(),
                () -> assertThat(higherIndex.compareTo(new MongoCheckpoint("8000", 1))).isZero(),
                () -> assertThat(PositionToken.isAtOrBefore(low, high)).isTrue()
        );
    }

    @Test
    void rejects_malformed_checkpoints() {
        // When
        Throwable wrongPrefix = catchThrowable(() -> MongoCheckpoint.parse("emt:chkpt:postgres:1:0"));
        Throwable missingIndex = catchThrowable(() -> MongoCheckpoint.parse("emt:chkpt:mongodb:8263"));
        Throwable negativeIndex = catchThrowable(() -> new MongoCheckpoint("8263", -1));

        // Then
        assertAll(
                () -> assertThat(wrongPrefix).isInstanceOf(IllegalArgumentException.class),
                () -> assertThat(missingIndex).isInstanceOf(IllegalArgumentException.class),
                () -> assertThat(negativeIndex).isInstanceOf(IllegalArgumentException.class)
        );
    }

    @Test
    void cannot_be_compared_with_global_positions() {
        // When
        Throwable throwable = catchThrowable(() -> new MongoCheckpoint("8263", 0).compareTo(GlobalPosition.of(1)));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class);
    }
}
