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

import com.mongodb.MongoException;
import com.mongodb.MongoNotPrimaryException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.ServerAddress;
import org.bson.BsonDocument;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class MongoChangeStreamFeedErrorsTest {

    @Test
    void network_and_server_selection_errors_interrupt_the_change_stream() {
        ServerAddress serverAddress = new ServerAddress("localhost", 27017);

        assertAll(
                () -> assertThat(MongoChangeStreamFeed.isMongoUnavailable(new MongoSocketException("connection reset", serverAddress))).isTrue(),
                () -> assertThat(MongoChangeStreamFeed.isMongoUnavailable(new MongoTimeoutException("no server available"))).isTrue(),
                () -> assertThat(MongoChangeStreamFeed.isMongoUnavailable(new MongoNotPrimaryException(new BsonDocument(), serverAddress))).isTrue()
        );
    }

    @Test
    void errors_labelled_as_resumable_interrupt_the_change_stream() {
        // Given
        MongoException error = new MongoException(280, "change stream failed");
        error.addLabel("ResumableChangeStreamError");

        // When
        boolean unavailable = MongoChangeStreamFeed.isMongoUnavailable(error);

        // Then
        assertThat(unavailable).isTrue();
    }

    @Test
    void other_errors_are_not_retried() {
        assertAll(
                () -> assertThat(MongoChangeStreamFeed.isMongoUnavailable(new MongoException(2, "bad value"))).isFalse(),
                () -> assertThat(MongoChangeStreamFeed.isMongoUnavailable(new IllegalStateException("boom"))).isFalse()
        );
    }
}
