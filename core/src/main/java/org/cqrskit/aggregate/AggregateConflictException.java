/*
 *
 *  Copyright 2025 Johan Haleby
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package org.cqrskit.aggregate;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * The events have not been committed since the aggregate was changed by someone else after it was loaded.
 * This is an optimistic locking failure, the command can normally be retried after reloading the aggregate.
 */
public class AggregateConflictException extends RuntimeException {
    public final String aggregateId;
    public final long expectedSequence;
    public final long actualSequence;

    public AggregateConflictException(String aggregateId, long expectedSequence, long actualSequence) {
        super(String.format("Aggregate %s was expected to be at sequence %d but was at %d.", aggregateId, expectedSequence, actualSequence));
        this.aggregateId = aggregateId;
        this.expectedSequence = expectedSequence;
        this.actualSequence = actualSequence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateConflictException)) return false;
        AggregateConflictException that = (AggregateConflictException) o;
        return expectedSequence == that.expectedSequence && actualSequence == that.actualSequence && Objects.equals(aggregateId, that.aggregateId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, expectedSequence, actualSequence);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", AggregateConflictException.class.getSimpleName() + "[", "]")
                .add("aggregateId='" + aggregateId + "'")
                .add("expectedSequence=" + expectedSequence)
                .add("actualSequence=" + actualSequence)
                .toString();
    }
}
