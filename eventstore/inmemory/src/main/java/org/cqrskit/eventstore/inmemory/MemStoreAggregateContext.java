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

package org.cqrskit.eventstore.inmemory;

import org.cqrskit.aggregate.Aggregate;
import org.cqrskit.store.AggregateContext;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * The {@link AggregateContext} handed out by {@link MemStore}.
 *
 * @param <A> The type of the aggregate
 */
public class MemStoreAggregateContext<A extends Aggregate<?, ?, ?, ?>> implements AggregateContext<A> {
    private final String aggregateId;
    private final A aggregate;
    private final long currentSequence;

    public MemStoreAggregateContext(String aggregateId, A aggregate, long currentSequence) {
        Objects.requireNonNull(aggregateId, "Aggregate id cannot be null");
        Objects.requireNonNull(aggregate, "Aggregate cannot be null");
        if (currentSequence < 0) {
            throw new IllegalArgumentException("Current sequence cannot be negative");
        }
        this.aggregateId = aggregateId;
        this.aggregate = aggregate;
        this.currentSequence = currentSequence;
    }

    /**
     * Create a context for an aggregate instance that has no committed events.
     */
    public static <A extends Aggregate<?, ?, ?, ?>> MemStoreAggregateContext<A> empty(String aggregateId, Supplier<A> aggregateFactory) {
        Objects.requireNonNull(aggregateFactory, "Aggregate factory cannot be null");
        return new MemStoreAggregateContext<>(aggregateId, aggregateFactory.get(), 0);
    }

    @Override
    public String aggregateId() {
        return aggregateId;
    }

    @Override
    public A aggregate() {
        return aggregate;
    }

    @Override
    public long currentSequence() {
        return currentSequence;
    }

    @Override
    public String toString() {
        return "MemStoreAggregateContext{" +
                "aggregateId='" + aggregateId + '\'' +
                ", aggregate=" + aggregate +
                ", currentSequence=" + currentSequence +
                '}';
    }
}
