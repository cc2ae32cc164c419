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

package org.cqrskit.store;

import org.cqrskit.aggregate.Aggregate;

/**
 * Read-only access to an aggregate instance as it was last persisted. Returned by {@link EventStore#loadAggregate(String)}
 * and passed back to {@link EventStore#commit(java.util.List, AggregateContext, java.util.Map)} so that the store can detect
 * concurrent modifications. Event stores may return their own context type carrying store specific information.
 *
 * @param <A> The type of the aggregate
 */
public interface AggregateContext<A extends Aggregate<?, ?, ?, ?>> {

    /**
     * @return The id of the aggregate instance
     */
    String aggregateId();

    /**
     * @return The aggregate, rebuilt from all events committed up to {@link #currentSequence()}
     */
    A aggregate();

    /**
     * @return The sequence of the last committed event, {@code 0} if no events have been committed
     */
    long currentSequence();
}
