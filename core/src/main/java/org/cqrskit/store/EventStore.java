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
import org.cqrskit.aggregate.AggregateConflictException;
import org.cqrskit.aggregate.DomainEvent;
import org.cqrskit.event.EventEnvelope;

import java.util.List;
import java.util.Map;

/**
 * Commits and loads the event streams of one aggregate type.
 *
 * @param <A>  The type of the aggregate
 * @param <E>  The type of the events produced by the aggregate
 * @param <AC> The type of {@link AggregateContext} that this store hands out. It fixes which reactors may be used together with the store.
 */
public interface EventStore<A extends Aggregate<?, E, ?, ?>, E extends DomainEvent, AC extends AggregateContext<A>> {

    /**
     * Load all events committed for an aggregate instance.
     *
     * @param aggregateId The id of the aggregate instance
     * @return The envelopes in ascending sequence order, or an empty list if nothing has been committed
     */
    List<EventEnvelope<E>> loadEvents(String aggregateId);

    /**
     * Load an aggregate instance by applying all of its committed events to a new aggregate.
     *
     * @param aggregateId The id of the aggregate instance
     * @return The context of the aggregate
     */
    AC loadAggregate(String aggregateId);

    /**
     * Commit events for the aggregate instance described by {@code context}, in the supplied order.
     *
     * @param events   The events to commit
     * @param context  The context that was returned when the aggregate was loaded
     * @param metadata Metadata to attach to every committed envelope
     * @return The committed envelopes, in sequence order
     * @throws AggregateConflictException If events were committed for the aggregate after {@code context} was loaded
     */
    List<EventEnvelope<E>> commit(List<E> events, AC context, Map<String, String> metadata);
}
