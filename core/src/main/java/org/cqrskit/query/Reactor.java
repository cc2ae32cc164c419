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

package org.cqrskit.query;

import org.cqrskit.aggregate.Aggregate;
import org.cqrskit.aggregate.DomainEvent;
import org.cqrskit.event.EventEnvelope;
import org.cqrskit.store.AggregateContext;
import org.jspecify.annotations.NullMarked;

import java.util.List;

/**
 * A reactor is a step in a saga. It reacts to the committed events of an aggregate instance and coordinates
 * a multi-step business process by returning follow-up events, which are committed to the same aggregate instance.
 * Compensating actions are expressed the same way.
 * <p>
 * A reactor is bound to the {@link AggregateContext} type of an event store, so a reactor written for one
 * store cannot be registered together with a store that hands out another context type.
 *
 * @param <A>  The type of the aggregate
 * @param <E>  The type of the events
 * @param <X>  The error type of the aggregate
 * @param <S>  The type of the services of the aggregate
 * @param <AC> The type of the aggregate context
 */
@NullMarked
@FunctionalInterface
public interface Reactor<A extends Aggregate<?, E, X, S>, E extends DomainEvent, X extends Exception, S, AC extends AggregateContext<A>> {

    /**
     * React to a batch of events that have just been committed.
     *
     * @param context     The aggregate as it was persisted after the events were committed
     * @param aggregateId The id of the aggregate instance
     * @param services    The services of the aggregate
     * @param events      The committed events, in commit order
     * @return The follow-up events in the order they should be committed, an empty list if there's nothing to do
     * @throws X If the process cannot continue. The error is reported in the same way as a rejected command.
     */
    List<E> react(AC context, String aggregateId, S services, List<EventEnvelope<E>> events) throws X;
}
