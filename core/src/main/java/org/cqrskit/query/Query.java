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

import org.cqrskit.aggregate.DomainEvent;
import org.cqrskit.event.EventEnvelope;
import org.jspecify.annotations.NullMarked;

import java.util.List;

/**
 * A query receives the events of an aggregate instance right after they have been committed. Typical queries
 * <ul>
 *     <li>update materialized views</li>
 *     <li>publish events to a message broker</li>
 *     <li>trigger a command on another aggregate</li>
 * </ul>
 * A query has no way to report failure to the component that dispatched the events. An implementation that cannot
 * complete its work must deal with that itself (log it, retry or put the events on a dead letter queue).
 *
 * @param <E> The type of the events
 */
@NullMarked
@FunctionalInterface
public interface Query<E extends DomainEvent> {

    /**
     * Called immediately after {@code events} have been committed. The method should return when the
     * side effect has been applied (or queued), the next query is not invoked until it does.
     *
     * @param aggregateId The id of the aggregate instance that the events belong to
     * @param events      The committed events, never empty and in commit order
     */
    void dispatch(String aggregateId, List<EventEnvelope<E>> events);
}
