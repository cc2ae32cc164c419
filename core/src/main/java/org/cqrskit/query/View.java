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

/**
 * A materialized view, the read side of a CQRS system. A view is updated by a query (see {@code GenericQuery}),
 * one event at a time in event order.
 * <p>
 * Implementations must have a public no-arg constructor that creates the initial state, must be serializable
 * by Jackson (so that they can be stored by a view repository) and should implement {@code toString}.
 *
 * @param <E> The type of the events that the view is built from
 */
public interface View<E extends DomainEvent> {

    /**
     * Fold an event into the state of this view. This must be a pure function of the current state and the event,
     * so that the view can be rebuilt by replaying its events. Events that the view doesn't care about must be ignored.
     *
     * @param event The event
     */
    void update(EventEnvelope<E> event);
}
