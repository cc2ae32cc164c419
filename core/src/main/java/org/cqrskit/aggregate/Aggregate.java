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

import org.jspecify.annotations.NullMarked;

import java.util.List;

/**
 * An aggregate is the unit of consistency in an event sourced system. It decides which events a command results in
 * and evolves its own state by applying those events, one at a time and in sequence order.
 * <p>
 * Instances are created from a {@code Supplier} (for example a no-arg constructor reference) and are rebuilt from
 * their event history whenever they are loaded from an event store.
 *
 * @param <C> The type of commands that the aggregate handles
 * @param <E> The type of events that the aggregate produces
 * @param <X> The aggregate specific error, thrown when a command (or a reactor acting on behalf of the aggregate) is rejected
 * @param <S> The type of the services that the aggregate needs in order to handle commands
 */
@NullMarked
public interface Aggregate<C, E extends DomainEvent, X extends Exception, S> {

    /**
     * @return The name of the aggregate type, used to group event streams in the event store
     */
    String aggregateType();

    /**
     * Handle a command. This method must not change the state of the aggregate, state changes only happen in {@link #apply(DomainEvent)}.
     *
     * @param command  The command to handle
     * @param services The services that the aggregate may use while handling the command
     * @return The resulting events, in the order they should be committed. An empty list means "nothing happened".
     * @throws X If the command is rejected
     */
    List<E> handle(C command, S services) throws X;

    /**
     * Evolve the state of the aggregate by applying an event.
     *
     * @param event The event to apply
     */
    void apply(E event);
}
