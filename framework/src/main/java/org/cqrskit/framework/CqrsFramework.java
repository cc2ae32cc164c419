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

package org.cqrskit.framework;

import org.cqrskit.aggregate.Aggregate;
import org.cqrskit.aggregate.AggregateConflictException;
import org.cqrskit.aggregate.DomainEvent;
import org.cqrskit.aggregate.UnexpectedAggregateException;
import org.cqrskit.event.EventEnvelope;
import org.cqrskit.query.Query;
import org.cqrskit.query.Reactor;
import org.cqrskit.store.AggregateContext;
import org.cqrskit.store.EventStore;
import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Executes commands against aggregates and distributes the resulting events. A command is executed like this:
 * <ol>
 *     <li>The aggregate is loaded from the {@link EventStore} and the command is handled by the aggregate.</li>
 *     <li>The resulting events are committed as one batch.</li>
 *     <li>The batch is handed to every {@link Reactor}, in registration order. Follow-up events returned by a reactor are committed
 *     as a new batch, and every new batch is handed to the reactors in the same way until no reactor returns any more events.</li>
 *     <li>Every batch committed during the execution is dispatched, in commit order, to every {@link Query} in registration order.</li>
 * </ol>
 * If a reactor throws the aggregate error the cascade stops, the batches committed so far are still dispatched to the queries
 * and then the error is thrown to the caller just like an error from the command handler.
 * <p>
 * Commands are not retried. An {@link AggregateConflictException} from the event store is propagated to the caller, any other
 * runtime failure of the event store is wrapped in an {@link UnexpectedAggregateException}.
 *
 * @param <A>  The type of the aggregate
 * @param <C>  The type of the commands
 * @param <E>  The type of the events
 * @param <X>  The error type of the aggregate
 * @param <S>  The type of the services of the aggregate
 * @param <AC> The type of the aggregate context of the event store
 */
@NullMarked
public class CqrsFramework<A extends Aggregate<C, E, X, S>, C, E extends DomainEvent, X extends Exception, S, AC extends AggregateContext<A>> {
    private static final Logger log = LoggerFactory.getLogger(CqrsFramework.class);

    /**
     * The maximum number of reactor generations that are allowed for one command, a follow-up batch of
     * a reactor on the last generation means that the reactors never settle.
     */
    public static final int DEFAULT_MAX_CASCADE_DEPTH = 10;

    private final EventStore<A, E, AC> store;
    private final List<Query<E>> queries;
    private final List<Reactor<A, E, X, S, AC>> reactors;
    private final S services;
    private final int maxCascadeDepth;

    public CqrsFramework(EventStore<A, E, AC> store, List<? extends Query<E>> queries, S services) {
        this(store, queries, Collections.emptyList(), services);
    }

    public CqrsFramework(EventStore<A, E, AC> store, List<? extends Query<E>> queries, List<? extends Reactor<A, E, X, S, AC>> reactors, S services) {
        this(store, queries, reactors, services, DEFAULT_MAX_CASCADE_DEPTH);
    }

    public CqrsFramework(EventStore<A, E, AC> store, List<? extends Query<E>> queries, List<? extends Reactor<A, E, X, S, AC>> reactors, S services, int maxCascadeDepth) {
        if (store == null) throw new IllegalArgumentException(EventStore.class.getSimpleName() + " cannot be null");
        if (queries == null) throw new IllegalArgumentException("Queries cannot be null");
        if (reactors == null) throw new IllegalArgumentException("Reactors cannot be null");
        if (services == null) throw new IllegalArgumentException("Services cannot be null");
        if (maxCascadeDepth < 1) throw new IllegalArgumentException("Max cascade depth must be greater than zero");
        this.store = store;
        this.queries = List.copyOf(queries);
        this.reactors = List.copyOf(reactors);
        this.services = services;
        this.maxCascadeDepth = maxCascadeDepth;
    }

    /**
     * Execute a command without metadata.
     *
     * @see #executeWithMetadata(String, Object, Map)
     */
    public List<EventEnvelope<E>> execute(String aggregateId, C command) throws X {
        return executeWithMetadata(aggregateId, command, Collections.emptyMap());
    }

    /**
     * Execute a command on an aggregate instance.
     *
     * @param aggregateId The id of the aggregate instance
     * @param command     The command
     * @param metadata    Metadata attached to every event committed during the execution (including events from reactors)
     * @return All envelopes committed during the execution, in commit order
     * @throws X If the command was rejected by the aggregate, or if a reactor failed
     */
    public List<EventEnvelope<E>> executeWithMetadata(String aggregateId, C command, Map<String, String> metadata) throws X {
        Objects.requireNonNull(aggregateId, "Aggregate id cannot be null");
        Objects.requireNonNull(command, "Command cannot be null");
        Objects.requireNonNull(metadata, "Metadata cannot be null");

        AC context = load(aggregateId);
        List<E> events = emptyListIfNull(context.aggregate().handle(command, services));
        List<EventEnvelope<E>> committed = events.isEmpty() ? Collections.emptyList() : commit(aggregateId, events, context, metadata);
        log.debug("Committed {} event(s) for {} {}", committed.size(), context.aggregate().aggregateType(), aggregateId);

        List<List<EventEnvelope<E>>> committedBatches = new ArrayList<>();
        if (!committed.isEmpty()) {
            committedBatches.add(committed);
        }

        Exception reactorFailure = null;
        try {
            react(aggregateId, committed, metadata, committedBatches);
        } catch (Exception e) {
            reactorFailure = e;
        }

        try {
            dispatch(aggregateId, committedBatches);
        } catch (RuntimeException e) {
            if (reactorFailure != null) {
                e.addSuppressed(reactorFailure);
            }
            throw e;
        }

        if (reactorFailure != null) {
            throw asAggregateError(reactorFailure);
        }

        List<EventEnvelope<E>> all = new ArrayList<>();
        committedBatches.forEach(all::addAll);
        return Collections.unmodifiableList(all);
    }

    private void react(String aggregateId, List<EventEnvelope<E>> firstBatch, Map<String, String> metadata, List<List<EventEnvelope<E>>> committedBatches) throws X {
        List<List<EventEnvelope<E>>> generation = firstBatch.isEmpty() || reactors.isEmpty() ? Collections.emptyList() : List.of(firstBatch);
        for (int depth = 0; !generation.isEmpty(); depth++) {
            if (depth == maxCascadeDepth) {
                throw new IllegalStateException(String.format("Reactors for aggregate %s did not settle within %d generations", aggregateId, maxCascadeDepth));
            }
            List<List<EventEnvelope<E>>> nextGeneration = new ArrayList<>();
            for (List<EventEnvelope<E>> events : generation) {
                for (Reactor<A, E, X, S, AC> reactor : reactors) {
                    AC context = load(aggregateId);
                    List<E> followUpEvents = emptyListIfNull(reactor.react(context, aggregateId, services, events));
                    if (!followUpEvents.isEmpty()) {
                        List<EventEnvelope<E>> committed = commit(aggregateId, followUpEvents, context, metadata);
                        log.debug("Reactor {} committed {} follow-up event(s) for {}", reactor.getClass().getName(), committed.size(), aggregateId);
                        committedBatches.add(committed);
                        nextGeneration.add(committed);
                    }
                }
            }
            generation = nextGeneration;
        }
    }

    private AC load(String aggregateId) {
        try {
            return store.loadAggregate(aggregateId);
        } catch (AggregateConflictException | UnexpectedAggregateException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UnexpectedAggregateException(aggregateId, "Failed to load aggregate " + aggregateId, e);
        }
    }

    private List<EventEnvelope<E>> commit(String aggregateId, List<E> events, AC context, Map<String, String> metadata) {
        try {
            return store.commit(events, context, metadata);
        } catch (AggregateConflictException | UnexpectedAggregateException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UnexpectedAggregateException(aggregateId, "Failed to commit " + events.size() + " event(s) for aggregate " + aggregateId, e);
        }
    }

    private void dispatch(String aggregateId, List<List<EventEnvelope<E>>> committedBatches) {
        for (List<EventEnvelope<E>> events : committedBatches) {
            for (Query<E> query : queries) {
                log.debug("Dispatching {} event(s) for {} to {}", events.size(), aggregateId, query.getClass().getName());
                query.dispatch(aggregateId, events);
            }
        }
    }

    // Reactors only declare X, so every checked exception that reaches this point is an X
    @SuppressWarnings("unchecked")
    private X asAggregateError(Exception e) {
        if (e instanceof RuntimeException) {
            throw (RuntimeException) e;
        }
        return (X) e;
    }

    private static <T> List<T> emptyListIfNull(List<T> list) {
        return list == null ? Collections.emptyList() : list;
    }
}
