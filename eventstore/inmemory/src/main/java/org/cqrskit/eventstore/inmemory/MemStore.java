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
import org.cqrskit.aggregate.AggregateConflictException;
import org.cqrskit.aggregate.DomainEvent;
import org.cqrskit.event.EventEnvelope;
import org.cqrskit.store.EventStore;
import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static java.util.Objects.requireNonNull;

/**
 * This is an {@link EventStore} that stores events in-memory. This is mainly useful for testing
 * and/or demo purposes and it's the default store used by the test framework.
 *
 * @param <A> The type of the aggregate
 * @param <E> The type of the events
 */
@NullMarked
public class MemStore<A extends Aggregate<?, E, ?, ?>, E extends DomainEvent> implements EventStore<A, E, MemStoreAggregateContext<A>> {
    private static final Logger log = LoggerFactory.getLogger(MemStore.class);

    // We cannot use ConcurrentMap since it doesn't maintain insertion order
    private final Map<String, List<EventEnvelope<E>>> state = Collections.synchronizedMap(new LinkedHashMap<>());

    private final Supplier<A> aggregateFactory;

    /**
     * Create an instance of {@link MemStore}
     *
     * @param aggregateFactory Creates a new aggregate instance that events are applied to when an aggregate is loaded
     */
    public MemStore(Supplier<A> aggregateFactory) {
        if (aggregateFactory == null) {
            throw new IllegalArgumentException("Aggregate factory cannot be null");
        }
        this.aggregateFactory = aggregateFactory;
    }

    @Override
    public List<EventEnvelope<E>> loadEvents(String aggregateId) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        List<EventEnvelope<E>> events = state.get(aggregateId);
        return events == null ? Collections.emptyList() : Collections.unmodifiableList(events);
    }

    @Override
    public MemStoreAggregateContext<A> loadAggregate(String aggregateId) {
        List<EventEnvelope<E>> events = loadEvents(aggregateId);
        A aggregate = newAggregate();
        events.forEach(envelope -> aggregate.apply(envelope.payload()));
        return new MemStoreAggregateContext<>(aggregateId, aggregate, calculateCurrentSequence(events));
    }

    @Override
    public List<EventEnvelope<E>> commit(List<E> events, MemStoreAggregateContext<A> context, Map<String, String> metadata) {
        requireNonNull(events, "Events cannot be null");
        requireNonNull(context, MemStoreAggregateContext.class.getSimpleName() + " cannot be null");
        String aggregateId = context.aggregateId();

        final AtomicReference<List<EventEnvelope<E>>> newEnvelopes = new AtomicReference<>(Collections.emptyList());
        state.compute(aggregateId, (__, currentEvents) -> {
            long currentSequence = calculateCurrentSequence(currentEvents);
            if (currentSequence != context.currentSequence()) {
                throw new AggregateConflictException(aggregateId, context.currentSequence(), currentSequence);
            }

            List<EventEnvelope<E>> envelopes = wrap(aggregateId, currentSequence, events, metadata);
            newEnvelopes.set(envelopes);
            if (envelopes.isEmpty()) {
                return currentEvents;
            }
            List<EventEnvelope<E>> eventList = currentEvents == null ? new ArrayList<>() : new ArrayList<>(currentEvents);
            eventList.addAll(envelopes);
            return eventList;
        });
        log.trace("Committed {} event(s) to {} after sequence {}", newEnvelopes.get().size(), aggregateId, context.currentSequence());
        return newEnvelopes.get();
    }

    /**
     * @return A snapshot of all committed events, grouped by aggregate id in the order that the aggregates were first written
     */
    public Map<String, List<EventEnvelope<E>>> getEvents() {
        synchronized (state) {
            return state.entrySet().stream()
                    .collect(Collectors.toMap(Map.Entry::getKey, e -> List.copyOf(e.getValue()), (v1, v2) -> v2, LinkedHashMap::new));
        }
    }

    private A newAggregate() {
        A aggregate = aggregateFactory.get();
        if (aggregate == null) {
            throw new IllegalStateException("Aggregate factory returned null");
        }
        return aggregate;
    }

    private static <E extends DomainEvent> List<EventEnvelope<E>> wrap(String aggregateId, long currentSequence, List<E> events, Map<String, String> metadata) {
        return LongStream.range(0, events.size())
                .mapToObj(i -> new EventEnvelope<>(aggregateId, currentSequence + i + 1, events.get((int) i), metadata))
                .collect(Collectors.toList());
    }

    private static long calculateCurrentSequence(List<? extends EventEnvelope<?>> events) {
        if (events == null || events.isEmpty()) {
            return 0;
        }
        return events.get(events.size() - 1).sequence();
    }
}
