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

package org.cqrskit.event;

import org.cqrskit.aggregate.DomainEvent;

import java.util.Map;
import java.util.Objects;

/**
 * An immutable record of one committed event together with the id of the aggregate instance it belongs to,
 * its position in the aggregate's event stream and arbitrary metadata (for example a correlation id).
 * <p>
 * Envelopes belonging to one aggregate are always handed to queries and reactors in ascending {@code sequence} order.
 *
 * @param aggregateId The id of the aggregate instance
 * @param sequence    The position of the event in the aggregate's event stream, the first event has sequence {@code 1}
 * @param payload     The domain event
 * @param metadata    Metadata that was supplied when the event was committed
 * @param <E>         The type of the domain event
 */
public record EventEnvelope<E extends DomainEvent>(String aggregateId, long sequence, E payload, Map<String, String> metadata) {

    public EventEnvelope {
        Objects.requireNonNull(aggregateId, "Aggregate id cannot be null");
        Objects.requireNonNull(payload, "Payload cannot be null");
        if (aggregateId.isBlank()) {
            throw new IllegalArgumentException("Aggregate id cannot be blank");
        }
        if (sequence < 1) {
            throw new IllegalArgumentException("Sequence must be greater than zero but was " + sequence);
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public EventEnvelope(String aggregateId, long sequence, E payload) {
        this(aggregateId, sequence, payload, Map.of());
    }
}
