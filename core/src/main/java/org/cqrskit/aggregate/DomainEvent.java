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

/**
 * A domain event produced by an {@link Aggregate}. Implementations should be immutable and have value equality
 * (records are a natural fit) so that events can be compared in tests.
 */
public interface DomainEvent {

    /**
     * @return A name identifying the type of the event, for example {@code "AccountOpened"}
     */
    String eventType();

    /**
     * @return The version of the event schema, change it when the payload of an event type changes
     */
    default String eventVersion() {
        return "1.0";
    }
}
