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

import java.util.StringJoiner;

/**
 * An event store failed to load or commit events for a reason other than a conflict, for example because
 * stored data could not be read back.
 */
public class UnexpectedAggregateException extends RuntimeException {
    public final String aggregateId;

    public UnexpectedAggregateException(String aggregateId, String message) {
        super(message);
        this.aggregateId = aggregateId;
    }

    public UnexpectedAggregateException(String aggregateId, String message, Throwable cause) {
        super(message, cause);
        this.aggregateId = aggregateId;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", UnexpectedAggregateException.class.getSimpleName() + "[", "]")
                .add("aggregateId='" + aggregateId + "'")
                .add("message=" + getMessage())
                .toString();
    }
}
