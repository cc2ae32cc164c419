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

package org.cqrskit.view;

import java.util.Objects;

/**
 * Identifies a stored view and the version it had when it was loaded, so that a {@link ViewRepository} can detect
 * concurrent updates.
 *
 * @param viewInstanceId The id of the view instance, normally the id of the aggregate instance that the view is built from
 * @param version        The number of times the view has been updated, {@code 0} for a view that has never been stored
 */
public record ViewContext(String viewInstanceId, long version) {

    public ViewContext {
        Objects.requireNonNull(viewInstanceId, "View instance id cannot be null");
        if (version < 0) {
            throw new IllegalArgumentException("Version cannot be negative");
        }
    }

    public static ViewContext initial(String viewInstanceId) {
        return new ViewContext(viewInstanceId, 0);
    }

    public ViewContext nextVersion() {
        return new ViewContext(viewInstanceId, version + 1);
    }
}
