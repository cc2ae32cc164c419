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

import org.cqrskit.aggregate.DomainEvent;
import org.cqrskit.query.View;
import org.jspecify.annotations.NonNull;

import java.util.Optional;

/**
 * Finds and saves view instances.
 *
 * @param <V> The type of the view
 * @param <E> The type of the events that the view is built from
 */
public interface ViewRepository<V extends View<E>, E extends DomainEvent> {

    /**
     * @return The stored view, or an empty {@code Optional} if the view has never been saved
     * @throws ViewRepositoryException If the view could not be loaded
     */
    Optional<@NonNull V> load(@NonNull String viewInstanceId);

    /**
     * @return The stored view together with its context, or an empty {@code Optional} if the view has never been saved
     * @throws ViewRepositoryException If the view could not be loaded
     */
    Optional<@NonNull LoadedView<V>> loadWithContext(@NonNull String viewInstanceId);

    /**
     * Save a view. {@code context} must be the context returned by {@link #loadWithContext(String)} (or {@link ViewContext#initial(String)}
     * for a new view) since the repository uses its version to detect concurrent updates.
     *
     * @throws ViewRepositoryException If the view could not be saved
     */
    void updateView(@NonNull V view, @NonNull ViewContext context);

    /**
     * A view together with the context it was loaded with.
     */
    record LoadedView<V>(V view, ViewContext context) {
    }
}
