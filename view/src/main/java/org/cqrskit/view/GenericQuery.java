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
import org.cqrskit.event.EventEnvelope;
import org.cqrskit.query.Query;
import org.cqrskit.query.View;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * A {@link Query} that keeps one view instance per aggregate instance up to date. For every dispatch the view is loaded from
 * a {@link ViewRepository} (or created if it doesn't exist), each event is applied using {@link View#update(EventEnvelope)}
 * and the view is saved again.
 * <p>
 * Failures to load or save the view are never propagated to the dispatcher. They are logged and handed to the error handler
 * (if any), see {@link #withErrorHandler(Consumer)}.
 *
 * @param <V> The type of the view
 * @param <E> The type of the events
 */
public class GenericQuery<V extends View<E>, E extends DomainEvent> implements Query<E> {
    private static final Logger log = LoggerFactory.getLogger(GenericQuery.class);

    private final ViewRepository<V, E> viewRepository;
    private final Supplier<V> viewFactory;
    private final Consumer<ViewRepositoryException> errorHandler;

    /**
     * @param viewRepository The repository that stores the views
     * @param viewFactory    Creates the initial view, typically the no-arg constructor of the view
     */
    public GenericQuery(ViewRepository<V, E> viewRepository, Supplier<V> viewFactory) {
        this(viewRepository, viewFactory, __ -> {
        });
    }

    private GenericQuery(ViewRepository<V, E> viewRepository, Supplier<V> viewFactory, Consumer<ViewRepositoryException> errorHandler) {
        if (viewRepository == null) throw new IllegalArgumentException(ViewRepository.class.getSimpleName() + " cannot be null");
        if (viewFactory == null) throw new IllegalArgumentException("View factory cannot be null");
        this.viewRepository = viewRepository;
        this.viewFactory = viewFactory;
        this.errorHandler = errorHandler;
    }

    /**
     * @return A new {@code GenericQuery} that calls {@code errorHandler} when a view cannot be loaded or saved
     */
    public GenericQuery<V, E> withErrorHandler(Consumer<ViewRepositoryException> errorHandler) {
        Objects.requireNonNull(errorHandler, "Error handler cannot be null");
        return new GenericQuery<>(viewRepository, viewFactory, errorHandler);
    }

    @Override
    public void dispatch(String viewInstanceId, List<EventEnvelope<E>> events) {
        try {
            ViewRepository.LoadedView<V> loadedView = viewRepository.loadWithContext(viewInstanceId)
                    .orElseGet(() -> new ViewRepository.LoadedView<>(viewFactory.get(), ViewContext.initial(viewInstanceId)));
            V view = loadedView.view();
            for (EventEnvelope<E> event : events) {
                view.update(event);
            }
            viewRepository.updateView(view, loadedView.context());
            log.debug("Updated view {} with {} event(s)", viewInstanceId, events.size());
        } catch (ViewRepositoryException e) {
            log.warn("Failed to update view {}: {}", viewInstanceId, e.getMessage(), e);
            errorHandler.accept(e);
        }
    }

    /**
     * Load a view instance without dispatching any events.
     *
     * @return The view or an empty {@code Optional} if it doesn't exist or cannot be loaded
     */
    public Optional<V> load(String viewInstanceId) {
        try {
            return viewRepository.load(viewInstanceId);
        } catch (ViewRepositoryException e) {
            log.warn("Failed to load view {}: {}", viewInstanceId, e.getMessage(), e);
            errorHandler.accept(e);
            return Optional.empty();
        }
    }
}
