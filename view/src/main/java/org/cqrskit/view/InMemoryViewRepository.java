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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.cqrskit.aggregate.DomainEvent;
import org.cqrskit.query.View;
import org.jspecify.annotations.NonNull;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A {@link ViewRepository} that keeps views in memory, serialized as JSON documents. Since every load deserializes a new
 * instance, a view that is modified after it was loaded is not changed in the repository until it's saved.
 *
 * @param <V> The type of the view
 * @param <E> The type of the events that the view is built from
 */
public class InMemoryViewRepository<V extends View<E>, E extends DomainEvent> implements ViewRepository<V, E> {

    private final ConcurrentHashMap<String, StoredView> views = new ConcurrentHashMap<>();
    private final Class<V> viewType;
    private final ObjectMapper objectMapper;

    public InMemoryViewRepository(Class<V> viewType) {
        this(viewType, new ObjectMapper());
    }

    public InMemoryViewRepository(Class<V> viewType, ObjectMapper objectMapper) {
        if (viewType == null) throw new IllegalArgumentException("View type cannot be null");
        if (objectMapper == null) throw new IllegalArgumentException(ObjectMapper.class.getSimpleName() + " cannot be null");
        this.viewType = viewType;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<@NonNull V> load(@NonNull String viewInstanceId) {
        return loadWithContext(viewInstanceId).map(LoadedView::view);
    }

    @Override
    public Optional<@NonNull LoadedView<V>> loadWithContext(@NonNull String viewInstanceId) {
        Objects.requireNonNull(viewInstanceId, "View instance id cannot be null");
        StoredView storedView = views.get(viewInstanceId);
        if (storedView == null) {
            return Optional.empty();
        }
        return Optional.of(new LoadedView<>(deserialize(viewInstanceId, storedView.json), new ViewContext(viewInstanceId, storedView.version)));
    }

    @Override
    public void updateView(@NonNull V view, @NonNull ViewContext context) {
        Objects.requireNonNull(view, "View cannot be null");
        Objects.requireNonNull(context, ViewContext.class.getSimpleName() + " cannot be null");
        String json = serialize(context.viewInstanceId(), view);
        views.compute(context.viewInstanceId(), (viewInstanceId, current) -> {
            long currentVersion = current == null ? 0 : current.version;
            if (currentVersion != context.version()) {
                throw new ViewRepositoryException(viewInstanceId, String.format("View %s was expected to be at version %d but was at %d.", viewInstanceId, context.version(), currentVersion));
            }
            return new StoredView(json, context.nextVersion().version());
        });
    }

    /**
     * @return The serialized views keyed by view instance id
     */
    public Map<String, String> getSerializedViews() {
        Map<String, String> result = new ConcurrentHashMap<>();
        views.forEach((id, storedView) -> result.put(id, storedView.json));
        return result;
    }

    private String serialize(String viewInstanceId, V view) {
        try {
            return objectMapper.writeValueAsString(view);
        } catch (JsonProcessingException e) {
            throw new ViewRepositoryException(viewInstanceId, "Failed to serialize view " + viewInstanceId, e);
        }
    }

    private V deserialize(String viewInstanceId, String json) {
        try {
            return objectMapper.readValue(json, viewType);
        } catch (JsonProcessingException e) {
            throw new ViewRepositoryException(viewInstanceId, "Failed to deserialize view " + viewInstanceId, e);
        }
    }

    private static class StoredView {
        private final String json;
        private final long version;

        StoredView(String json, long version) {
            this.json = json;
            this.version = version;
        }
    }
}
