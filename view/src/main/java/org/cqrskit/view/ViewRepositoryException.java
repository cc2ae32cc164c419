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

import java.util.StringJoiner;

/**
 * A {@link ViewRepository} failed to load or save a view.
 */
public class ViewRepositoryException extends RuntimeException {
    public final String viewInstanceId;

    public ViewRepositoryException(String viewInstanceId, String message) {
        super(message);
        this.viewInstanceId = viewInstanceId;
    }

    public ViewRepositoryException(String viewInstanceId, String message, Throwable cause) {
        super(message, cause);
        this.viewInstanceId = viewInstanceId;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ViewRepositoryException.class.getSimpleName() + "[", "]")
                .add("viewInstanceId='" + viewInstanceId + "'")
                .add("message=" + getMessage())
                .toString();
    }
}
