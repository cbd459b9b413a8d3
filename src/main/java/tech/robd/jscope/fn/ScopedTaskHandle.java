/*
 [File Info]
 path: src/main/java/tech/robd/jscope/fn/ScopedTaskHandle.java
 description: Read-and-cancel view of work dispatched by a VisibilityScope.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
 [/File Info]
*/

/*
 * Copyright (c) 2025 Rob Deas Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package tech.robd.jscope.fn;

import org.jspecify.annotations.Nullable;
import tech.robd.jscope.DispatchMode;

import java.util.concurrent.CompletableFuture;

/**
 * A handle to work that a scope has already handed to a dispatcher.
 *
 * <p>Supports:
 * <ul>
 *   <li>Best-effort cancellation via {@link #cancel()}; safe to repeat.</li>
 *   <li>State inspection with {@link #isActive()}, {@link #isCompleted()} and {@link #isCancelled()}.</li>
 *   <li>{@link #completion()}, which completes normally whatever the outcome.</li>
 * </ul>
 *
 * <p>Submission is fire-and-forget, so handles are only reachable through the scope's
 * introspection methods and through {@link tech.robd.jscope.advanced.Dispatcher}.</p>
 */
public interface ScopedTaskHandle {

    /**
     * Request cancellation of the work.
     *
     * @return {@code true} if this call made the request, {@code false} if it had already been made
     */
    boolean cancel();

    /**
     * @return {@code true} while the work has neither finished nor been asked to cancel
     */
    boolean isActive();

    /**
     * @return {@code true} once the handle has settled (success, failure or cancellation)
     */
    boolean isCompleted();

    /**
     * @return {@code true} once cancellation has been requested
     */
    boolean isCancelled();

    /**
     * @return a future that completes with {@code null} when the handle settles, for any reason
     */
    CompletableFuture<Void> completion();

    /**
     * @return the key the work was submitted under, or {@code null} for anonymous work
     */
    @Nullable Object key();

    /**
     * @return the task name; generated when none was given
     */
    String name();

    /**
     * @return the mode the work was dispatched with
     */
    DispatchMode mode();
}
