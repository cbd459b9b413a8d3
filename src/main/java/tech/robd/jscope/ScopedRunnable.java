/*
 [File Info]
 path: src/main/java/tech/robd/jscope/ScopedRunnable.java
 description: Functional interface for a unit of work submitted to a VisibilityScope.
 license: Apache-2.0
 editable: yes
 structured: yes
 author: Rob Deas
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

package tech.robd.jscope;

import org.jspecify.annotations.NonNull;

/**
 * Work owned by a {@link VisibilityScope}.
 * <p>
 * The body receives its {@link TaskContext} explicitly so it can check for cancellation and
 * use the cancellable blocking calls of the context.
 * </p>
 *
 * <pre>{@code
 * scope.submit(task -> {
 *     while (!task.isCancelled()) {
 *         refresh();
 *         task.delay(1_000);
 *     }
 * });
 * }</pre>
 *
 * @author Rob Deas
 * @since 0.1.0
 */
@FunctionalInterface
public interface ScopedRunnable {

    // [🧩 Section: api]

    /**
     * Run this work.
     *
     * @param task context of the running task
     * @throws Exception on failure; the failure completes the task's handle and is never seen by
     *                   the submitter. Throw {@link java.util.concurrent.CancellationException}
     *                   to end the task as cancelled.
     */
    void run(@NonNull TaskContext task) throws Exception;
    // [/🧩 Section: api]
}
