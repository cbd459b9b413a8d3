/*
 [File Info]
 path: src/main/java/tech/robd/jscope/TaskOptions.java
 description: Immutable submission configuration: dispatch mode, optional key, name, priority
              hint and dispatcher preference. Wither-style construction.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
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
import org.jspecify.annotations.Nullable;
import tech.robd.jscope.advanced.Dispatcher;

/**
 * How a piece of work is to be submitted to a {@link VisibilityScope}.
 *
 * <p>Every combination of mode, key, priority and dispatcher goes through the one
 * {@link VisibilityScope#submit(TaskOptions, ScopedRunnable)} operation:</p>
 * <pre>{@code
 * scope.submit(TaskOptions.keyed("search").withPriority(TaskPriority.HIGH), task -> search(task));
 * scope.submit(TaskOptions.detached().withDispatcher(io), task -> sync(task));
 * }</pre>
 *
 * @param mode       dispatch mode (non-null)
 * @param key        identity for keyed submission; a new task under an equal key cancels and
 *                   replaces the previous one. {@code null} for an anonymous task
 * @param name       human-readable task name used in traces and thread names, or {@code null}
 * @param priority   priority hint, or {@code null} to inherit (normal/immediate) or use none
 * @param dispatcher execution-context preference, or {@code null} to inherit (normal/immediate)
 *                   or use the scope's default dispatcher
 */
public record TaskOptions(
        @NonNull DispatchMode mode,
        @Nullable Object key,
        @Nullable String name,
        @Nullable TaskPriority priority,
        @Nullable Dispatcher dispatcher
) {

    private static final TaskOptions DEFAULTS = new TaskOptions(DispatchMode.NORMAL, null, null, null, null);

    public TaskOptions {
        if (mode == null) throw new IllegalArgumentException("mode == null");
    }

    // 🧩 Section: factories

    /**
     * @return anonymous, normal-mode options with nothing set
     */
    public static TaskOptions defaults() {
        return DEFAULTS;
    }

    /**
     * @param key non-null task identity
     * @return normal-mode options for a keyed task
     */
    public static TaskOptions keyed(@NonNull Object key) {
        return DEFAULTS.withKey(key);
    }

    /**
     * @return options for a detached task
     */
    public static TaskOptions detached() {
        return DEFAULTS.withMode(DispatchMode.DETACHED);
    }

    /**
     * @return options for an immediate task
     */
    @Experimental
    public static TaskOptions immediate() {
        return DEFAULTS.withMode(DispatchMode.IMMEDIATE);
    }
    // [/🧩 Section: factories]

    // 🧩 Section: withers
    public TaskOptions withMode(@NonNull DispatchMode mode) {
        return new TaskOptions(mode, key, name, priority, dispatcher);
    }

    /**
     * @param key non-null task identity
     * @return a copy with the key set
     * @throws IllegalArgumentException if {@code key} is null; use {@link #anonymous()} instead
     */
    public TaskOptions withKey(@NonNull Object key) {
        if (key == null) throw new IllegalArgumentException("key == null");
        return new TaskOptions(mode, key, name, priority, dispatcher);
    }

    public TaskOptions anonymous() {
        return new TaskOptions(mode, null, name, priority, dispatcher);
    }

    public TaskOptions withName(@Nullable String name) {
        return new TaskOptions(mode, key, name, priority, dispatcher);
    }

    public TaskOptions withPriority(@Nullable TaskPriority priority) {
        return new TaskOptions(mode, key, name, priority, dispatcher);
    }

    public TaskOptions withDispatcher(@Nullable Dispatcher dispatcher) {
        return new TaskOptions(mode, key, name, priority, dispatcher);
    }
    // [/🧩 Section: withers]

    /**
     * @return {@code true} if a key is set
     */
    public boolean isKeyed() {
        return key != null;
    }
}
