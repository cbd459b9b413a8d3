/*
 [File Info]
 path: src/main/java/tech/robd/jscope/VisibilityScope.java
 description: Reference-counted cancellation scope. Observers activate and deactivate it; work
              submitted while observed is dispatched and tracked, work submitted while
              unobserved is dropped, and the last deactivation cancels everything tracked.
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.robd.jscope.advanced.Dispatcher;
import tech.robd.jscope.diagnostics.Diagnostics;
import tech.robd.jscope.fn.ScopedTaskHandle;
import tech.robd.jscope.internal.ScopedTask;
import tech.robd.jscope.internal.ScopedTaskHandleImpl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A cancellation scope whose lifetime follows a count of active observers.
 *
 * <p>Observers call {@link #activate()} when they become active and {@link #deactivate()} when
 * they stop, or hold an {@link Observation} from {@link #observe()} that pairs the two. While at
 * least one observer is active, {@link #submit(TaskOptions, ScopedRunnable)} dispatches work and
 * keeps its handle. When the count returns to zero every kept handle is cancelled and forgotten
 * before {@code deactivate()} returns. Work submitted while no observer is active never runs.</p>
 *
 * <pre>{@code
 * VisibilityScope scope = VisibilityScope.create();
 * try (Observation shown = scope.observe()) {
 *     scope.submit(task -> poll(task));                      // anonymous
 *     scope.submit("search", task -> search(task, query));   // keyed: replaces an earlier "search"
 * }                                                          // both cancelled here
 * }</pre>
 *
 * <h2>Keyed work</h2>
 * <p>At most one task is kept per key. Submitting under a key that already has a task cancels
 * that task first, then dispatches the new one.</p>
 *
 * <h2>Thread-safety</h2>
 * <p>{@code activate}, {@code deactivate} and {@code submit} are serialised on one lock, so a
 * scope may be shared between threads. Cancellation is a request: the scope never waits for
 * cancelled work to stop. Finished work removes itself from the scope without taking the lock.</p>
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public final class VisibilityScope {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(VisibilityScope.class);
    private static final Logger LOG = LoggerFactory.getLogger(VisibilityScope.class);
    private static final AtomicInteger COUNTER = new AtomicInteger();
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final String name;
    private final int scopeId = System.identityHashCode(this);
    private final Dispatcher dispatcher;
    private final ImbalancePolicy imbalancePolicy;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicInteger violations = new AtomicInteger();

    // mutated under lock; pruning of settled handles removes without it
    private int observerCount;
    private final ConcurrentLinkedQueue<ScopedTaskHandleImpl> anonymousTasks = new ConcurrentLinkedQueue<>();
    private final ConcurrentMap<Object, ScopedTaskHandleImpl> keyedTasks = new ConcurrentHashMap<>();
    // [/🧩 Section: state]

    // 🧩 Section: construction
    private VisibilityScope(Builder builder) {
        this.name = Objects.requireNonNullElseGet(builder.name, () -> "scope-" + COUNTER.incrementAndGet());
        this.dispatcher = Objects.requireNonNullElseGet(builder.dispatcher, Dispatcher::shared);
        this.imbalancePolicy = Objects.requireNonNullElseGet(builder.imbalancePolicy, ImbalancePolicy::fromEnvironment);
        DIAG.debug("scope#{} created name={} dispatcher={} policy={}", scopeId, name, dispatcher, imbalancePolicy);
    }

    /**
     * @return an unobserved scope on the shared dispatcher with the environment's imbalance policy
     */
    public static VisibilityScope create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configures a {@link VisibilityScope}. Unset values fall back to a generated name,
     * {@link Dispatcher#shared()} and {@link ImbalancePolicy#fromEnvironment()}.
     */
    public static final class Builder {
        private @Nullable String name;
        private @Nullable Dispatcher dispatcher;
        private @Nullable ImbalancePolicy imbalancePolicy;

        private Builder() {
        }

        public Builder name(@Nullable String name) {
            this.name = name;
            return this;
        }

        /**
         * @param dispatcher where work runs when its options name no dispatcher and nothing is inherited
         */
        public Builder dispatcher(@Nullable Dispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder imbalancePolicy(@Nullable ImbalancePolicy policy) {
            this.imbalancePolicy = policy;
            return this;
        }

        public VisibilityScope build() {
            return new VisibilityScope(this);
        }
    }
    // [/🧩 Section: construction]

    // 🧩 Section: observers

    /**
     * Record one more active observer.
     */
    public void activate() {
        lock.lock();
        try {
            observerCount++;
            DIAG.debug("scope#{} activate -> observers={}", scopeId, observerCount);
            flush();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record one fewer active observer. When the count reaches zero every kept task is
     * cancelled and forgotten before this method returns.
     *
     * <p>A call with no matching {@link #activate()} leaves the count at zero, is logged at WARN
     * and counted in {@link #violationCount()}.</p>
     *
     * @throws ObserverImbalanceException for an unmatched call under {@link ImbalancePolicy#FAIL_FAST},
     *                                    after the count has been clamped
     */
    public void deactivate() {
        boolean unmatched = false;
        lock.lock();
        try {
            observerCount--;
            if (observerCount < 0) {
                unmatched = true;
                observerCount = 0;
                LOG.warn("Scope '{}': deactivate() without matching activate(); observer count clamped to 0 (violation #{})",
                        name, violations.incrementAndGet());
            }
            DIAG.debug("scope#{} deactivate -> observers={}", scopeId, observerCount);
            flush();
        } finally {
            lock.unlock();
        }
        if (unmatched && imbalancePolicy == ImbalancePolicy.FAIL_FAST) {
            throw new ObserverImbalanceException(name);
        }
    }

    /**
     * Activate the scope and return the binding that deactivates it.
     *
     * @return an open observation; close it when the observer stops being active
     */
    public Observation observe() {
        activate();
        return new Observation(this);
    }
    // [/🧩 Section: observers]

    // 🧩 Section: submit

    /**
     * Dispatch anonymous work with default options.
     *
     * @see #submit(TaskOptions, ScopedRunnable)
     */
    public void submit(@NonNull ScopedRunnable work) {
        submit(TaskOptions.defaults(), work);
    }

    /**
     * Dispatch keyed work with otherwise default options.
     *
     * @see #submit(TaskOptions, ScopedRunnable)
     */
    public void submit(@NonNull Object key, @NonNull ScopedRunnable work) {
        if (key == null) throw new IllegalArgumentException("key == null");
        submit(TaskOptions.keyed(key), work);
    }

    /**
     * Submit work to this scope.
     *
     * <ul>
     *   <li>No active observer: the work is dropped and never runs.</li>
     *   <li>Anonymous: the work is dispatched and its handle kept.</li>
     *   <li>Keyed: a task already kept under an equal key is cancelled first; the new work is
     *   then dispatched and replaces it.</li>
     * </ul>
     * <p>The caller learns nothing about the outcome of the work. For
     * {@link DispatchMode#IMMEDIATE} this method returns once the work reaches its first
     * suspension point or finishes; otherwise it returns without waiting.</p>
     *
     * @param options how to dispatch
     * @param work    the work
     * @throws IllegalArgumentException if either argument is null
     */
    public void submit(@NonNull TaskOptions options, @NonNull ScopedRunnable work) {
        if (options == null) throw new IllegalArgumentException("options == null");
        if (work == null) throw new IllegalArgumentException("work == null");

        final ScopedTaskHandleImpl handle;
        final boolean awaitPrefix;
        lock.lock();
        try {
            if (observerCount == 0) {
                DIAG.debug("scope#{} submit dropped: no active observer (key={})", scopeId, options.key());
                return;
            }

            // 🧩 Point: submit/resolve-context
            TaskContext ambient = options.mode() == DispatchMode.DETACHED ? null : TaskContext.current();
            Dispatcher target = options.dispatcher() != null ? options.dispatcher()
                    : ambient != null ? ambient.dispatcher() : dispatcher;
            TaskPriority priority = options.priority() != null ? options.priority()
                    : ambient != null ? ambient.priority() : null;

            // 🧩 Point: submit/supersede
            // cancel callbacks run on this thread and may re-enter the scope: detach before
            // cancelling, and loop in case a callback keyed new work under the same key
            Object key = options.key();
            if (key != null) {
                ScopedTaskHandleImpl previous;
                while ((previous = keyedTasks.get(key)) != null) {
                    keyedTasks.remove(key, previous);
                    DIAG.debug("scope#{} key={} supersedes {}", scopeId, key, previous);
                    previous.cancel();
                }
                if (observerCount == 0) {
                    DIAG.debug("scope#{} submit dropped: last observer left during supersede (key={})", scopeId, key);
                    return;
                }
            }

            handle = new ScopedTaskHandleImpl(options.mode(), key, options.name(), priority, target);
            if (key != null) {
                keyedTasks.put(key, handle);
            } else {
                anonymousTasks.add(handle);
            }
            handle.whenSettled(() -> prune(handle));

            // 🧩 Point: submit/dispatch
            DIAG.debug("scope#{} dispatch {} on {}", scopeId, handle, target);
            target.dispatch(handle, new ScopedTask(handle, work));

            // a worker of the target waiting on work queued behind it may never be released
            TaskContext caller = TaskContext.current();
            awaitPrefix = options.mode() == DispatchMode.IMMEDIATE
                    && (caller == null || caller.dispatcher() != target);
            if (options.mode() == DispatchMode.IMMEDIATE && !awaitPrefix) {
                DIAG.debug("scope#{} {} runs on the caller's dispatcher; not waiting for its prefix", scopeId, handle);
            }
        } finally {
            lock.unlock();
        }

        // outside the lock so the prefix may touch this scope
        if (awaitPrefix) {
            handle.awaitFirstSuspension();
        }
    }
    // [/🧩 Section: submit]

    // 🧩 Section: flush
    private void flush() {
        if (observerCount != 0) return;
        if (anonymousTasks.isEmpty() && keyedTasks.isEmpty()) return;

        // detach everything first; cancel callbacks may activate and submit, and that work stays
        List<ScopedTaskHandleImpl> detached = new ArrayList<>();
        ScopedTaskHandleImpl h;
        while ((h = anonymousTasks.poll()) != null) {
            detached.add(h);
        }
        int anonymous = detached.size();
        for (Map.Entry<Object, ScopedTaskHandleImpl> e : keyedTasks.entrySet()) {
            if (keyedTasks.remove(e.getKey(), e.getValue())) {
                detached.add(e.getValue());
            }
        }
        DIAG.debug("scope#{} flushing anonymous={} keyed={}", scopeId, anonymous, detached.size() - anonymous);
        for (ScopedTaskHandleImpl victim : detached) {
            victim.cancel();
        }
    }

    private void prune(ScopedTaskHandleImpl handle) {
        Object key = handle.key();
        boolean removed = key != null ? keyedTasks.remove(key, handle) : anonymousTasks.remove(handle);
        if (removed) {
            DIAG.debug("scope#{} pruned settled {}", scopeId, handle);
        }
    }
    // [/🧩 Section: flush]

    // 🧩 Section: introspection
    public int observerCount() {
        lock.lock();
        try {
            return observerCount;
        } finally {
            lock.unlock();
        }
    }

    public boolean isObserved() {
        return observerCount() > 0;
    }

    /**
     * @return number of kept tasks, anonymous and keyed
     */
    public int taskCount() {
        return anonymousTasks.size() + keyedTasks.size();
    }

    public int anonymousTaskCount() {
        return anonymousTasks.size();
    }

    public int keyedTaskCount() {
        return keyedTasks.size();
    }

    /**
     * @return snapshot of the keys that currently have a kept task
     */
    public Set<Object> keys() {
        return Set.copyOf(keyedTasks.keySet());
    }

    /**
     * @return the task kept under {@code key}, or {@code null}
     */
    public @Nullable ScopedTaskHandle keyedTask(@NonNull Object key) {
        if (key == null) throw new IllegalArgumentException("key == null");
        return keyedTasks.get(key);
    }

    /**
     * @return number of unmatched {@link #deactivate()} calls seen so far
     */
    public int violationCount() {
        return violations.get();
    }

    public String name() {
        return name;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    public ImbalancePolicy imbalancePolicy() {
        return imbalancePolicy;
    }

    @Override
    public String toString() {
        int observers = observerCount();
        return "VisibilityScope[" + name + " "
                + (observers > 0 ? "OBSERVED(" + observers + ")" : "UNOBSERVED")
                + " tasks=" + taskCount() + "]";
    }
    // [/🧩 Section: introspection]
}
