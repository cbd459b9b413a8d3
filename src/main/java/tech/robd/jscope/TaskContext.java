/*
 [File Info]
 path: src/main/java/tech/robd/jscope/TaskContext.java
 description: Context handed to running scoped work: cancellation checks, cancellable
              suspension points (delay, yield, awaitCancellation) and the task's resolved
              settings. Tracks the context of the task running on the current thread.
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
import tech.robd.jscope.diagnostics.Diagnostics;
import tech.robd.jscope.fn.ScopedTaskHandle;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;

/**
 * Explicit context passed to a {@link ScopedRunnable}.
 * <p>
 * Cancellation is cooperative: the scope only signals it. Work notices the signal through
 * {@link #isCancelled()}, {@link #checkCancellation()}, or one of the suspension points
 * {@link #delay(long)}, {@link #yield()} and {@link #awaitCancellation()}, each of which throws
 * {@link CancellationException} once the task is cancelled.
 * </p>
 *
 * <p>While the work runs, {@link #current()} on its thread returns this context. A
 * {@link DispatchMode#NORMAL} or {@link DispatchMode#IMMEDIATE} submission made from that
 * thread inherits the dispatcher and priority recorded here.</p>
 */
public final class TaskContext {

    private static final Diagnostics DIAG = Diagnostics.of(TaskContext.class);
    private static final ThreadLocal<TaskContext> CURRENT = new ThreadLocal<>();

    public static final String TASK_WAS_CANCELLED = "Scoped task was cancelled";
    private static final long SLICE_MS = 10L;

    private final @NonNull ScopedTaskHandle handle;
    private final @NonNull CancellationToken token;
    private final @Nullable TaskPriority priority;
    private final @NonNull Dispatcher dispatcher;
    private final @NonNull Runnable suspensionHook;

    private TaskContext(ScopedTaskHandle handle, CancellationToken token, @Nullable TaskPriority priority,
                        Dispatcher dispatcher, Runnable suspensionHook) {
        this.handle = handle;
        this.token = token;
        this.priority = priority;
        this.dispatcher = dispatcher;
        this.suspensionHook = suspensionHook;
    }

    // 🧩 Section: factories

    /**
     * Create the context for one dispatched task. Called by the task runner.
     *
     * @param handle         the task's handle
     * @param token          the task's cancellation token
     * @param priority       resolved priority, or {@code null}
     * @param dispatcher     dispatcher the task runs on
     * @param suspensionHook run at every suspension point, before the point blocks
     * @return a new context
     */
    public static @NonNull TaskContext create(@NonNull ScopedTaskHandle handle, @NonNull CancellationToken token,
                                              @Nullable TaskPriority priority, @NonNull Dispatcher dispatcher,
                                              @NonNull Runnable suspensionHook) {
        if (handle == null || token == null || dispatcher == null || suspensionHook == null) {
            throw new IllegalArgumentException("handle, token, dispatcher and suspensionHook are required");
        }
        return new TaskContext(handle, token, priority, dispatcher, suspensionHook);
    }

    /**
     * @return the context of the scoped task running on this thread, or {@code null} when the
     * caller is not running inside scoped work
     */
    public static @Nullable TaskContext current() {
        return CURRENT.get();
    }

    /**
     * Make this context {@link #current()} on the calling thread until the returned binding is
     * closed, which restores the previous value. Called by the task runner.
     *
     * @return binding to close when the work returns
     */
    public Binding bind() {
        TaskContext previous = CURRENT.get();
        CURRENT.set(this);
        return () -> {
            if (previous == null) CURRENT.remove();
            else CURRENT.set(previous);
        };
    }

    /**
     * Restores the previously current context; never throws.
     */
    @FunctionalInterface
    public interface Binding extends AutoCloseable {
        @Override
        void close();
    }
    // [/🧩 Section: factories]

    // 🧩 Section: cancellation

    /**
     * @return {@code true} once the task has been asked to cancel
     */
    public boolean isCancelled() {
        return token.isCancelled();
    }

    /**
     * @throws CancellationException if the task has been asked to cancel
     */
    public void checkCancellation() {
        if (token.isCancelled()) {
            throw new CancellationException(TASK_WAS_CANCELLED);
        }
    }

    public CancellationToken getCancellationToken() {
        return token;
    }
    // [/🧩 Section: cancellation]

    // 🧩 Section: suspension

    /**
     * Sleep for {@code millis}, waking early with {@link CancellationException} if cancelled.
     */
    public void delay(long millis) {
        suspensionHook.run();
        checkCancellation();
        long remaining = Math.max(0L, millis);
        while (remaining > 0L) {
            checkCancellation();
            long slice = Math.min(SLICE_MS, remaining);
            try {
                Thread.sleep(slice);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted");
            }
            remaining -= slice;
        }
        checkCancellation();
    }

    /**
     * Give other work a chance to run. Checks for cancellation before and after.
     */
    public void yield() {
        suspensionHook.run();
        checkCancellation();
        Thread.yield();
        checkCancellation();
    }

    /**
     * Block until the task is cancelled. Never returns normally.
     *
     * @throws CancellationException always, once the task is cancelled or its thread interrupted
     */
    public void awaitCancellation() {
        suspensionHook.run();
        CountDownLatch cancelled = new CountDownLatch(1);
        AutoCloseable reg = token.onCancel(cancelled::countDown);
        try {
            cancelled.await();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } finally {
            try {
                reg.close();
            } catch (Exception e) {
                DIAG.debug("task {} awaitCancellation: registration close failed: {}", handle.name(), e.toString());
            }
        }
        throw new CancellationException(TASK_WAS_CANCELLED);
    }
    // [/🧩 Section: suspension]

    // 🧩 Section: settings
    public String name() {
        return handle.name();
    }

    public @Nullable Object key() {
        return handle.key();
    }

    public DispatchMode mode() {
        return handle.mode();
    }

    public @Nullable TaskPriority priority() {
        return priority;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }
    // [/🧩 Section: settings]

    @Override
    public String toString() {
        return "TaskContext{" +
                "task=" + handle.name() +
                ", thread=" + Thread.currentThread().getName() +
                ", cancelled=" + token.isCancelled() +
                '}';
    }
}
