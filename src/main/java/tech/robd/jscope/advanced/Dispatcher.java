/*
 [File Info]
 path: src/main/java/tech/robd/jscope/advanced/Dispatcher.java
 description: Named ExecutorService wrapper used as the execution-context preference of scoped
              work. Tracks the handles it runs, cancels rejected work, and offers graceful and
              forceful shutdown.
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

package tech.robd.jscope.advanced;

import tech.robd.jscope.diagnostics.Diagnostics;
import tech.robd.jscope.fn.ScopedTaskHandle;

import java.lang.ref.WeakReference;
import java.util.Iterator;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A {@code Dispatcher} runs scoped work on a specific {@link ExecutorService}.
 *
 * <p>It is the execution-context preference of a submission
 * ({@link tech.robd.jscope.TaskOptions#withDispatcher(Dispatcher)}). Every scope also has a
 * default dispatcher, {@link #shared()} unless configured otherwise.</p>
 *
 * <p>Predefined factory methods:
 * {@link #shared()}, {@link #cpu()}, {@link #fixedThreadPool(int)},
 * {@link #cachedThreadPool()}, {@link #singleThread()}. Pools created by these factories use
 * daemon threads named {@code <dispatcher>-worker-<n>}.</p>
 */
public final class Dispatcher {

    private static final Diagnostics DIAG = Diagnostics.of(Dispatcher.class);

    private final ExecutorService executor;
    private final String name;
    private final boolean closeable;
    private final Set<WeakReference<ScopedTaskHandle>> activeHandles = ConcurrentHashMap.newKeySet();

    private Dispatcher(ExecutorService executor, String name, boolean closeable) {
        this.executor = executor;
        this.name = name;
        this.closeable = closeable;
    }

    // 🧩 Section: execution

    /**
     * Run {@code task}, the runner of the work behind {@code handle}, on this dispatcher.
     * <p>If the executor rejects the task the handle is cancelled, so its owner sees it settle.</p>
     *
     * @param handle handle of the work; tracked until it settles
     * @param task   runnable that executes the work and settles the handle
     * @throws IllegalArgumentException if either argument is null
     */
    public void dispatch(ScopedTaskHandle handle, Runnable task) {
        if (handle == null || task == null) throw new IllegalArgumentException("handle and task cannot be null");

        WeakReference<ScopedTaskHandle> ref = new WeakReference<>(handle);
        activeHandles.add(ref);
        // 🧩 Point: execution/cleanup-handle
        handle.completion().whenComplete((r, t) -> activeHandles.removeIf(w -> w == ref || w.get() == null));

        // 🧩 Point: execution/submit-task
        try {
            executor.execute(task);
            DIAG.debug("dispatcher {} accepted {}", name, handle.name());
        } catch (RejectedExecutionException rex) {
            DIAG.warn("dispatcher {} rejected {} (probably shut down)", name, handle.name());
            handle.cancel();
        }
    }

    /**
     * @return number of dispatched handles that have not settled yet
     */
    public int activeTaskCount() {
        activeHandles.removeIf(w -> w.get() == null);
        return activeHandles.size();
    }
    // [/🧩 Section: execution]

    // 🧩 Section: lifecycle

    /**
     * Gracefully shut down the executor, waiting up to 5 seconds before forcing it.
     * <p>No-op for {@link #shared()} and {@link #cpu()}, whose executors outlive any one user.</p>
     */
    public void close() {
        if (!closeable) {
            DIAG.debug("dispatcher {} is process-wide; close() ignored", name);
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    /**
     * Cancel every tracked handle, then shut the executor down immediately.
     * <p>For {@link #shared()} and {@link #cpu()} only the cancellation happens.</p>
     */
    public void kill() {
        // 🧩 Point: lifecycle/cancel-handles
        Iterator<WeakReference<ScopedTaskHandle>> it = activeHandles.iterator();
        while (it.hasNext()) {
            ScopedTaskHandle handle = it.next().get();
            if (handle != null) handle.cancel();
            it.remove();
        }

        // 🧩 Point: lifecycle/shutdown-now
        if (!closeable) return;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                DIAG.warn("dispatcher {} did not terminate within 5s of kill()", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: info
    public ExecutorService executor() {
        return executor;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "Dispatcher(" + name + ")";
    }
    // [/🧩 Section: info]

    // 🧩 Section: factories

    /**
     * Wrap an executor owned by the caller. {@link #close()} and {@link #kill()} shut it down.
     *
     * @param executor the executor service to wrap (non-null)
     * @param name     a human-readable name (non-null)
     * @return a new dispatcher
     * @throws IllegalArgumentException if {@code executor} or {@code name} is null
     */
    public static Dispatcher create(ExecutorService executor, String name) {
        if (executor == null || name == null) {
            throw new IllegalArgumentException("Executor and name cannot be null");
        }
        return new Dispatcher(executor, name, true);
    }

    /**
     * Process-wide cached pool; the default dispatcher of every scope.
     *
     * @return the shared dispatcher
     */
    public static Dispatcher shared() {
        return SharedHolder.SHARED;
    }

    /**
     * Dispatcher on {@link ForkJoinPool#commonPool()} for CPU-bound work.
     *
     * @return a dispatcher backed by the common pool
     */
    public static Dispatcher cpu() {
        return new Dispatcher(ForkJoinPool.commonPool(), "CPU", false);
    }

    /**
     * @param nThreads number of threads in the pool
     * @return a dispatcher backed by a new fixed-size pool
     */
    public static Dispatcher fixedThreadPool(int nThreads) {
        String name = "FixedPool-" + nThreads;
        return create(Executors.newFixedThreadPool(nThreads, namedDaemonThreads(name)), name);
    }

    /**
     * @return a dispatcher backed by a new cached pool
     */
    public static Dispatcher cachedThreadPool() {
        return create(Executors.newCachedThreadPool(namedDaemonThreads("CachedPool")), "CachedPool");
    }

    /**
     * Single-threaded dispatcher; work submitted to it runs one task at a time in order.
     *
     * @return a dispatcher backed by a new single-thread executor
     */
    public static Dispatcher singleThread() {
        return singleThread("SingleThread");
    }

    /**
     * @param name dispatcher name, also the worker thread name prefix
     * @return a dispatcher backed by a new single-thread executor
     */
    public static Dispatcher singleThread(String name) {
        return create(Executors.newSingleThreadExecutor(namedDaemonThreads(name)), name);
    }

    /**
     * @param prefix thread name prefix
     * @return a factory producing daemon threads named {@code <prefix>-worker-<n>}
     */
    public static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class SharedHolder {
        static final Dispatcher SHARED = new Dispatcher(
                Executors.newCachedThreadPool(namedDaemonThreads("jscope-shared")), "jscope-shared", false);
    }
    // [/🧩 Section: factories]
}
