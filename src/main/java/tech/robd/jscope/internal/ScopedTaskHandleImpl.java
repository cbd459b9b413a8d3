/*
 [File Info]
 path: src/main/java/tech/robd/jscope/internal/ScopedTaskHandleImpl.java
 description: Default ScopedTaskHandle. Links a CompletableFuture to a CancellationTokenImpl in
              both directions and gates IMMEDIATE submitters on the task's first suspension.
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

package tech.robd.jscope.internal;

import org.jspecify.annotations.Nullable;
import tech.robd.jscope.DispatchMode;
import tech.robd.jscope.TaskPriority;
import tech.robd.jscope.advanced.Dispatcher;
import tech.robd.jscope.diagnostics.Diagnostics;
import tech.robd.jscope.fn.ScopedTaskHandle;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default {@link ScopedTaskHandle}.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Token → future: cancelling the token cancels the future.</li>
 *   <li>Future → token: once the future settles the token's callbacks are released.</li>
 *   <li>Carry the resolved dispatch settings (mode, key, name, priority, dispatcher).</li>
 *   <li>Release an {@link DispatchMode#IMMEDIATE} submitter at the first suspension point.</li>
 * </ul>
 *
 * <p>Equality is identity: a scope may hold two handles with equal settings.</p>
 */
public final class ScopedTaskHandleImpl implements ScopedTaskHandle {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(ScopedTaskHandleImpl.class);
    private static final AtomicInteger COUNTER = new AtomicInteger();
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final int handleId = COUNTER.incrementAndGet();
    private final CompletableFuture<Void> future = new CompletableFuture<>();
    private final CancellationTokenImpl token = new CancellationTokenImpl();
    private final CountDownLatch firstSuspension = new CountDownLatch(1);
    private final DispatchMode mode;
    private final @Nullable Object key;
    private final String name;
    private final @Nullable TaskPriority priority;
    private final Dispatcher dispatcher;
    // [/🧩 Section: state]

    // 🧩 Section: construction
    public ScopedTaskHandleImpl(DispatchMode mode, @Nullable Object key, @Nullable String name,
                                @Nullable TaskPriority priority, Dispatcher dispatcher) {
        if (mode == null) throw new IllegalArgumentException("mode == null");
        if (dispatcher == null) throw new IllegalArgumentException("dispatcher == null");
        this.mode = mode;
        this.key = key;
        this.name = name != null ? name : "task-" + handleId;
        this.priority = priority;
        this.dispatcher = dispatcher;

        // 🧩 Point: construction/token→future
        token.onCancel(() -> {
            DIAG.debug("hdl#{} token->future cancel", handleId);
            future.cancel(true);
        });

        // 🧩 Point: construction/future→token
        future.whenComplete((r, t) -> {
            if (DIAG.isActive()) {
                if (future.isCancelled()) {
                    DIAG.debug("hdl#{} settled: CANCELLED", handleId);
                } else if (t != null) {
                    DIAG.debug("hdl#{} settled: FAILED ({})", handleId, t.getClass().getSimpleName());
                } else {
                    DIAG.debug("hdl#{} settled: OK", handleId);
                }
            }
            token.release();
            firstSuspension.countDown();
        });
    }
    // [/🧩 Section: construction]

    // 🧩 Section: API
    @Override
    public boolean cancel() {
        boolean first = token.cancel();
        DIAG.debug("hdl#{} cancel requested (first={})", handleId, first);
        return first;
    }

    @Override
    public boolean isActive() {
        return !future.isDone() && !token.isCancelled();
    }

    @Override
    public boolean isCompleted() {
        return future.isDone();
    }

    @Override
    public boolean isCancelled() {
        return token.isCancelled() || future.isCancelled();
    }

    @Override
    public CompletableFuture<Void> completion() {
        return future.handle((r, t) -> null);
    }

    @Override
    public @Nullable Object key() {
        return key;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DispatchMode mode() {
        return mode;
    }
    // [/🧩 Section: API]

    // 🧩 Section: runner-side

    public CancellationTokenImpl token() {
        return token;
    }

    public @Nullable TaskPriority priority() {
        return priority;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    /**
     * Register {@code action} to run once the handle settles, whatever the outcome.
     */
    public void whenSettled(Runnable action) {
        future.whenComplete((r, t) -> action.run());
    }

    void succeed() {
        future.complete(null);
    }

    void fail(Throwable t) {
        if (t instanceof CancellationException) {
            cancel();
            future.cancel(false);
        } else {
            future.completeExceptionally(t);
        }
    }

    /**
     * Called by the task at each suspension point; only the first call has an effect.
     */
    void markSuspended() {
        firstSuspension.countDown();
    }

    /**
     * Block until the task first suspends or settles. Restores the interrupt flag and returns
     * early if the waiting thread is interrupted.
     */
    public void awaitFirstSuspension() {
        try {
            firstSuspension.await();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            DIAG.debug("hdl#{} interrupted while waiting for first suspension", handleId);
        }
    }
    // [/🧩 Section: runner-side]

    @Override
    public String toString() {
        String status;
        if (future.isDone()) {
            status = future.isCancelled() ? "CANCELLED"
                    : future.isCompletedExceptionally() ? "FAILED" : "COMPLETED";
        } else {
            status = token.isCancelled() ? "CANCELLING" : "ACTIVE";
        }
        return "ScopedTask[" + name + (key != null ? " key=" + key : "") + " " + mode + " " + status + "]";
    }
}
