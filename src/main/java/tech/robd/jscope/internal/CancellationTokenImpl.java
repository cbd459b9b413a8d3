/*
 [File Info]
 path: src/main/java/tech/robd/jscope/internal/CancellationTokenImpl.java
 description: Default CancellationToken. Callback queue with at-most-once wrappers, race-safe
              registration, and release of callbacks once the guarded task has finished.
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

import tech.robd.jscope.CancellationToken;
import tech.robd.jscope.diagnostics.Diagnostics;

import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Event-driven {@link CancellationToken}.
 *
 * <p>One token is created per dispatched task. {@link #release()} is called by the task's
 * handle when the task finishes, after which pending callbacks are dropped so a finished task
 * no longer pins whatever its callbacks capture.</p>
 */
public final class CancellationTokenImpl implements CancellationToken {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(CancellationTokenImpl.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final int tokId = System.identityHashCode(this);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean released = new AtomicBoolean(false);
    private final ConcurrentLinkedQueue<Callback> callbacks = new ConcurrentLinkedQueue<>();
    // [/🧩 Section: state]

    // 🧩 Section: callback

    /**
     * Runs its action once at most; {@link #clear()} disarms it.
     */
    private static final class Callback {
        private final AtomicReference<Runnable> action;

        Callback(Runnable action) {
            this.action = new AtomicReference<>(action);
        }

        void fire() {
            Runnable r = action.getAndSet(null);
            if (r != null) r.run();
        }

        void clear() {
            action.set(null);
        }
    }
    // [/🧩 Section: callback]

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    // 🧩 Section: registration
    @Override
    public AutoCloseable onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "Callback cannot be null");
        Callback cb = new Callback(callback);

        if (cancelled.get()) {
            DIAG.debug("tok#{} onCancel: already cancelled, running now", tokId);
            fireSafely(cb, "onCancel-immediate");
            return () -> {
            };
        }

        if (released.get()) {
            DIAG.debug("tok#{} onCancel: released, callback ignored", tokId);
            return () -> {
            };
        }

        callbacks.offer(cb);

        // cancel() may have drained the queue between the check above and the offer
        if (cancelled.get() && callbacks.remove(cb)) {
            DIAG.debug("tok#{} onCancel: lost race with cancel, running now", tokId);
            fireSafely(cb, "onCancel-race");
        }

        return () -> {
            if (callbacks.remove(cb)) {
                cb.clear();
            }
        };
    }
    // [/🧩 Section: registration]

    // 🧩 Section: cancel
    @Override
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            DIAG.debug("tok#{} cancel: already cancelled", tokId);
            return false;
        }
        DIAG.debug("tok#{} cancel: firing {} callbacks", tokId, callbacks.size());
        Callback cb;
        while ((cb = callbacks.poll()) != null) {
            fireSafely(cb, "cancel");
        }
        return true;
    }

    private void fireSafely(Callback cb, String where) {
        try {
            cb.fire();
        } catch (Throwable t) {
            DIAG.error("tok#{} callback failed @{}: {}", tokId, where, t.toString());
        }
    }
    // [/🧩 Section: cancel]

    // 🧩 Section: release

    /**
     * Drop all pending callbacks without running them. Idempotent.
     * <p>A cancelled token keeps its queue: {@link #cancel()} may still be draining it, and the
     * task's own future settles from inside that drain.</p>
     */
    public void release() {
        if (released.compareAndSet(false, true)) {
            if (cancelled.get()) {
                DIAG.debug("tok#{} released while cancelling; callbacks left to cancel()", tokId);
                return;
            }
            Callback cb;
            while ((cb = callbacks.poll()) != null) {
                cb.clear();
            }
            DIAG.debug("tok#{} released (cancelled={})", tokId, cancelled.get());
        }
    }

    /**
     * @return number of callbacks still waiting for cancellation
     */
    public int pendingCallbackCount() {
        return callbacks.size();
    }
    // [/🧩 Section: release]

    @Override
    public String toString() {
        if (cancelled.get()) return "CancellationToken[CANCELLED]";
        return released.get() ? "CancellationToken[RELEASED]"
                : "CancellationToken[ACTIVE, callbacks=" + callbacks.size() + "]";
    }
}
