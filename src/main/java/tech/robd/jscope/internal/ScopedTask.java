/*
 [File Info]
 path: src/main/java/tech/robd/jscope/internal/ScopedTask.java
 description: Runnable handed to a Dispatcher for one submission. Binds the TaskContext,
              applies the priority hint, links cancellation to thread interruption and
              settles the handle with the outcome of the work.
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.robd.jscope.ScopedRunnable;
import tech.robd.jscope.TaskContext;
import tech.robd.jscope.TaskPriority;
import tech.robd.jscope.diagnostics.Diagnostics;

import java.util.concurrent.CancellationException;

/**
 * Executes one piece of scoped work on a dispatcher thread.
 */
public final class ScopedTask implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(ScopedTask.class);
    private static final Diagnostics DIAG = Diagnostics.of(ScopedTask.class);

    private final ScopedTaskHandleImpl handle;
    private final ScopedRunnable work;
    private final TaskContext context;

    // guarded by this; cancel() must not interrupt the worker once the work has returned
    private boolean running;

    public ScopedTask(ScopedTaskHandleImpl handle, ScopedRunnable work) {
        if (handle == null) throw new IllegalArgumentException("handle == null");
        if (work == null) throw new IllegalArgumentException("work == null");
        this.handle = handle;
        this.work = work;
        this.context = TaskContext.create(handle, handle.token(), handle.priority(),
                handle.dispatcher(), handle::markSuspended);
    }

    public TaskContext context() {
        return context;
    }

    // 🧩 Section: run
    @Override
    public void run() {
        // cancelled between dispatch and pickup: the work never starts
        if (handle.isCompleted() || handle.isCancelled()) {
            DIAG.debug("task {} skipped: cancelled before start", handle.name());
            handle.fail(new CancellationException(TaskContext.TASK_WAS_CANCELLED));
            return;
        }

        final Thread current = Thread.currentThread();
        final int savedPriority = current.getPriority();
        applyPriority(current, handle.priority());

        synchronized (this) {
            running = true;
        }
        AutoCloseable interruptReg = handle.token().onCancel(() -> {
            synchronized (this) {
                if (!running) return;
                DIAG.debug("task {} token->interrupt", handle.name());
                current.interrupt();
            }
        });

        DIAG.debug("task {} start on {}", handle.name(), current.getName());
        try (TaskContext.Binding ignored = context.bind()) {
            work.run(context);
            handle.succeed();
            DIAG.debug("task {} complete OK", handle.name());
        } catch (CancellationException ce) {
            handle.fail(ce);
            DIAG.debug("task {} cancelled", handle.name());
        } catch (InterruptedException ie) {
            handle.fail(new CancellationException("Interrupted"));
            DIAG.debug("task {} interrupted", handle.name());
        } catch (Throwable t) {
            handle.fail(t);
            // nobody joins the handle, so this is the only trace of the failure
            LOG.warn("Scoped task '{}' failed", handle.name(), t);
        } finally {
            try {
                interruptReg.close();
            } catch (Exception e) {
                DIAG.debug("task {} interrupt registration close failed: {}", handle.name(), e.toString());
            }
            // cancellation interrupts the worker; do not leak the flag into the next pooled task
            synchronized (this) {
                running = false;
                Thread.interrupted();
            }
            current.setPriority(savedPriority);
            handle.markSuspended();
        }
    }
    // [/🧩 Section: run]

    private static void applyPriority(Thread thread, @Nullable TaskPriority priority) {
        if (priority == null) return;
        try {
            thread.setPriority(priority.threadPriority());
        } catch (SecurityException | IllegalArgumentException e) {
            DIAG.warn("could not apply {} to {}: {}", priority, thread.getName(), e.toString());
        }
    }
}
