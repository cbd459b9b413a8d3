/*
 [File Info]
 path: src/test/java/tech/robd/jscope/advanced/DispatcherTest.java
 description: Dispatcher tests: thread naming, handle tracking, rejected work settling as
              cancelled, kill cancelling tracked work, process-wide dispatchers surviving close.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 * Licensed under the Apache License, Version 2.0 (the "License");
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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.jscope.DispatchMode;
import tech.robd.jscope.ImbalancePolicy;
import tech.robd.jscope.TaskContext;
import tech.robd.jscope.TaskOptions;
import tech.robd.jscope.VisibilityScope;
import tech.robd.jscope.fn.ScopedTaskHandle;
import tech.robd.jscope.internal.ScopedTaskHandleImpl;
import tech.robd.jscope.tools.TestAwaitUtils;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

final class DispatcherTest {

    private static VisibilityScope scopeOn(Dispatcher dispatcher) {
        return VisibilityScope.builder()
                .dispatcher(dispatcher)
                .imbalancePolicy(ImbalancePolicy.CLAMP)
                .build();
    }

    // 🧩 Section: execution

    @Test
    @Timeout(2)
    void factoryThreadsAreNamedDaemons() {
        Dispatcher d = Dispatcher.fixedThreadPool(2);
        try {
            AtomicReference<Thread> worker = new AtomicReference<>();
            CountDownLatch ran = new CountDownLatch(1);
            VisibilityScope scope = scopeOn(d);
            scope.activate();
            scope.submit(task -> {
                worker.set(Thread.currentThread());
                ran.countDown();
            });
            TestAwaitUtils.awaitLatch(ran, 1000, "task never ran");
            scope.deactivate();

            assertEquals("FixedPool-2", d.getName());
            assertTrue(worker.get().getName().startsWith("FixedPool-2-worker-"), worker.get().getName());
            assertTrue(worker.get().isDaemon());
        } finally {
            d.close();
        }
        assertTrue(d.isShutdown());
    }

    @Test
    @Timeout(2)
        // Tracking follows the handle: counted while running, dropped once settled.
    void tracksHandlesUntilTheySettle() {
        Dispatcher d = Dispatcher.cachedThreadPool();
        try {
            VisibilityScope scope = scopeOn(d);
            scope.activate();
            scope.submit("park", TaskContext::awaitCancellation);
            ScopedTaskHandle handle = scope.keyedTask("park");
            assertEquals(1, d.activeTaskCount());

            handle.cancel();
            TestAwaitUtils.awaitCancelled(handle, 1000);
            TestAwaitUtils.awaitTrue(() -> d.activeTaskCount() == 0, 1000, "settled handle still tracked");
            scope.deactivate();
        } finally {
            d.close();
        }
    }

    @Test
    void dispatchRejectsNullArguments() {
        Dispatcher d = Dispatcher.singleThread();
        try {
            ScopedTaskHandleImpl h = new ScopedTaskHandleImpl(DispatchMode.NORMAL, null, null, null, d);
            assertThrows(IllegalArgumentException.class, () -> d.dispatch(null, () -> { }));
            assertThrows(IllegalArgumentException.class, () -> d.dispatch(h, null));
            assertThrows(IllegalArgumentException.class, () -> Dispatcher.create(null, "x"));
        } finally {
            d.close();
        }
    }
    // [/🧩 Section: execution]

    // 🧩 Section: lifecycle

    @Test
    @Timeout(2)
        // A shut-down executor rejects the work; the handle settles cancelled and the scope forgets it.
    void rejectedWorkSettlesCancelled() {
        Dispatcher d = Dispatcher.singleThread("closed");
        d.close();
        VisibilityScope scope = scopeOn(d);
        AtomicBoolean ran = new AtomicBoolean(false);

        scope.activate();
        scope.submit(TaskOptions.keyed("late"), task -> ran.set(true));

        TestAwaitUtils.awaitTrue(() -> scope.taskCount() == 0, 1000, "rejected work still kept");
        assertFalse(ran.get());
        assertEquals(0, d.activeTaskCount());
        scope.deactivate();
    }

    @Test
    @Timeout(3)
        // IMMEDIATE on a rejecting dispatcher must not strand the submitter.
    void rejectedImmediateWorkReleasesSubmitter() {
        Dispatcher d = Dispatcher.singleThread("closed-immediate");
        d.close();
        VisibilityScope scope = scopeOn(d);

        scope.activate();
        assertDoesNotThrow(() -> scope.submit(TaskOptions.immediate(), task -> fail("must not run")));
        assertEquals(0, scope.taskCount());
        scope.deactivate();
    }

    @Test
    @Timeout(3)
        // kill() cancels every tracked handle before shutting the pool down.
    void killCancelsTrackedWork() {
        Dispatcher d = Dispatcher.fixedThreadPool(2);
        VisibilityScope scope = scopeOn(d);
        scope.activate();
        scope.submit("a", TaskContext::awaitCancellation);
        scope.submit("b", TaskContext::awaitCancellation);
        ScopedTaskHandle a = scope.keyedTask("a");
        ScopedTaskHandle b = scope.keyedTask("b");

        d.kill();

        TestAwaitUtils.awaitCancelled(a, 1000);
        TestAwaitUtils.awaitCancelled(b, 1000);
        assertTrue(d.isShutdown());
        assertEquals(0, d.activeTaskCount());
        TestAwaitUtils.awaitTrue(() -> scope.taskCount() == 0, 1000, "killed work still kept");
        scope.deactivate();
    }

    @Test
        // Process-wide dispatchers ignore close(); other users keep working.
    void processWideDispatchersSurviveClose() {
        Dispatcher.shared().close();
        Dispatcher.cpu().close();

        assertFalse(Dispatcher.shared().isShutdown());
        assertFalse(Dispatcher.cpu().isShutdown());
        assertSame(Dispatcher.shared(), Dispatcher.shared());
        assertEquals("Dispatcher(jscope-shared)", Dispatcher.shared().toString());
    }
    // [/🧩 Section: lifecycle]
}
