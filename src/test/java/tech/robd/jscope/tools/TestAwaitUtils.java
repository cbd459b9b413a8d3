/*
 [File Info]
 path: src/test/java/tech/robd/jscope/tools/TestAwaitUtils.java
 description: Deterministic wait helpers for scope tests: awaitTrue, awaitLatch, awaitSettled
              and awaitCancelled for ScopedTaskHandle.
 license: Apache-2.0
 editable: yes
 structured: no
 [/File Info]
*/
/*
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

package tech.robd.jscope.tools;

import tech.robd.jscope.fn.ScopedTaskHandle;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic wait helpers for concurrent tests.
 */
public final class TestAwaitUtils {
    private TestAwaitUtils() {
    }

    /**
     * Poll a condition until true or fail the test on timeout.
     */
    public static void awaitTrue(BooleanSupplier cond, long timeoutMs, String msg) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (System.nanoTime() < deadline) {
            if (cond.getAsBoolean()) return;
            try {
                Thread.sleep(2);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting: " + msg);
            }
        }
        assertTrue(cond.getAsBoolean(), msg);
    }

    /**
     * Await a latch or fail with a useful message.
     */
    public static void awaitLatch(CountDownLatch latch, long timeoutMs, String msg) {
        try {
            assertTrue(latch.await(timeoutMs, TimeUnit.MILLISECONDS), msg);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail("Interrupted while waiting for latch: " + e);
        }
    }

    /**
     * Wait until the handle settles (any outcome) or fail on timeout.
     */
    public static void awaitSettled(ScopedTaskHandle handle, long timeoutMs) {
        try {
            handle.completion().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            fail("Handle " + handle + " did not settle within " + timeoutMs + "ms");
        } catch (ExecutionException ee) {
            fail("completion() must not complete exceptionally: " + ee.getCause());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            fail("Interrupted while waiting for " + handle);
        }
        assertTrue(handle.isCompleted());
    }

    /**
     * Wait until the handle settles and assert that it settled as cancelled.
     */
    public static void awaitCancelled(ScopedTaskHandle handle, long timeoutMs) {
        awaitSettled(handle, timeoutMs);
        assertTrue(handle.isCancelled(), "expected " + handle + " to be cancelled");
        assertFalse(handle.isActive());
    }
}
