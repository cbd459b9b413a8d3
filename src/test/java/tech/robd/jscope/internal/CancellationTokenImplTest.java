/*
 [File Info]
 path: src/test/java/tech/robd/jscope/internal/CancellationTokenImplTest.java
 description: Token tests: single winning cancel, at-most-once callbacks, late registration,
              registration removal, failing callbacks, release semantics.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
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
package tech.robd.jscope.internal;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.jscope.tools.TestAwaitUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class CancellationTokenImplTest {

    @Test
    void cancelIsIdempotentAndRunsCallbacksOnce() {
        CancellationTokenImpl token = new CancellationTokenImpl();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);
        token.onCancel(calls::incrementAndGet);
        assertEquals(2, token.pendingCallbackCount());

        assertTrue(token.cancel());
        assertFalse(token.cancel());
        assertTrue(token.isCancelled());
        assertEquals(2, calls.get());
        assertEquals(0, token.pendingCallbackCount());
        assertEquals("CancellationToken[CANCELLED]", token.toString());
    }

    @Test
    void callbackRegisteredAfterCancelRunsImmediately() {
        CancellationTokenImpl token = new CancellationTokenImpl();
        token.cancel();

        AtomicBoolean ran = new AtomicBoolean(false);
        token.onCancel(() -> ran.set(true));
        assertTrue(ran.get());
        assertEquals(0, token.pendingCallbackCount());
    }

    @Test
    void closedRegistrationNeverFires() throws Exception {
        CancellationTokenImpl token = new CancellationTokenImpl();
        AtomicBoolean ran = new AtomicBoolean(false);
        AutoCloseable reg = token.onCancel(() -> ran.set(true));

        reg.close();
        reg.close();
        token.cancel();
        assertFalse(ran.get());
    }

    @Test
    void failingCallbackDoesNotStopTheOthers() {
        CancellationTokenImpl token = new CancellationTokenImpl();
        AtomicInteger after = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("listener bug");
        });
        token.onCancel(after::incrementAndGet);

        assertDoesNotThrow(token::cancel);
        assertEquals(1, after.get());
    }

    @Test
    void releaseDropsPendingCallbacksAndIgnoresLaterOnes() {
        CancellationTokenImpl token = new CancellationTokenImpl();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        token.release();
        assertEquals(0, token.pendingCallbackCount());
        assertEquals("CancellationToken[RELEASED]", token.toString());
        token.onCancel(calls::incrementAndGet);
        assertEquals(0, token.pendingCallbackCount());

        assertTrue(token.cancel());
        assertEquals(0, calls.get());
    }

    @Test
        // A callback that releases the token mid-cancel (as a settling future does) must not
        // starve the callbacks queued behind it.
    void releaseDuringCancelKeepsRemainingCallbacks() {
        CancellationTokenImpl token = new CancellationTokenImpl();
        AtomicBoolean later = new AtomicBoolean(false);
        token.onCancel(token::release);
        token.onCancel(() -> later.set(true));

        token.cancel();
        assertTrue(later.get());
    }

    @Test
    @Timeout(3)
        // Concurrent cancel: exactly one caller wins and each callback runs exactly once.
        // Race-avoidance: all threads wait on 'go' so the cancels overlap.
    void concurrentCancelHasOneWinner() throws InterruptedException {
        CancellationTokenImpl token = new CancellationTokenImpl();
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger winners = new AtomicInteger();
        for (int i = 0; i < 10; i++) token.onCancel(calls::incrementAndGet);

        CountDownLatch go = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(8);
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            Thread t = new Thread(() -> {
                try {
                    go.await();
                    if (token.cancel()) winners.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
            threads.add(t);
            t.start();
        }
        go.countDown();
        TestAwaitUtils.awaitLatch(done, 2000, "cancel threads did not finish");
        for (Thread t : threads) t.join();

        assertEquals(1, winners.get());
        assertEquals(10, calls.get());
    }
}
