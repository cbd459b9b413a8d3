/*
 [File Info]
 path: src/main/java/tech/robd/jscope/CancellationToken.java
 description: Cooperative cancellation signal carried by every scoped task. Idempotent cancel,
              at-most-once callbacks, removable registrations.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
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

/**
 * A request-only cancellation signal.
 *
 * <p>Cancelling a token never waits for the work it guards. Work observes the request by
 * polling {@link #isCancelled()}, by registering a callback, or through the blocking calls of
 * {@link TaskContext}, which react to the interrupt that accompanies cancellation.</p>
 */
public interface CancellationToken {

    /**
     * @return {@code true} once {@link #cancel()} has been called
     * <p>Thread-safe and non-blocking.</p>
     */
    boolean isCancelled();

    /**
     * Register a callback to run when this token is cancelled.
     * <p>If the token is already cancelled the callback runs immediately on the calling thread.
     * Each callback runs at most once.</p>
     *
     * @param callback action to run on cancellation; should be quick and must not block
     * @return registration that removes the callback when closed
     */
    AutoCloseable onCancel(Runnable callback);

    /**
     * Cancel this token, running all registered callbacks on the calling thread.
     * <p>Safe to call any number of times from any thread.</p>
     *
     * @return {@code true} if this call performed the cancellation, {@code false} if the token
     * was already cancelled
     */
    boolean cancel();
}
