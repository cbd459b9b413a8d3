/*
 [File Info]
 path: src/main/java/tech/robd/jscope/Observation.java
 description: One observer's binding to a VisibilityScope. Opened active; close() deactivates
              the scope exactly once.
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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An active observer of a {@link VisibilityScope}, obtained from {@link VisibilityScope#observe()}.
 * <p>
 * Closing it deactivates the scope. Further {@link #close()} calls do nothing, so a lifecycle
 * callback that fires twice cannot unbalance the scope's observer count.
 * </p>
 */
public final class Observation implements AutoCloseable {

    private final VisibilityScope scope;
    private final AtomicBoolean open = new AtomicBoolean(true);

    Observation(VisibilityScope scope) {
        this.scope = scope;
    }

    /**
     * @return {@code true} until the first {@link #close()}
     */
    public boolean isOpen() {
        return open.get();
    }

    public VisibilityScope scope() {
        return scope;
    }

    /**
     * Deactivate the scope, once.
     */
    @Override
    public void close() {
        if (open.compareAndSet(true, false)) {
            scope.deactivate();
        }
    }

    @Override
    public String toString() {
        return "Observation[" + scope.name() + (open.get() ? " OPEN" : " CLOSED") + "]";
    }
}
