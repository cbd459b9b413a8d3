/*
 [File Info]
 path: src/main/java/tech/robd/jscope/TaskPriority.java
 description: Priority hint for scoped work, applied as the worker thread's priority while the
              work runs.
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
 * Scheduling hint for submitted work.
 *
 * <p>The hint is advisory: the worker thread's priority is raised or lowered for the duration
 * of the task and restored afterwards. The operating system may ignore Java thread priorities.</p>
 */
public enum TaskPriority {
    /** User-facing work that should finish as soon as possible. */
    HIGH(8),
    /** The default for work with no stated urgency. */
    MEDIUM(Thread.NORM_PRIORITY),
    /** Work the user is not waiting on. */
    LOW(3),
    /** Maintenance work. */
    BACKGROUND(Thread.MIN_PRIORITY);

    private final int threadPriority;

    TaskPriority(int threadPriority) {
        this.threadPriority = threadPriority;
    }

    /**
     * @return the {@link Thread#setPriority(int)} value this hint maps to
     */
    public int threadPriority() {
        return threadPriority;
    }
}
