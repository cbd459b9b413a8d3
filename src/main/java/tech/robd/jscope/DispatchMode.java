/*
 [File Info]
 path: src/main/java/tech/robd/jscope/DispatchMode.java
 description: How submitted work is handed to its dispatcher: normal, detached, or immediate.
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
 * Dispatch mode of a submitted task. The mode changes where and when work starts; the scope
 * keeps and cancels the resulting handle the same way in every mode.
 */
public enum DispatchMode {

    /**
     * Queue the work. When submitted from inside a running scoped task, the new task takes
     * that task's dispatcher and priority unless the options set their own.
     */
    NORMAL,

    /**
     * Queue the work without inheriting anything from a calling task. Runs on the scope's
     * default dispatcher unless the options name one.
     */
    DETACHED,

    /**
     * Start the work and wait until it reaches its first suspension point
     * ({@link TaskContext#delay(long)}, {@link TaskContext#yield()},
     * {@link TaskContext#awaitCancellation()}) or finishes. Inherits like {@link #NORMAL}.
     *
     * <p>Submitted from a task already running on the target dispatcher, the call returns
     * without waiting: that worker may be the only one able to run the prefix.</p>
     */
    @Experimental("Java has no suspension points; the synchronous prefix runs on the worker while the caller waits")
    IMMEDIATE
}
