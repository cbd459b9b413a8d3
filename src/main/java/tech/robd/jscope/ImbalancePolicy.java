/*
 [File Info]
 path: src/main/java/tech/robd/jscope/ImbalancePolicy.java
 description: What a scope does when deactivate() is called more often than activate().
              Default resolved from `jscope.strict` or the library's assertion status.
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

package tech.robd.jscope;

/**
 * Reaction to an observer count that would go below zero.
 *
 * <p>Both policies clamp the count to zero, count the violation and log it at WARN. They differ
 * only in whether the offending {@link VisibilityScope#deactivate()} call then fails.</p>
 */
public enum ImbalancePolicy {

    /** Clamp, log and carry on. */
    CLAMP,

    /** Clamp, log, then throw {@link ObserverImbalanceException}. */
    FAIL_FAST;

    // 🧩 Section: configuration

    /**
     * System property overriding the default: {@code -Djscope.strict=true} selects
     * {@link #FAIL_FAST}, {@code false} selects {@link #CLAMP}.
     */
    public static final String STRICT_PROPERTY = "jscope.strict";

    /**
     * Resolve the process-wide default.
     * <p>An explicit {@value #STRICT_PROPERTY} wins. Without it the library fails fast when JVM
     * assertions are enabled for it ({@code -ea}) and clamps otherwise.</p>
     *
     * @return the default policy
     */
    public static ImbalancePolicy fromEnvironment() {
        String strict = System.getProperty(STRICT_PROPERTY);
        if (strict != null && !strict.isBlank()) {
            return Boolean.parseBoolean(strict.trim()) ? FAIL_FAST : CLAMP;
        }
        return VisibilityScope.class.desiredAssertionStatus() ? FAIL_FAST : CLAMP;
    }
    // [/🧩 Section: configuration]
}
