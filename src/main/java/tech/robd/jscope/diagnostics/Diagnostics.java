/*
 [File Info]
 path: src/main/java/tech/robd/jscope/diagnostics/Diagnostics.java
 description: Owner-bound tracing facade used by the scope internals. Resolves to a no-op
              while tracing is disabled; backed by SLF4J otherwise.
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

package tech.robd.jscope.diagnostics;

import org.slf4j.spi.LocationAwareLogger;

/**
 * Tracing facade bound to an owning {@link Class}.
 *
 * <p>Scope, token and dispatcher internals trace every state transition through this
 * interface. Tracing is off unless {@code -Djscope.diag=true} is set or {@link #enable()} is
 * called, in which case messages go to the SLF4J logger of the owner class.</p>
 *
 * <pre>{@code
 * private static final Diagnostics DIAG = Diagnostics.of(MyType.class);
 * DIAG.debug("scope#{} flushed {} tasks", id, n);
 * if (DIAG.isActive()) DIAG.debug("state {}", expensiveDump());
 * }</pre>
 */
public interface Diagnostics {

    /**
     * @return the class whose logger receives this instance's messages
     */
    Class<?> owner();

    /**
     * @return whether a message passed to this instance right now would reach a logger;
     * use it to skip building costly arguments
     */
    boolean isActive();

    /**
     * Emit one message.
     *
     * @param level one of the {@code LocationAwareLogger.*_INT} constants
     */
    void log(int level, String msg, Object... args);

    // 🧩 Section: levels
    default void debug(String msg, Object... args) {
        log(LocationAwareLogger.DEBUG_INT, msg, args);
    }

    default void info(String msg, Object... args) {
        log(LocationAwareLogger.INFO_INT, msg, args);
    }

    default void warn(String msg, Object... args) {
        log(LocationAwareLogger.WARN_INT, msg, args);
    }

    default void error(String msg, Object... args) {
        log(LocationAwareLogger.ERROR_INT, msg, args);
    }
    // [/🧩 Section: levels]

    // 🧩 Section: factories

    /**
     * Diagnostics for {@code owner}. Returns the shared no-op when tracing is disabled at the
     * time of the call, so a {@code static final} field created while tracing is off stays silent.
     *
     * @param owner owning class
     * @return active or no-op diagnostics
     */
    static Diagnostics of(Class<?> owner) {
        return DiagnosticsBackend.isEnabled() ? new ActiveD(owner) : NoOpD.INSTANCE;
    }

    /**
     * Diagnostics for {@code owner} that consults the global switch on every call.
     *
     * @param owner owning class
     * @return an instance that follows {@link #enable()} and {@link #disable()}
     */
    static Diagnostics dynamic(Class<?> owner) {
        return new ActiveD(owner);
    }
    // [/🧩 Section: factories]

    // 🧩 Section: switch

    /** Turn tracing on for the whole process. */
    static void enable() {
        DiagnosticsBackend.setEnabled(true);
    }

    /** Turn tracing off for the whole process. */
    static void disable() {
        DiagnosticsBackend.setEnabled(false);
    }

    /**
     * @return whether tracing is currently on
     */
    static boolean isEnabled() {
        return DiagnosticsBackend.isEnabled();
    }
    // [/🧩 Section: switch]
}
