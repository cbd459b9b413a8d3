/*
 [File Info]
 path: src/main/java/tech/robd/jscope/diagnostics/DiagnosticsBackend.java
 description: Package-private SLF4J sink for scope tracing. One global switch, read from the
              system property `jscope.diag` at class load and flipped through Diagnostics.
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LocationAwareLogger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Routes trace messages from {@link Diagnostics} instances to SLF4J.
 *
 * <p>Loggers are cached per owner class. When the bound logger is a
 * {@link LocationAwareLogger} the call site is attributed to the code that called
 * {@link Diagnostics}, not to this class.</p>
 */
final class DiagnosticsBackend {

    // 🧩 Section: state
    static final String PROPERTY = "jscope.diag";

    private static final String FQCN = DiagnosticsBackend.class.getName();
    private static final ConcurrentMap<Class<?>, Logger> LOGGERS = new ConcurrentHashMap<>();

    private static volatile boolean enabled = Boolean.parseBoolean(
            System.getProperty(PROPERTY, "false").trim());
    // [/🧩 Section: state]

    private DiagnosticsBackend() {
    }

    // 🧩 Section: switch
    static boolean isEnabled() {
        return enabled;
    }

    static void setEnabled(boolean on) {
        enabled = on;
    }
    // [/🧩 Section: switch]

    // 🧩 Section: emit

    /**
     * Emit {@code msg} at {@code level} for {@code owner}. Returns immediately while tracing is off.
     *
     * @param level one of the {@code LocationAwareLogger.*_INT} constants
     */
    static void emit(Class<?> owner, int level, String msg, Object... args) {
        if (!enabled) return;
        Logger log = LOGGERS.computeIfAbsent(owner, LoggerFactory::getLogger);
        // 🧩 Point: emit/location-aware
        if (log instanceof LocationAwareLogger law) {
            law.log(null, FQCN, level, msg, args, null);
            return;
        }
        switch (level) {
            case LocationAwareLogger.ERROR_INT -> log.error(msg, args);
            case LocationAwareLogger.WARN_INT -> log.warn(msg, args);
            case LocationAwareLogger.INFO_INT -> log.info(msg, args);
            default -> log.debug(msg, args);
        }
    }
    // [/🧩 Section: emit]
}
