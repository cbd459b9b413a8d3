/*
 [File Info]
 path: src/test/java/tech/robd/jscope/tools/EventLog.java
 description: Thread-safe ordered log of named events, used to assert happens-before ordering
              between work running on different threads.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Ordered, append-only event record shared between a test and the work it submits.
 *
 * <pre>{@code
 * EventLog log = new EventLog();
 * scope.submit(task -> log.add("a-start"));
 * log.assertBefore("a-cancel", "b-start");
 * }</pre>
 */
public final class EventLog {

    private final List<String> events = new CopyOnWriteArrayList<>();

    public void add(String event) {
        events.add(event);
    }

    public boolean contains(String event) {
        return events.contains(event);
    }

    public int count(String event) {
        return (int) events.stream().filter(event::equals).count();
    }

    public List<String> snapshot() {
        return List.copyOf(events);
    }

    /**
     * Assert that both events were recorded and {@code first} was recorded before {@code second}.
     */
    public void assertBefore(String first, String second) {
        int a = events.indexOf(first);
        int b = events.indexOf(second);
        assertTrue(a >= 0, "missing event '" + first + "' in " + events);
        assertTrue(b >= 0, "missing event '" + second + "' in " + events);
        assertTrue(a < b, "expected '" + first + "' before '" + second + "' in " + events);
    }

    @Override
    public String toString() {
        return events.toString();
    }
}
