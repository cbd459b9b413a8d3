/*
 [File Info]
 path: src/main/java/tech/robd/jscope/ObserverImbalanceException.java
 description: Thrown under ImbalancePolicy.FAIL_FAST when a scope is deactivated more often
              than it was activated.
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

package tech.robd.jscope;

/**
 * Signals mismatched {@link VisibilityScope#activate()} / {@link VisibilityScope#deactivate()}
 * calls in the code binding observers to a scope.
 * <p>
 * By the time this is thrown the scope has already clamped its observer count to zero and
 * cancelled its tasks, so the scope itself remains usable. The fix belongs in the caller.
 * </p>
 *
 * @see ImbalancePolicy#FAIL_FAST
 */
public final class ObserverImbalanceException extends IllegalStateException {

    private final String scopeName;

    /**
     * @param scopeName name of the scope that saw the extra deactivation
     */
    public ObserverImbalanceException(String scopeName) {
        super("Observer count of scope '" + scopeName
                + "' dropped below zero: deactivate() called without a matching activate()");
        this.scopeName = scopeName;
    }

    /**
     * @return name of the scope that saw the extra deactivation
     */
    public String scopeName() {
        return scopeName;
    }
}
