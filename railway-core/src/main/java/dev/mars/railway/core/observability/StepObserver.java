/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.railway.core.observability;

/**
 * Receives every executed step of a run, synchronously and in execution order.
 * Exceptions thrown by an observer abort the run.
 */
@FunctionalInterface
public interface StepObserver {

    /**
     * @param nodeName the node that just ran
     * @param state    the state string it produced, or {@code exit::<exitState>} for exit nodes
     * @param context  the context after the step, or the exit node's payload
     */
    void onStep(String nodeName, String state, Object context);
}
