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

package dev.mars.railway.core;

import java.util.List;

/**
 * Thrown when a run would invoke more nodes than its iteration bound allows.
 * Carries the tail of the execution path for diagnosis.
 */
public class MaxIterationsException extends DagRunnerException {

    private final int maxIterations;
    private final List<String> pathTail;

    public MaxIterationsException(int maxIterations, List<String> pathTail) {
        super("Maximum iterations (" + maxIterations + ") reached. Execution path: "
                + String.join(" -> ", pathTail));
        this.maxIterations = maxIterations;
        this.pathTail = List.copyOf(pathTail);
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public List<String> getPathTail() {
        return pathTail;
    }
}
