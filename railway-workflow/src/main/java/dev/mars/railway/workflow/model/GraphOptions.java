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

package dev.mars.railway.workflow.model;

import java.util.Objects;

public final class GraphOptions {

    public static final int DEFAULT_MAX_ITERATIONS = 100;

    private static final GraphOptions DEFAULTS = new GraphOptions(DEFAULT_MAX_ITERATIONS, true, true);

    private final int maxIterations;
    private final boolean enableLoopDetection;
    private final boolean strictStateCheck;

    public GraphOptions(int maxIterations, boolean enableLoopDetection, boolean strictStateCheck) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("Max iterations must be positive: " + maxIterations);
        }
        this.maxIterations = maxIterations;
        this.enableLoopDetection = enableLoopDetection;
        this.strictStateCheck = strictStateCheck;
    }

    public static GraphOptions defaults() {
        return DEFAULTS;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public boolean isEnableLoopDetection() {
        return enableLoopDetection;
    }

    public boolean isStrictStateCheck() {
        return strictStateCheck;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphOptions that = (GraphOptions) o;
        return maxIterations == that.maxIterations &&
               enableLoopDetection == that.enableLoopDetection &&
               strictStateCheck == that.strictStateCheck;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxIterations, enableLoopDetection, strictStateCheck);
    }

    @Override
    public String toString() {
        return "GraphOptions{" +
               "maxIterations=" + maxIterations +
               ", enableLoopDetection=" + enableLoopDetection +
               ", strictStateCheck=" + strictStateCheck +
               '}';
    }
}
