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

import dev.mars.railway.core.observability.RunnerMetrics;
import dev.mars.railway.core.observability.StepObserver;

import java.util.Objects;

/**
 * Settings shared by {@link DagRunner} and {@link AsyncDagRunner}. Passed in explicitly at
 * construction; no runner reads process-wide state.
 */
public final class RunnerOptions {

    private final int maxIterations;
    private final boolean strict;
    private final StepObserver observer;
    private final RunnerMetrics metrics;
    private final int pathTailSize;

    private RunnerOptions(Builder builder) {
        this.maxIterations = builder.maxIterations;
        this.strict = builder.strict;
        this.observer = builder.observer;
        this.metrics = builder.metrics != null ? builder.metrics : RunnerMetrics.noop();
        this.pathTailSize = builder.pathTailSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RunnerOptions defaults() {
        return builder().build();
    }

    /**
     * Builder preloaded from a {@link RunnerConfiguration}. Metrics are bound to the global
     * OpenTelemetry instance when enabled.
     */
    public static Builder fromConfiguration(RunnerConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        return builder()
                .maxIterations(configuration.getMaxIterations())
                .strict(configuration.isStrict())
                .pathTailSize(configuration.getPathTailSize())
                .metrics(configuration.isMetricsEnabled() ? RunnerMetrics.getInstance() : RunnerMetrics.noop());
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * @return the observer, or {@code null} when none is registered
     */
    public StepObserver getObserver() {
        return observer;
    }

    public RunnerMetrics getMetrics() {
        return metrics;
    }

    public int getPathTailSize() {
        return pathTailSize;
    }

    public Builder toBuilder() {
        return builder()
                .maxIterations(maxIterations)
                .strict(strict)
                .observer(observer)
                .metrics(metrics)
                .pathTailSize(pathTailSize);
    }

    @Override
    public String toString() {
        return "RunnerOptions{" +
                "maxIterations=" + maxIterations +
                ", strict=" + strict +
                ", observer=" + (observer != null) +
                ", pathTailSize=" + pathTailSize +
                '}';
    }

    public static final class Builder {
        private int maxIterations = RunnerConfiguration.DEFAULT_MAX_ITERATIONS;
        private boolean strict = RunnerConfiguration.DEFAULT_STRICT;
        private StepObserver observer;
        private RunnerMetrics metrics;
        private int pathTailSize = RunnerConfiguration.DEFAULT_PATH_TAIL_SIZE;

        private Builder() {
        }

        public Builder maxIterations(int maxIterations) {
            if (maxIterations <= 0) {
                throw new IllegalArgumentException("Max iterations must be positive: " + maxIterations);
            }
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder observer(StepObserver observer) {
            this.observer = observer;
            return this;
        }

        public Builder metrics(RunnerMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder pathTailSize(int pathTailSize) {
            if (pathTailSize <= 0) {
                throw new IllegalArgumentException("Path tail size must be positive: " + pathTailSize);
            }
            this.pathTailSize = pathTailSize;
            return this;
        }

        public RunnerOptions build() {
            return new RunnerOptions(this);
        }
    }
}
