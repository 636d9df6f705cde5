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

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the DAG runners.
 *
 * Provides the runner metrics:
 * - railway.runner.active (gauge) - Runs currently in progress
 * - railway.runner.runs.total (counter) - Runs started
 * - railway.runner.runs.completed (counter) - Runs that reached an exit or ended leniently
 * - railway.runner.runs.failed (counter) - Runs aborted by an exception
 * - railway.runner.steps.total (counter) - Node invocations
 * - railway.runner.undefined_states (counter) - Undefined states encountered
 * - railway.runner.max_iterations_exceeded (counter) - Runs stopped by the iteration bound
 * - railway.runner.iterations (histogram) - Node invocations per completed run
 * - railway.runner.duration.seconds (histogram) - Run duration distribution
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-27
 * @version 1.0 (OpenTelemetry)
 */
public class RunnerMetrics {

    private static final Logger logger = Logger.getLogger(RunnerMetrics.class.getName());
    private static final String METER_NAME = "railway-runner";

    private static RunnerMetrics instance;

    // Counters
    private final LongCounter runsTotal;
    private final LongCounter runsCompleted;
    private final LongCounter runsFailed;
    private final LongCounter stepsTotal;
    private final LongCounter undefinedStates;
    private final LongCounter maxIterationsExceeded;

    // Histograms
    private final LongHistogram iterations;
    private final DoubleHistogram runDuration;

    private final AtomicLong activeRuns = new AtomicLong(0);

    private static final AttributeKey<String> WORKFLOW_KEY = AttributeKey.stringKey("workflow.start_node");
    private static final AttributeKey<String> MODE_KEY = AttributeKey.stringKey("execution.mode");
    private static final AttributeKey<String> NODE_KEY = AttributeKey.stringKey("node.name");
    private static final AttributeKey<String> EXIT_KEY = AttributeKey.stringKey("exit.code");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");

    public RunnerMetrics(Meter meter) {
        Objects.requireNonNull(meter, "Meter cannot be null");

        runsTotal = meter.counterBuilder("railway.runner.runs.total")
                .setDescription("Total number of runs started")
                .setUnit("1")
                .build();

        runsCompleted = meter.counterBuilder("railway.runner.runs.completed")
                .setDescription("Number of runs that finished without an exception")
                .setUnit("1")
                .build();

        runsFailed = meter.counterBuilder("railway.runner.runs.failed")
                .setDescription("Number of runs aborted by an exception")
                .setUnit("1")
                .build();

        stepsTotal = meter.counterBuilder("railway.runner.steps.total")
                .setDescription("Total number of node invocations")
                .setUnit("1")
                .build();

        undefinedStates = meter.counterBuilder("railway.runner.undefined_states")
                .setDescription("Number of states produced without a transition entry")
                .setUnit("1")
                .build();

        maxIterationsExceeded = meter.counterBuilder("railway.runner.max_iterations_exceeded")
                .setDescription("Number of runs stopped by the iteration bound")
                .setUnit("1")
                .build();

        iterations = meter.histogramBuilder("railway.runner.iterations")
                .setDescription("Node invocations per completed run")
                .setUnit("1")
                .ofLongs()
                .build();

        runDuration = meter.histogramBuilder("railway.runner.duration.seconds")
                .setDescription("Run duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("railway.runner.active")
                .setDescription("Number of runs currently in progress")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeRuns.get()));

        logger.fine("RunnerMetrics initialized");
    }

    /**
     * Get the shared instance bound to {@link GlobalOpenTelemetry}.
     */
    public static synchronized RunnerMetrics getInstance() {
        if (instance == null) {
            instance = new RunnerMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
        }
        return instance;
    }

    /**
     * Metrics that record nothing.
     */
    public static RunnerMetrics noop() {
        return new RunnerMetrics(OpenTelemetry.noop().getMeter(METER_NAME));
    }

    public void recordRunStarted(String startNode, String mode) {
        runsTotal.add(1, attributes(startNode, mode));
        activeRuns.incrementAndGet();
    }

    public void recordRunCompleted(String startNode, String mode, String exitCode,
                                   int iterationCount, double durationSeconds) {
        activeRuns.decrementAndGet();

        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_KEY, startNode)
                .put(MODE_KEY, mode)
                .put(EXIT_KEY, exitCode)
                .build();

        runsCompleted.add(1, attrs);
        iterations.record(iterationCount, attrs);
        runDuration.record(durationSeconds, attrs);
    }

    public void recordRunFailed(String startNode, String mode, String failureReason) {
        activeRuns.decrementAndGet();

        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_KEY, startNode)
                .put(MODE_KEY, mode)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();

        runsFailed.add(1, attrs);
    }

    public void recordStep(String startNode, String nodeName) {
        stepsTotal.add(1, Attributes.builder()
                .put(WORKFLOW_KEY, startNode)
                .put(NODE_KEY, nodeName)
                .build());
    }

    public void recordUndefinedState(String startNode, String nodeName) {
        undefinedStates.add(1, Attributes.builder()
                .put(WORKFLOW_KEY, startNode)
                .put(NODE_KEY, nodeName)
                .build());
    }

    public void recordMaxIterationsExceeded(String startNode) {
        maxIterationsExceeded.add(1, Attributes.of(WORKFLOW_KEY, startNode));
    }

    public long getActiveRuns() {
        return activeRuns.get();
    }

    private static Attributes attributes(String startNode, String mode) {
        return Attributes.builder()
                .put(WORKFLOW_KEY, startNode)
                .put(MODE_KEY, mode)
                .build();
    }
}
