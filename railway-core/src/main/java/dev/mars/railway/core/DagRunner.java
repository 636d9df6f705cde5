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

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.logging.Logger;

/**
 * Synchronous interpreter for a {@link TransitionTable}.
 * <p>
 * Invokes the start node, turns each {@link Outcome} into a state string, looks the
 * state up and keeps going until an exit is reached. Async nodes found in the table are
 * awaited on the calling thread. Node and observer exceptions propagate unchanged.
 *
 * <pre>{@code
 * DagRunner runner = new DagRunner(RunnerOptions.builder().maxIterations(20).build());
 * DagRunnerResult result = runner.run("fetch", Nodes::fetch, table);
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class DagRunner {

    private static final Logger logger = Logger.getLogger(DagRunner.class.getName());
    private static final String MODE = "sync";

    private final RunnerOptions options;

    public DagRunner() {
        this(RunnerOptions.defaults());
    }

    public DagRunner(RunnerOptions options) {
        this.options = Objects.requireNonNull(options, "Runner options cannot be null");
    }

    public static DagRunner fromConfiguration(RunnerConfiguration configuration) {
        return new DagRunner(RunnerOptions.fromConfiguration(configuration).build());
    }

    public RunnerOptions getOptions() {
        return options;
    }

    /**
     * Runs the table from {@code start}, registered under {@code startName}.
     *
     * @throws UndefinedStateException in strict mode when a state has no entry
     * @throws MaxIterationsException  when the iteration bound is reached
     */
    public <C> DagRunnerResult run(String startName, StartNode<C> start, TransitionTable<C> table) {
        Objects.requireNonNull(start, "Start node cannot be null");
        RunState<C> state = new RunState<>(startName, table, options);
        logger.fine("Starting run at " + startName + " with " + options);
        options.getMetrics().recordRunStarted(startName, MODE);

        try {
            DagRunnerResult result = execute(state, start);
            options.getMetrics().recordRunCompleted(startName, MODE, result.exitCode(),
                    result.iterations(), state.elapsedSeconds());
            logger.fine("Run from " + startName + " finished with exit '" + result.exitState()
                    + "' after " + result.iterations() + " iterations");
            return result;
        } catch (RuntimeException | Error e) {
            options.getMetrics().recordRunFailed(startName, MODE, e.getClass().getSimpleName());
            throw e;
        }
    }

    private <C> DagRunnerResult execute(RunState<C> state, StartNode<C> start) {
        state.beforeInvocation();
        state.afterNode(state.startNode(), start.call());

        while (true) {
            TransitionTarget<C> target = state.route();
            if (target == null) {
                return state.finishUndefined();
            }
            if (target instanceof TransitionTarget.Terminate<C> terminate) {
                if (terminate.isMarker()) {
                    return state.finishMarker(terminate);
                }
                state.beforeInvocation();
                Object payload = terminate.exitNode() != null
                        ? terminate.exitNode().apply(state.context())
                        : await(terminate.asyncExitNode().apply(state.context()));
                return state.finishExit(terminate, payload);
            }

            TransitionTarget.Continue<C> next = (TransitionTarget.Continue<C>) target;
            state.beforeInvocation();
            NodeResult<C> result = next.isAsync()
                    ? await(next.asyncNode().apply(state.context()))
                    : next.node().apply(state.context());
            state.afterNode(next.nodeName(), result);
        }
    }

    private static <T> T await(CompletionStage<T> stage) {
        try {
            return stage.toCompletableFuture().join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new DagRunnerException("Async node failed", cause);
        }
    }
}
