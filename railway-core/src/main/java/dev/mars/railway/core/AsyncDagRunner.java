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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Logger;

/**
 * Cooperative interpreter for tables whose nodes may suspend.
 * <p>
 * Routing is identical to {@link DagRunner}. The runner never switches threads itself:
 * completed stages are consumed in a loop and pending ones are chained with
 * {@code thenCompose}, so continuations run on whichever thread completes the node.
 * Failures complete the returned future exceptionally.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class AsyncDagRunner {

    private static final Logger logger = Logger.getLogger(AsyncDagRunner.class.getName());
    private static final String MODE = "async";

    private final RunnerOptions options;

    public AsyncDagRunner() {
        this(RunnerOptions.defaults());
    }

    public AsyncDagRunner(RunnerOptions options) {
        this.options = Objects.requireNonNull(options, "Runner options cannot be null");
    }

    public static AsyncDagRunner fromConfiguration(RunnerConfiguration configuration) {
        return new AsyncDagRunner(RunnerOptions.fromConfiguration(configuration).build());
    }

    public RunnerOptions getOptions() {
        return options;
    }

    /**
     * Runs the table from {@code start}. Use {@link AsyncStartNode#of(StartNode)} for a
     * start node that does not suspend.
     */
    public <C> CompletableFuture<DagRunnerResult> run(String startName, AsyncStartNode<C> start, TransitionTable<C> table) {
        Objects.requireNonNull(start, "Start node cannot be null");
        RunState<C> state = new RunState<>(startName, table, options);
        logger.fine("Starting async run at " + startName + " with " + options);
        options.getMetrics().recordRunStarted(startName, MODE);

        CompletableFuture<DagRunnerResult> future;
        try {
            state.beforeInvocation();
            CompletableFuture<NodeResult<C>> first = start.call().toCompletableFuture();
            future = continueWith(state, state.startNode(), first);
        } catch (RuntimeException | Error e) {
            future = CompletableFuture.failedFuture(e);
        }

        return future.whenComplete((result, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                options.getMetrics().recordRunFailed(startName, MODE, cause.getClass().getSimpleName());
            } else {
                options.getMetrics().recordRunCompleted(startName, MODE, result.exitCode(),
                        result.iterations(), state.elapsedSeconds());
                logger.fine("Async run from " + startName + " finished with exit '" + result.exitState() + "'");
            }
        });
    }

    private <C> CompletableFuture<DagRunnerResult> continueWith(RunState<C> state, String nodeName,
                                                                CompletableFuture<NodeResult<C>> pending) {
        if (pending.isDone() && !pending.isCompletedExceptionally()) {
            state.afterNode(nodeName, pending.join());
            return advance(state);
        }
        return pending.thenCompose(result -> {
            state.afterNode(nodeName, result);
            return advance(state);
        });
    }

    private <C> CompletableFuture<DagRunnerResult> advance(RunState<C> state) {
        while (true) {
            TransitionTarget<C> target = state.route();
            if (target == null) {
                return CompletableFuture.completedFuture(state.finishUndefined());
            }
            if (target instanceof TransitionTarget.Terminate<C> terminate) {
                if (terminate.isMarker()) {
                    return CompletableFuture.completedFuture(state.finishMarker(terminate));
                }
                state.beforeInvocation();
                CompletableFuture<Object> payload = terminate.exitNode() != null
                        ? CompletableFuture.completedFuture(terminate.exitNode().apply(state.context()))
                        : terminate.asyncExitNode().apply(state.context()).toCompletableFuture();
                return payload.thenApply(value -> state.finishExit(terminate, value));
            }

            TransitionTarget.Continue<C> next = (TransitionTarget.Continue<C>) target;
            state.beforeInvocation();
            CompletableFuture<NodeResult<C>> pending = next.isAsync()
                    ? next.asyncNode().apply(state.context()).toCompletableFuture()
                    : CompletableFuture.completedFuture(next.node().apply(state.context()));

            if (pending.isDone() && !pending.isCompletedExceptionally()) {
                state.afterNode(next.nodeName(), pending.join());
                continue;
            }
            return pending.thenCompose(result -> {
                state.afterNode(next.nodeName(), result);
                return advance(state);
            });
        }
    }
}
