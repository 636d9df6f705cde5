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

import dev.mars.railway.core.observability.StepObserver;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Per-run routing state shared by the synchronous and asynchronous runners. Lives for a
 * single run and is discarded once the {@link DagRunnerResult} exists.
 */
final class RunState<C> {

    private static final Logger logger = Logger.getLogger(RunState.class.getName());

    private final String startNode;
    private final TransitionTable<C> table;
    private final RunnerOptions options;
    private final List<String> executionPath = new ArrayList<>();
    private final long startNanos = System.nanoTime();

    private int iterations;
    private C context;
    private String currentNode;
    private String currentState;

    RunState(String startNode, TransitionTable<C> table, RunnerOptions options) {
        this.startNode = Objects.requireNonNull(startNode, "Start node name cannot be null");
        this.table = Objects.requireNonNull(table, "Transition table cannot be null");
        this.options = Objects.requireNonNull(options, "Runner options cannot be null");
    }

    String startNode() {
        return startNode;
    }

    C context() {
        return context;
    }

    int iterations() {
        return iterations;
    }

    double elapsedSeconds() {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    /**
     * Raises {@link MaxIterationsException} when one more invocation would exceed the bound.
     */
    void beforeInvocation() {
        if (iterations >= options.getMaxIterations()) {
            options.getMetrics().recordMaxIterationsExceeded(startNode);
            int from = Math.max(0, executionPath.size() - options.getPathTailSize());
            throw new MaxIterationsException(options.getMaxIterations(), executionPath.subList(from, executionPath.size()));
        }
    }

    void afterNode(String nodeName, NodeResult<C> result) {
        if (result == null) {
            throw new DagRunnerException("Node '" + nodeName + "' returned no result");
        }
        iterations++;
        executionPath.add(nodeName);
        context = result.context();
        currentNode = nodeName;
        currentState = result.outcome().toStateString(nodeName);
        options.getMetrics().recordStep(startNode, nodeName);
        logger.fine("[" + iterations + "] " + nodeName + " -> " + currentState);
        notifyObserver(nodeName, currentState, context);
    }

    /**
     * Looks up the transition for the current state.
     *
     * @return the target, or {@code null} when the state is undefined and the run is lenient
     * @throws UndefinedStateException when the state is undefined and the run is strict
     */
    TransitionTarget<C> route() {
        TransitionTarget<C> target = table.lookup(currentState).orElse(null);
        if (target == null) {
            options.getMetrics().recordUndefinedState(startNode, currentNode);
            if (options.isStrict()) {
                throw new UndefinedStateException(currentState, currentNode);
            }
            logger.warning("Undefined state: " + currentState + " (node: " + currentNode + ")");
        }
        return target;
    }

    DagRunnerResult finishUndefined() {
        return new DagRunnerResult(null, context, iterations, executionPath, null);
    }

    DagRunnerResult finishMarker(TransitionTarget.Terminate<C> terminate) {
        logger.fine("Run ended on exit marker " + terminate.classification().exitState());
        return new DagRunnerResult(terminate.classification(), context, iterations, executionPath, null);
    }

    DagRunnerResult finishExit(TransitionTarget.Terminate<C> terminate, Object payload) {
        String exitNodeName = terminate.exitNodeName();
        iterations++;
        executionPath.add(exitNodeName);
        options.getMetrics().recordStep(startNode, exitNodeName);

        ExitContract contract = payload instanceof ExitContract ? (ExitContract) payload : null;
        ExitClassification classification = contract != null ? contract.classification() : terminate.classification();
        logger.fine("[" + iterations + "] " + exitNodeName + " -> exit::" + classification.exitState());
        notifyObserver(exitNodeName, "exit::" + classification.exitState(), payload);

        Object finalContext = contract != null ? contract.context() : payload;
        ExitContract returned = contract != null ? contract : new DefaultExitContract(classification, payload);
        return new DagRunnerResult(classification, finalContext, iterations, executionPath, returned);
    }

    private void notifyObserver(String nodeName, String state, Object payload) {
        StepObserver observer = options.getObserver();
        if (observer != null) {
            observer.onStep(nodeName, state, payload);
        }
    }
}
