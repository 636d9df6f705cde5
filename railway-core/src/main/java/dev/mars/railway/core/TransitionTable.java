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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable routing table from state strings to {@link TransitionTarget}s.
 * <p>
 * Every node is registered under an explicit name when the table is built; the runner
 * never derives node names from the callables themselves.
 *
 * <pre>{@code
 * TransitionTable<Order> table = TransitionTable.<Order>builder()
 *         .next("fetch::success::done", "validate", Nodes::validate)
 *         .exit("validate::success::done", "exit.success.done", Nodes::done)
 *         .terminate("validate::failure::error", "exit::red::error")
 *         .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class TransitionTable<C> {

    private final Map<String, TransitionTarget<C>> entries;

    private TransitionTable(Map<String, TransitionTarget<C>> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static <C> Builder<C> builder() {
        return new Builder<>();
    }

    public Optional<TransitionTarget<C>> lookup(String state) {
        return Optional.ofNullable(entries.get(state));
    }

    public boolean contains(String state) {
        return entries.containsKey(state);
    }

    public Set<String> states() {
        return entries.keySet();
    }

    public Map<String, TransitionTarget<C>> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "TransitionTable{states=" + entries.size() + "}";
    }

    public static final class Builder<C> {

        private final Map<String, TransitionTarget<C>> entries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder<C> next(String state, String nodeName, Node<C> node) {
            Objects.requireNonNull(node, "Node cannot be null");
            return put(state, new TransitionTarget.Continue<>(nodeName, node, null));
        }

        public Builder<C> nextAsync(String state, String nodeName, AsyncNode<C> node) {
            Objects.requireNonNull(node, "Async node cannot be null");
            return put(state, new TransitionTarget.Continue<>(nodeName, null, node));
        }

        /**
         * Routes to an exit node; the classification comes from its name.
         */
        public Builder<C> exit(String state, String exitNodeName, ExitNode<C> exitNode) {
            Objects.requireNonNull(exitNode, "Exit node cannot be null");
            return put(state, new TransitionTarget.Terminate<>(
                    classify(exitNodeName), exitNodeName, exitNode, null));
        }

        /**
         * Routes to an exit node with an explicitly declared exit code.
         */
        public Builder<C> exit(String state, String exitNodeName, int exitCode, ExitNode<C> exitNode) {
            Objects.requireNonNull(exitNode, "Exit node cannot be null");
            return put(state, new TransitionTarget.Terminate<>(
                    classify(exitNodeName).withExitCode(exitCode), exitNodeName, exitNode, null));
        }

        public Builder<C> exitAsync(String state, String exitNodeName, AsyncExitNode<C> exitNode) {
            Objects.requireNonNull(exitNode, "Async exit node cannot be null");
            return put(state, new TransitionTarget.Terminate<>(
                    classify(exitNodeName), exitNodeName, null, exitNode));
        }

        public Builder<C> exitAsync(String state, String exitNodeName, int exitCode, AsyncExitNode<C> exitNode) {
            Objects.requireNonNull(exitNode, "Async exit node cannot be null");
            return put(state, new TransitionTarget.Terminate<>(
                    classify(exitNodeName).withExitCode(exitCode), exitNodeName, null, exitNode));
        }

        /**
         * Ends the run on a legacy {@code exit::colour::name} marker without invoking any node.
         */
        public Builder<C> terminate(String state, String legacyMarker) {
            return put(state, TransitionTarget.Terminate.marker(ExitClassification.fromLegacyMarker(legacyMarker)));
        }

        public Builder<C> terminate(String state, ExitClassification classification) {
            return put(state, TransitionTarget.Terminate.marker(classification));
        }

        public Builder<C> put(String state, TransitionTarget<C> target) {
            Objects.requireNonNull(target, "Target cannot be null");
            StateStrings.parseState(state);
            if (entries.putIfAbsent(state, target) != null) {
                throw new IllegalArgumentException("Duplicate transition for state: " + state);
            }
            return this;
        }

        public TransitionTable<C> build() {
            return new TransitionTable<>(entries);
        }

        private static ExitClassification classify(String exitNodeName) {
            Objects.requireNonNull(exitNodeName, "Exit node name cannot be null");
            return ExitClassification.fromExitNodeName(exitNodeName);
        }
    }
}
