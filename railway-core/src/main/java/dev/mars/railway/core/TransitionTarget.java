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

/**
 * Entry of a {@link TransitionTable}: either continue with another node or terminate
 * the run. Decided when the table is built, never re-parsed during a run.
 */
public sealed interface TransitionTarget<C> permits TransitionTarget.Continue, TransitionTarget.Terminate {

    /**
     * Invoke the named node next. Exactly one of {@code node} and {@code asyncNode} is set.
     */
    record Continue<C>(String nodeName, Node<C> node, AsyncNode<C> asyncNode) implements TransitionTarget<C> {

        public Continue {
            Objects.requireNonNull(nodeName, "Node name cannot be null");
            if ((node == null) == (asyncNode == null)) {
                throw new IllegalArgumentException("Exactly one of node or asyncNode must be set for " + nodeName);
            }
        }

        public boolean isAsync() {
            return asyncNode != null;
        }
    }

    /**
     * End the run. With an exit node the node is invoked first; without one this is a
     * legacy {@code exit::colour::name} marker and the run ends immediately.
     */
    record Terminate<C>(ExitClassification classification, String exitNodeName,
                        ExitNode<C> exitNode, AsyncExitNode<C> asyncExitNode) implements TransitionTarget<C> {

        public Terminate {
            Objects.requireNonNull(classification, "Classification cannot be null");
            if (exitNode != null && asyncExitNode != null) {
                throw new IllegalArgumentException("Only one of exitNode or asyncExitNode may be set for " + exitNodeName);
            }
            if ((exitNode != null || asyncExitNode != null) && exitNodeName == null) {
                throw new IllegalArgumentException("Exit node name is required when an exit node is set");
            }
        }

        public static <C> Terminate<C> marker(ExitClassification classification) {
            return new Terminate<>(classification, null, null, null);
        }

        public boolean isMarker() {
            return exitNode == null && asyncExitNode == null;
        }
    }
}
