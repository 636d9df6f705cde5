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

import dev.mars.railway.core.StateStrings;

import java.util.Objects;

/**
 * Edge of a transition graph: when {@code fromNode} produces {@code fromState}
 * ({@code outcome::detail}), continue with {@code toTarget}. The target is either a node
 * name or a legacy {@code exit::<name>} reference.
 */
public final class StateTransition {

    private final String fromNode;
    private final String fromState;
    private final String toTarget;

    public StateTransition(String fromNode, String fromState, String toTarget) {
        this.fromNode = Objects.requireNonNull(fromNode, "From node cannot be null");
        this.fromState = Objects.requireNonNull(fromState, "From state cannot be null");
        this.toTarget = Objects.requireNonNull(toTarget, "Target cannot be null");
    }

    public String getFromNode() {
        return fromNode;
    }

    public String getFromState() {
        return fromState;
    }

    public String getToTarget() {
        return toTarget;
    }

    /**
     * Full state string used as the runtime lookup key.
     */
    public String getStateString() {
        return fromNode + StateStrings.SEPARATOR + fromState;
    }

    public boolean isLegacyExit() {
        return StateStrings.isExitMarker(toTarget);
    }

    /**
     * @return the exit referenced by a legacy target, or {@code null} for node targets
     */
    public String getExitName() {
        return isLegacyExit() ? toTarget.substring(StateStrings.EXIT_MARKER_PREFIX.length()) : null;
    }

    public StateTransition withTarget(String target) {
        return new StateTransition(fromNode, fromState, target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StateTransition that = (StateTransition) o;
        return Objects.equals(fromNode, that.fromNode) &&
               Objects.equals(fromState, that.fromState) &&
               Objects.equals(toTarget, that.toTarget);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromNode, fromState, toTarget);
    }

    @Override
    public String toString() {
        return fromNode + "::" + fromState + " -> " + toTarget;
    }
}
