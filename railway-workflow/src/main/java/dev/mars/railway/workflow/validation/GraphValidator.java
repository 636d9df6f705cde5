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

package dev.mars.railway.workflow.validation;

import dev.mars.railway.core.ExitClassification;
import dev.mars.railway.core.StateStrings;
import dev.mars.railway.workflow.model.ExitDefinition;
import dev.mars.railway.workflow.model.NodeDefinition;
import dev.mars.railway.workflow.model.ParseWarning;
import dev.mars.railway.workflow.model.StateTransition;
import dev.mars.railway.workflow.model.TransitionGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Structural checks for transition graphs. Each check is callable on its own and returns
 * its own result; {@link #validate(TransitionGraph)} runs all of them and concatenates
 * the findings. Validation never throws for a defective graph.
 *
 * <p>Error codes:
 * <ul>
 *   <li>E001 start node not declared</li>
 *   <li>E002 legacy exit reference not declared in {@code exits}</li>
 *   <li>E003 transition target node not declared</li>
 *   <li>E004 reachable node without transitions</li>
 *   <li>E005 state declared twice for a node</li>
 *   <li>E006 reachable nodes that can never reach an exit</li>
 *   <li>E007 node name segment is not a usable identifier</li>
 * </ul>
 * Warning codes: W001 unreachable node, W002 conflicting node-local and top-level
 * transition, W003 exit code contradicts exit category, W004 unsupported version.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class GraphValidator {

    private static final Logger logger = Logger.getLogger(GraphValidator.class.getName());

    public static final Set<String> SUPPORTED_VERSIONS = Set.of("1.0");

    private static final Set<String> LEGACY_EXIT_PREFIXES = Set.of(
            ExitClassification.GREEN, ExitClassification.RED, ExitClassification.YELLOW,
            ExitClassification.SUCCESS, ExitClassification.FAILURE, ExitClassification.WARNING);

    public ValidationResult validate(TransitionGraph graph) {
        Objects.requireNonNull(graph, "Transition graph cannot be null");

        ValidationResult result = ValidationResult.combine(
                validateStartNodeExists(graph),
                validateTransitionTargets(graph),
                validateReachability(graph),
                validateTermination(graph),
                validateNoDuplicateStates(graph),
                validateNoInfiniteLoop(graph),
                validateIdentifiers(graph),
                validateTransitionConflicts(graph),
                validateExitCodes(graph),
                validateVersion(graph));

        logger.fine("Validated graph '" + graph.getEntrypoint() + "': " + result);
        return result;
    }

    public ValidationResult validateStartNodeExists(TransitionGraph graph) {
        ValidationResult result = new ValidationResult();
        if (!graph.hasNode(graph.getStartNode())) {
            result.addError("E001", graph.getStartNode(), null,
                    "Start node '" + graph.getStartNode() + "' is not defined");
        }
        return result;
    }

    public ValidationResult validateTransitionTargets(TransitionGraph graph) {
        ValidationResult result = new ValidationResult();
        for (StateTransition transition : graph.getTransitions()) {
            if (transition.isLegacyExit()) {
                String exitName = transition.getExitName();
                if (!isKnownLegacyExit(graph, exitName)) {
                    result.addError("E002", transition.getFromNode(), transition.getFromState(),
                            "Exit '" + exitName + "' is not defined (node '" + transition.getFromNode()
                                    + "', state '" + transition.getFromState() + "')");
                }
            } else if (!graph.hasNode(transition.getToTarget())) {
                result.addError("E003", transition.getFromNode(), transition.getFromState(),
                        "Target node '" + transition.getToTarget() + "' is not defined (node '"
                                + transition.getFromNode() + "', state '" + transition.getFromState() + "')");
            }
        }
        return result;
    }

    public ValidationResult validateReachability(TransitionGraph graph) {
        ValidationResult result = new ValidationResult();
        Set<String> reachable = findReachableNodes(graph);
        for (NodeDefinition node : graph.getNodes()) {
            if (!reachable.contains(node.getName())) {
                result.addWarning("W001", node.getName(), null,
                        "Node '" + node.getName() + "' is not reachable from the start node");
            }
        }
        return result;
    }

    /**
     * Exit nodes are exempt; every other reachable node needs at least one transition.
     */
    public ValidationResult validateTermination(TransitionGraph graph) {
        ValidationResult result = new ValidationResult();
        for (String nodeName : findReachableNodes(graph)) {
            boolean exit = graph.getNode(nodeName).map(NodeDefinition::isExit).orElse(false);
            if (!exit && graph.getTransitionsForNode(nodeName).isEmpty()) {
                result.addError("E004", nodeName, null,
                        "Node '" + nodeName + "' has no transitions (dead end)");
            }
        }
        return result;
    }

    public ValidationResult validateNoDuplicateStates(TransitionGraph graph) {
        ValidationResult result = new ValidationResult();
        for (NodeDefinition node : graph.getNodes()) {
            Set<String> seen = new HashSet<>();
            for (String state : graph.getStatesForNode(node.getName())) {
                if (!seen.add(state)) {
                    result.addError("E005", node.getName(), state,
                            "State '" + state + "' is declared more than once for node '" + node.getName() + "'");
                }
            }
        }
        return result;
    }

    /**
     * Walks the reversed edges from every exit to find the nodes that can finish; any
     * reachable node outside that set is stuck in a cycle with no way out.
     */
    public ValidationResult validateNoInfiniteLoop(TransitionGraph graph) {
        ValidationResult result = new ValidationResult();

        Set<String> canReachExit = new HashSet<>();
        Queue<String> queue = new ArrayDeque<>();

        for (NodeDefinition exitNode : graph.getExitNodes()) {
            if (canReachExit.add(exitNode.getName())) {
                queue.offer(exitNode.getName());
            }
        }
        for (StateTransition transition : graph.getTransitions()) {
            if (transition.isLegacyExit() && canReachExit.add(transition.getFromNode())) {
                queue.offer(transition.getFromNode());
            }
        }

        Map<String, List<String>> reverseEdges = new HashMap<>();
        for (StateTransition transition : graph.getTransitions()) {
            if (!transition.isLegacyExit()) {
                reverseEdges.computeIfAbsent(transition.getToTarget(), key -> new ArrayList<>())
                        .add(transition.getFromNode());
            }
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String source : reverseEdges.getOrDefault(current, List.of())) {
                if (canReachExit.add(source)) {
                    queue.offer(source);
                }
            }
        }

        Set<String> stuck = new TreeSet<>(findReachableNodes(graph));
        stuck.removeAll(canReachExit);
        if (!stuck.isEmpty()) {
            result.addError("E006",
                    "The following nodes can never reach an exit (possible infinite loop): "
                            + String.join(", ", stuck));
        }
        return result;
    }

    public ValidationResult validateIdentifiers(TransitionGraph graph) {
        ValidationResult result = new ValidationResult();
        for (NodeDefinition node : graph.getNodes()) {
            NameValidation validation = NameValidator.validateNodeName(node.getName());
            if (!validation.valid()) {
                result.addError("E007", node.getName(), null, validation.errorMessage(), validation.suggestion());
            }
        }
        return result;
    }

    /**
     * Surfaces the merge conflicts the parser recorded.
     */
    public ValidationResult validateTransitionConflicts(TransitionGraph graph) {
        ValidationResult result = new ValidationResult();
        for (ParseWarning warning : graph.getParseWarnings()) {
            result.addWarning(warning.getCode(), warning.getFieldPath(), null, warning.getMessage());
        }
        return result;
    }

    public ValidationResult validateExitCodes(TransitionGraph graph) {
        ValidationResult result = new ValidationResult();
        for (NodeDefinition exitNode : graph.getExitNodes()) {
            if (!ExitClassification.isExitNodeName(exitNode.getName())) {
                continue;
            }
            String category = ExitClassification.fromExitNodeName(exitNode.getName()).category();
            boolean contradicts = (ExitClassification.SUCCESS.equals(category) && exitNode.getExitCode() != 0)
                    || (ExitClassification.FAILURE.equals(category) && exitNode.getExitCode() == 0);
            if (contradicts) {
                result.addWarning("W003", exitNode.getName(), null,
                        "Exit node '" + exitNode.getName() + "' is in category '" + category
                                + "' but declares exit code " + exitNode.getExitCode());
            }
        }
        return result;
    }

    public ValidationResult validateVersion(TransitionGraph graph) {
        ValidationResult result = new ValidationResult();
        if (!SUPPORTED_VERSIONS.contains(graph.getVersion())) {
            result.addWarning("W004", "Graph version '" + graph.getVersion() + "' is not one of "
                    + new TreeSet<>(SUPPORTED_VERSIONS));
        }
        return result;
    }

    /**
     * Declared nodes reachable from the start node over node-to-node transitions, in
     * visiting order.
     */
    public Set<String> findReachableNodes(TransitionGraph graph) {
        Set<String> reachable = new LinkedHashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        queue.offer(graph.getStartNode());

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!graph.hasNode(current) || !reachable.add(current)) {
                continue;
            }
            for (StateTransition transition : graph.getTransitionsForNode(current)) {
                if (!transition.isLegacyExit()) {
                    queue.offer(transition.getToTarget());
                }
            }
        }
        return reachable;
    }

    /**
     * A legacy reference names a declared exit, or spells out its classification
     * directly as {@code colour::name} or {@code category::detail}.
     */
    static boolean isKnownLegacyExit(TransitionGraph graph, String exitName) {
        if (exitName == null || exitName.isEmpty()) {
            return false;
        }
        for (ExitDefinition exit : graph.getExits()) {
            if (exit.getName().equals(exitName)) {
                return true;
            }
        }
        int separator = exitName.indexOf(StateStrings.SEPARATOR);
        return separator > 0
                && separator + StateStrings.SEPARATOR.length() < exitName.length()
                && LEGACY_EXIT_PREFIXES.contains(exitName.substring(0, separator));
    }
}
