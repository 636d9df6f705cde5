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

package dev.mars.railway.workflow;

import dev.mars.railway.core.ExitClassification;
import dev.mars.railway.core.StateStrings;
import dev.mars.railway.workflow.model.ExitDefinition;
import dev.mars.railway.workflow.model.NodeDefinition;
import dev.mars.railway.workflow.model.StateTransition;
import dev.mars.railway.workflow.model.TransitionGraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Converts between the legacy {@code exits} section with {@code exit::name} targets and
 * exit nodes named {@code exit.<category>.<detail>}.
 *
 * <p>Legacy names carry their colour as a prefix: {@code green_resolved} becomes
 * {@code exit.success.resolved}, {@code red_timeout} becomes {@code exit.failure.timeout}
 * and {@code yellow_partial} becomes {@code exit.warning.partial}. Without a prefix the
 * code decides. {@code green_success} becomes {@code exit.success.done}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class ExitFormatConverter {

    private static final Logger logger = Logger.getLogger(ExitFormatConverter.class.getName());

    private static final Set<String> STANDARD_CATEGORIES =
            Set.of(ExitClassification.SUCCESS, ExitClassification.FAILURE, ExitClassification.WARNING);

    /**
     * Replaces legacy exits with exit nodes, appended after the existing nodes, and
     * rewrites {@code exit::} targets to the node names.
     */
    public TransitionGraph toCurrentFormat(TransitionGraph graph) {
        Objects.requireNonNull(graph, "Transition graph cannot be null");

        Map<String, String> nameToPath = new LinkedHashMap<>();
        List<NodeDefinition> nodes = new ArrayList<>(graph.getNodes());
        for (ExitDefinition exit : graph.getExits()) {
            String path = toExitNodeName(exit);
            nameToPath.put(exit.getName(), path);
            addExitNode(nodes, path, exit.getCode(), exit.getDescription());
        }

        List<StateTransition> transitions = new ArrayList<>();
        for (StateTransition transition : graph.getTransitions()) {
            if (!transition.isLegacyExit()) {
                transitions.add(transition);
                continue;
            }
            String exitName = transition.getExitName();
            String path = nameToPath.get(exitName);
            if (path == null) {
                path = nestedTargetToExitNodeName(exitName);
                ExitClassification classification = ExitClassification.fromExitNodeName(path);
                addExitNode(nodes, path, classification.exitCode(), "");
            }
            transitions.add(transition.withTarget(path));
        }

        logger.fine("Converted " + graph.getExits().size() + " legacy exit(s) of '"
                + graph.getEntrypoint() + "' to exit nodes");
        return graph.toBuilder()
                .nodes(nodes)
                .exits(List.of())
                .transitions(transitions)
                .build();
    }

    /**
     * Turns exit nodes in the three standard categories that use the default
     * implementation reference back into legacy exits. Other exit nodes are kept.
     */
    public TransitionGraph toLegacyFormat(TransitionGraph graph) {
        Objects.requireNonNull(graph, "Transition graph cannot be null");

        Map<String, String> pathToName = new LinkedHashMap<>();
        List<NodeDefinition> nodes = new ArrayList<>();
        List<ExitDefinition> exits = new ArrayList<>(graph.getExits());
        for (NodeDefinition node : graph.getNodes()) {
            if (!isConvertibleExitNode(node)) {
                nodes.add(node);
                continue;
            }
            String legacyName = toLegacyName(node.getName());
            pathToName.put(node.getName(), legacyName);
            exits.add(new ExitDefinition(legacyName, node.getExitCode(), node.getDescription()));
        }

        List<StateTransition> transitions = new ArrayList<>();
        for (StateTransition transition : graph.getTransitions()) {
            String legacyName = pathToName.get(transition.getToTarget());
            transitions.add(legacyName != null
                    ? transition.withTarget(StateStrings.EXIT_MARKER_PREFIX + legacyName)
                    : transition);
        }

        return graph.toBuilder()
                .nodes(nodes)
                .exits(exits)
                .transitions(transitions)
                .build();
    }

    /**
     * {@code green_success} is {@code exit.success.done}; otherwise the colour prefix is
     * dropped and the rest becomes the detail.
     */
    public static String toExitNodeName(ExitDefinition exit) {
        String category = ExitClassification.categoryForColour(exit.getColour());
        String detail = exit.getDetail();
        if (ExitClassification.SUCCESS.equals(category) && detail.equals(category)) {
            detail = "done";
        }
        return ExitClassification.EXIT_NODE_PREFIX + category + "." + detail;
    }

    /**
     * {@code exit.success.done} is {@code green_success}; {@code exit.failure.ssh.timeout}
     * is {@code red_ssh.timeout}.
     */
    public static String toLegacyName(String exitNodeName) {
        ExitClassification classification = ExitClassification.fromExitNodeName(exitNodeName);
        String detail = classification.detail();
        if (ExitClassification.SUCCESS.equals(classification.category()) && "done".equals(detail)) {
            detail = ExitClassification.SUCCESS;
        }
        return classification.colour() + "_" + detail;
    }

    /**
     * {@code success::done} or {@code green::done} spelled inline after {@code exit::}.
     */
    static String nestedTargetToExitNodeName(String exitName) {
        String[] parts = exitName.split(StateStrings.SEPARATOR, 2);
        String category = parts[0];
        if (!STANDARD_CATEGORIES.contains(category)) {
            category = ExitClassification.categoryForColour(category);
        }
        String detail = parts.length > 1 && !parts[1].isEmpty()
                ? parts[1].replace(StateStrings.SEPARATOR, ".")
                : "done";
        return ExitClassification.EXIT_NODE_PREFIX + category + "." + detail;
    }

    private static boolean isConvertibleExitNode(NodeDefinition node) {
        if (!node.isExit() || !node.getName().startsWith(ExitClassification.EXIT_NODE_PREFIX)) {
            return false;
        }
        ExitClassification classification = ExitClassification.fromExitNodeName(node.getName());
        return STANDARD_CATEGORIES.contains(classification.category())
                && !classification.detail().isEmpty()
                && node.getModule().equals("nodes." + node.getName())
                && node.getFunction().equals(node.getLeafName());
    }

    private static void addExitNode(List<NodeDefinition> nodes, String path, int code, String description) {
        boolean present = nodes.stream().anyMatch(node -> node.getName().equals(path));
        if (!present) {
            String leaf = path.substring(path.lastIndexOf('.') + 1);
            nodes.add(NodeDefinition.exitNode(path, "nodes." + path, leaf, description, code));
        }
    }
}
