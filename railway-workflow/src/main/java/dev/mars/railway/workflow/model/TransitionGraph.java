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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable in-memory form of a graph description.
 * <p>
 * Node names are unique. Transitions may reference undeclared nodes so partially
 * written graphs can still be loaded; the validator reports them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class TransitionGraph {

    private final String version;
    private final String entrypoint;
    private final String description;
    private final List<NodeDefinition> nodes;
    private final List<ExitDefinition> exits;
    private final List<StateTransition> transitions;
    private final String startNode;
    private final GraphOptions options;
    private final List<ParseWarning> parseWarnings;

    public TransitionGraph(String version, String entrypoint, String description,
                           List<NodeDefinition> nodes, List<ExitDefinition> exits,
                           List<StateTransition> transitions, String startNode,
                           GraphOptions options, List<ParseWarning> parseWarnings) {
        this.version = Objects.requireNonNull(version, "Version cannot be null");
        this.entrypoint = Objects.requireNonNull(entrypoint, "Entrypoint cannot be null");
        this.description = description != null ? description : "";
        this.nodes = List.copyOf(nodes != null ? nodes : List.of());
        this.exits = List.copyOf(exits != null ? exits : List.of());
        this.transitions = List.copyOf(transitions != null ? transitions : List.of());
        this.startNode = Objects.requireNonNull(startNode, "Start node cannot be null");
        this.options = options != null ? options : GraphOptions.defaults();
        this.parseWarnings = List.copyOf(parseWarnings != null ? parseWarnings : List.of());

        List<String> seen = new ArrayList<>();
        for (NodeDefinition node : this.nodes) {
            if (seen.contains(node.getName())) {
                throw new IllegalArgumentException("Duplicate node name: " + node.getName());
            }
            seen.add(node.getName());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getVersion() {
        return version;
    }

    public String getEntrypoint() {
        return entrypoint;
    }

    public String getDescription() {
        return description;
    }

    public List<NodeDefinition> getNodes() {
        return nodes;
    }

    public List<ExitDefinition> getExits() {
        return exits;
    }

    public List<StateTransition> getTransitions() {
        return transitions;
    }

    public String getStartNode() {
        return startNode;
    }

    public GraphOptions getOptions() {
        return options;
    }

    public List<ParseWarning> getParseWarnings() {
        return parseWarnings;
    }

    public Optional<NodeDefinition> getNode(String name) {
        return nodes.stream().filter(node -> node.getName().equals(name)).findFirst();
    }

    public boolean hasNode(String name) {
        return getNode(name).isPresent();
    }

    public Optional<ExitDefinition> getExit(String name) {
        return exits.stream().filter(exit -> exit.getName().equals(name)).findFirst();
    }

    public List<StateTransition> getTransitionsForNode(String nodeName) {
        return transitions.stream()
                .filter(transition -> transition.getFromNode().equals(nodeName))
                .toList();
    }

    /**
     * The {@code outcome::detail} states declared for a node, duplicates included.
     */
    public List<String> getStatesForNode(String nodeName) {
        return getTransitionsForNode(nodeName).stream()
                .map(StateTransition::getFromState)
                .toList();
    }

    public List<NodeDefinition> getExitNodes() {
        return nodes.stream().filter(NodeDefinition::isExit).toList();
    }

    public List<NodeDefinition> getRegularNodes() {
        return nodes.stream().filter(node -> !node.isExit()).toList();
    }

    /**
     * True when the target ends a run: a legacy {@code exit::} reference or a declared
     * exit node.
     */
    public boolean isExitTarget(String target) {
        if (StateStrings.isExitMarker(target)) {
            return true;
        }
        return getNode(target).map(NodeDefinition::isExit).orElse(false);
    }

    public Builder toBuilder() {
        return builder()
                .version(version)
                .entrypoint(entrypoint)
                .description(description)
                .nodes(nodes)
                .exits(exits)
                .transitions(transitions)
                .startNode(startNode)
                .options(options)
                .parseWarnings(parseWarnings);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransitionGraph that = (TransitionGraph) o;
        return Objects.equals(version, that.version) &&
               Objects.equals(entrypoint, that.entrypoint) &&
               Objects.equals(description, that.description) &&
               Objects.equals(nodes, that.nodes) &&
               Objects.equals(exits, that.exits) &&
               Objects.equals(transitions, that.transitions) &&
               Objects.equals(startNode, that.startNode) &&
               Objects.equals(options, that.options) &&
               Objects.equals(parseWarnings, that.parseWarnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, entrypoint, description, nodes, exits, transitions,
                startNode, options, parseWarnings);
    }

    @Override
    public String toString() {
        return "TransitionGraph{" +
               "entrypoint='" + entrypoint + '\'' +
               ", version='" + version + '\'' +
               ", nodes=" + nodes.size() +
               ", exits=" + exits.size() +
               ", transitions=" + transitions.size() +
               ", startNode='" + startNode + '\'' +
               '}';
    }

    public static final class Builder {
        private String version = "1.0";
        private String entrypoint;
        private String description = "";
        private final List<NodeDefinition> nodes = new ArrayList<>();
        private final List<ExitDefinition> exits = new ArrayList<>();
        private final List<StateTransition> transitions = new ArrayList<>();
        private String startNode;
        private GraphOptions options = GraphOptions.defaults();
        private final List<ParseWarning> parseWarnings = new ArrayList<>();

        private Builder() {
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder entrypoint(String entrypoint) {
            this.entrypoint = entrypoint;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder node(NodeDefinition node) {
            this.nodes.add(node);
            return this;
        }

        public Builder node(String name, String module, String function) {
            return node(new NodeDefinition(name, module, function, ""));
        }

        public Builder exitNode(String name, int exitCode) {
            String leaf = name.substring(name.lastIndexOf('.') + 1);
            return node(NodeDefinition.exitNode(name, "nodes." + name, leaf, "", exitCode));
        }

        public Builder nodes(List<NodeDefinition> nodes) {
            this.nodes.clear();
            this.nodes.addAll(nodes);
            return this;
        }

        public Builder exit(ExitDefinition exit) {
            this.exits.add(exit);
            return this;
        }

        public Builder exits(List<ExitDefinition> exits) {
            this.exits.clear();
            this.exits.addAll(exits);
            return this;
        }

        public Builder transition(String fromNode, String fromState, String toTarget) {
            this.transitions.add(new StateTransition(fromNode, fromState, toTarget));
            return this;
        }

        public Builder transitions(List<StateTransition> transitions) {
            this.transitions.clear();
            this.transitions.addAll(transitions);
            return this;
        }

        public Builder startNode(String startNode) {
            this.startNode = startNode;
            return this;
        }

        public Builder options(GraphOptions options) {
            this.options = options;
            return this;
        }

        public Builder parseWarnings(List<ParseWarning> parseWarnings) {
            this.parseWarnings.clear();
            this.parseWarnings.addAll(parseWarnings);
            return this;
        }

        public TransitionGraph build() {
            return new TransitionGraph(version, entrypoint, description, nodes, exits,
                    transitions, startNode, options, parseWarnings);
        }
    }
}
