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
import dev.mars.railway.workflow.model.ExitDefinition;
import dev.mars.railway.workflow.model.GraphOptions;
import dev.mars.railway.workflow.model.NodeDefinition;
import dev.mars.railway.workflow.model.ParseWarning;
import dev.mars.railway.workflow.model.StateTransition;
import dev.mars.railway.workflow.model.TransitionGraph;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * YAML-based implementation of TransitionGraphParser.
 * Parses graph descriptions using SnakeYAML.
 * <p>
 * Accepts flat node entries, nested node groups ({@code sub: {deep: {process: ...}}}
 * becomes {@code sub.deep.process}), the nested {@code nodes.exit} tree and the legacy
 * {@code exits} section. Transitions may be declared in the top-level block or inside a
 * node; on conflict the node-local entry wins and a {@code W002} parse warning is kept.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlTransitionGraphParser implements TransitionGraphParser {

    private static final Logger logger = Logger.getLogger(YamlTransitionGraphParser.class.getName());

    static final List<String> REQUIRED_FIELDS = List.of("version", "entrypoint", "nodes", "start", "transitions");

    public static final String TRANSITION_CONFLICT_CODE = "W002";

    private static final String EXIT_GROUP = "exit";
    private static final Set<String> NODE_KEYS = Set.of("module", "function", "description", "transitions", "exit", "exit_code");

    private final Yaml yaml;

    public YamlTransitionGraphParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
    }

    @Override
    public TransitionGraph parse(Path file) throws TransitionGraphParseException {
        if (!Files.exists(file)) {
            throw new TransitionGraphParseException("File not found: " + file);
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TransitionGraphParseException("Failed to read graph file: " + file, e);
        }
        try {
            return parseFromString(content);
        } catch (TransitionGraphParseException e) {
            throw e.withSource(file.toString());
        }
    }

    @Override
    public TransitionGraph parseFromString(String content) throws TransitionGraphParseException {
        Object data;
        try {
            data = yaml.load(content);
        } catch (MarkedYAMLException e) {
            int line = e.getProblemMark() != null ? e.getProblemMark().getLine() + 1 : -1;
            throw new TransitionGraphParseException(null, line, null, "YAML syntax error: " + e.getProblem(), e);
        } catch (YAMLException e) {
            throw new TransitionGraphParseException("YAML parsing failed: " + e.getMessage(), e);
        }

        if (!(data instanceof Map)) {
            throw new TransitionGraphParseException("Root of a graph description must be a mapping");
        }
        return buildGraph(asMap(data));
    }

    private TransitionGraph buildGraph(Map<String, Object> data) throws TransitionGraphParseException {
        for (String field : REQUIRED_FIELDS) {
            if (!data.containsKey(field)) {
                throw new TransitionGraphParseException(field, "Required field '" + field + "' is missing");
            }
        }
        String version = requireScalar(data, "version");
        String entrypoint = requireScalar(data, "entrypoint");
        String startNode = requireScalar(data, "start");

        List<NodeDefinition> nodes = new ArrayList<>();
        Map<String, List<StateTransition>> localTransitions = new LinkedHashMap<>();
        Map<String, Object> nodesData = getMapValue(data, "nodes");
        if (nodesData != null) {
            parseNodeTree(nodesData, "", nodes, localTransitions);
        }

        List<ExitDefinition> exits = new ArrayList<>();
        Map<String, Object> exitsData = getMapValue(data, "exits");
        if (exitsData != null) {
            for (Map.Entry<String, Object> entry : exitsData.entrySet()) {
                exits.add(parseExitDefinition(String.valueOf(entry.getKey()), entry.getValue()));
            }
        }

        List<StateTransition> topLevel = new ArrayList<>();
        Map<String, Object> transitionsData = getMapValue(data, "transitions");
        if (transitionsData != null) {
            for (Map.Entry<String, Object> entry : transitionsData.entrySet()) {
                String nodeName = String.valueOf(entry.getKey());
                topLevel.addAll(parseTransitionsForNode(nodeName, entry.getValue(), "transitions." + nodeName));
            }
        }

        List<ParseWarning> warnings = new ArrayList<>();
        List<StateTransition> transitions = mergeTransitions(topLevel, localTransitions, warnings);

        GraphOptions options = parseOptions(getMapValue(data, "options"));

        try {
            return new TransitionGraph(version, entrypoint, getStringValue(data, "description", ""),
                    nodes, exits, transitions, startNode, options, warnings);
        } catch (IllegalArgumentException e) {
            throw new TransitionGraphParseException("nodes", e.getMessage());
        }
    }

    private void parseNodeTree(Map<String, Object> tree, String prefix, List<NodeDefinition> nodes,
                               Map<String, List<StateTransition>> localTransitions) throws TransitionGraphParseException {
        for (Map.Entry<String, Object> entry : tree.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String name = prefix.isEmpty() ? key : prefix + "." + key;
            Object value = entry.getValue();

            if (prefix.isEmpty() && EXIT_GROUP.equals(key) && isExitGroup(value)) {
                parseExitTree(asMap(value), EXIT_GROUP, nodes, localTransitions);
            } else if (isGroup(value)) {
                parseNodeTree(asMap(value), name, nodes, localTransitions);
            } else if (value instanceof Map) {
                nodes.add(parseNodeDefinition(name, asMap(value), localTransitions));
            } else {
                throw new TransitionGraphParseException("nodes." + name,
                        "Node '" + name + "' must be a mapping with 'module' and 'function'");
            }
        }
    }

    private void parseExitTree(Map<String, Object> tree, String prefix, List<NodeDefinition> nodes,
                               Map<String, List<StateTransition>> localTransitions) throws TransitionGraphParseException {
        for (Map.Entry<String, Object> entry : tree.entrySet()) {
            String name = prefix + "." + entry.getKey();
            Object value = entry.getValue();

            if (isExitGroup(value)) {
                parseExitTree(asMap(value), name, nodes, localTransitions);
            } else if (value == null || value instanceof Map) {
                nodes.add(parseExitNode(name, value == null ? Map.of() : asMap(value), localTransitions));
            } else {
                throw new TransitionGraphParseException("nodes." + name,
                        "Exit node '" + name + "' must be a mapping");
            }
        }
    }

    private NodeDefinition parseExitNode(String name, Map<String, Object> data,
                                         Map<String, List<StateTransition>> localTransitions) throws TransitionGraphParseException {
        ExitClassification classification = ExitClassification.fromExitNodeName(name);
        int exitCode = parseExitCode(name, data, ExitClassification.defaultExitCode(classification.category()));
        String leaf = name.substring(name.lastIndexOf('.') + 1);
        collectLocalTransitions(name, data, localTransitions);
        return NodeDefinition.exitNode(name,
                getStringValue(data, "module", "nodes." + name),
                getStringValue(data, "function", leaf),
                getStringValue(data, "description", ""),
                exitCode);
    }

    private NodeDefinition parseNodeDefinition(String name, Map<String, Object> data,
                                               Map<String, List<StateTransition>> localTransitions) throws TransitionGraphParseException {
        String fieldPath = "nodes." + name;
        if (!data.containsKey("module")) {
            throw new TransitionGraphParseException(fieldPath, "Node '" + name + "' is missing 'module'");
        }
        if (!data.containsKey("function")) {
            throw new TransitionGraphParseException(fieldPath, "Node '" + name + "' is missing 'function'");
        }
        collectLocalTransitions(name, data, localTransitions);

        boolean exit = getBooleanValue(data, "exit", false) || ExitClassification.isExitNodeName(name);
        int exitCode = 0;
        if (exit) {
            String category = ExitClassification.fromExitNodeName(name).category();
            exitCode = parseExitCode(name, data, ExitClassification.defaultExitCode(category));
        }
        return new NodeDefinition(name,
                getStringValue(data, "module"),
                getStringValue(data, "function"),
                getStringValue(data, "description", ""),
                exit, exitCode);
    }

    private ExitDefinition parseExitDefinition(String name, Object value) throws TransitionGraphParseException {
        Map<String, Object> data = value instanceof Map ? asMap(value) : Map.of();
        Object code = data.get("code");
        int parsedCode = 0;
        if (code != null) {
            parsedCode = toInt(code, "exits." + name + ".code");
        }
        return new ExitDefinition(name, parsedCode, getStringValue(data, "description", ""));
    }

    private void collectLocalTransitions(String nodeName, Map<String, Object> data,
                                         Map<String, List<StateTransition>> localTransitions) {
        if (data.containsKey("transitions")) {
            List<StateTransition> parsed = parseTransitionsForNode(nodeName, data.get("transitions"),
                    "nodes." + nodeName + ".transitions");
            localTransitions.put(nodeName, parsed);
        }
    }

    private List<StateTransition> parseTransitionsForNode(String nodeName, Object value, String fieldPath) {
        if (!(value instanceof Map)) {
            if (value != null) {
                logger.warning("Ignoring malformed transitions at " + fieldPath + ": expected a mapping");
            }
            return List.of();
        }
        List<StateTransition> transitions = new ArrayList<>();
        for (Map.Entry<String, Object> entry : asMap(value).entrySet()) {
            if (entry.getValue() == null) {
                logger.warning("Ignoring transition without target at " + fieldPath + "." + entry.getKey());
                continue;
            }
            transitions.add(new StateTransition(nodeName, String.valueOf(entry.getKey()), String.valueOf(entry.getValue())));
        }
        return transitions;
    }

    private List<StateTransition> mergeTransitions(List<StateTransition> topLevel,
                                                   Map<String, List<StateTransition>> localTransitions,
                                                   List<ParseWarning> warnings) {
        List<StateTransition> merged = new ArrayList<>();
        for (StateTransition transition : topLevel) {
            Optional<StateTransition> local = localTransitions.getOrDefault(transition.getFromNode(), List.of()).stream()
                    .filter(candidate -> candidate.getFromState().equals(transition.getFromState()))
                    .findFirst();
            if (local.isEmpty()) {
                merged.add(transition);
                continue;
            }
            if (!local.get().getToTarget().equals(transition.getToTarget())) {
                String message = "Node-local transition '" + transition.getFromState() + "' -> '"
                        + local.get().getToTarget() + "' overrides top-level target '" + transition.getToTarget() + "'";
                warnings.add(new ParseWarning(TRANSITION_CONFLICT_CODE, "transitions." + transition.getFromNode(), message));
                logger.warning(transition.getFromNode() + ": " + message);
            }
        }
        for (List<StateTransition> local : localTransitions.values()) {
            merged.addAll(local);
        }
        return merged;
    }

    private GraphOptions parseOptions(Map<String, Object> data) throws TransitionGraphParseException {
        if (data == null) {
            return GraphOptions.defaults();
        }
        int maxIterations = GraphOptions.DEFAULT_MAX_ITERATIONS;
        if (data.get("max_iterations") != null) {
            maxIterations = toInt(data.get("max_iterations"), "options.max_iterations");
            if (maxIterations <= 0) {
                throw new TransitionGraphParseException("options.max_iterations",
                        "max_iterations must be a positive integer but was " + maxIterations);
            }
        }
        return new GraphOptions(maxIterations,
                getBooleanValue(data, "enable_loop_detection", true),
                getBooleanValue(data, "strict_state_check", true));
    }

    private int parseExitCode(String name, Map<String, Object> data, int defaultValue) throws TransitionGraphParseException {
        Object value = data.get("exit_code");
        return value != null ? toInt(value, "nodes." + name + ".exit_code") : defaultValue;
    }

    private static boolean isGroup(Object value) {
        if (!(value instanceof Map)) {
            return false;
        }
        Map<?, ?> map = (Map<?, ?>) value;
        if (map.isEmpty()) {
            return false;
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (NODE_KEYS.contains(String.valueOf(entry.getKey())) || !(entry.getValue() instanceof Map)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Exit tree levels may hold empty leaves ({@code done:}), so null children count as leaves.
     */
    private static boolean isExitGroup(Object value) {
        if (!(value instanceof Map)) {
            return false;
        }
        Map<?, ?> map = (Map<?, ?>) value;
        if (map.isEmpty()) {
            return false;
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            Object child = entry.getValue();
            if (NODE_KEYS.contains(String.valueOf(entry.getKey())) || (child != null && !(child instanceof Map))) {
                return false;
            }
        }
        return true;
    }

    private static String requireScalar(Map<String, Object> data, String key) throws TransitionGraphParseException {
        Object value = data.get(key);
        if (value == null || value instanceof Map || value instanceof List) {
            throw new TransitionGraphParseException(key, "Field '" + key + "' must be a non-empty value");
        }
        String text = value.toString();
        if (text.isBlank()) {
            throw new TransitionGraphParseException(key, "Field '" + key + "' must be a non-empty value");
        }
        return text;
    }

    private static int toInt(Object value, String fieldPath) throws TransitionGraphParseException {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new TransitionGraphParseException(null, -1, fieldPath, "Expected an integer but found '" + value + "'", e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private static String getStringValue(Map<String, Object> data, String key) {
        return getStringValue(data, key, null);
    }

    private static String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static Map<String, Object> getMapValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof Map ? asMap(value) : null;
    }

    private static boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }
}
