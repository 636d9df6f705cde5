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

package dev.mars.railway.workflow.codegen;

import dev.mars.railway.core.ExitClassification;
import dev.mars.railway.core.StateFormatException;
import dev.mars.railway.core.StateStrings;
import dev.mars.railway.workflow.model.ExitDefinition;
import dev.mars.railway.workflow.model.GraphOptions;
import dev.mars.railway.workflow.model.NodeDefinition;
import dev.mars.railway.workflow.model.StateTransition;
import dev.mars.railway.workflow.model.TransitionGraph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Turns a validated {@link TransitionGraph} into one Java compilation unit holding the
 * state enumeration, exit codes, node references, transition table and graph metadata.
 *
 * <p>Output depends only on the graph, the source reference and the options, so the same
 * input always yields the same text. Nothing is written to disk.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class TransitionCodeGenerator {

    private static final Logger logger = Logger.getLogger(TransitionCodeGenerator.class.getName());

    public static final String HEADER_LINE = "// DO NOT EDIT - Generated by the railway transition compiler";

    static final String INDENT = "    ";

    private static final Set<String> CLASS_MEMBERS = Set.of(
            "START_NODE", "MAX_ITERATIONS", "NODE_REFERENCES", "TRANSITION_TABLE", "GRAPH_METADATA");

    private static final List<String> IMPORTS = List.of(
            "dev.mars.railway.core.AsyncDagRunner",
            "dev.mars.railway.core.AsyncStartNode",
            "dev.mars.railway.core.DagRunner",
            "dev.mars.railway.core.DagRunnerResult",
            "dev.mars.railway.core.NodeOutcome",
            "dev.mars.railway.core.StartNode",
            "dev.mars.railway.core.TransitionTable",
            "dev.mars.railway.core.TransitionTarget");

    private static final List<String> JDK_IMPORTS = List.of(
            "java.util.Map",
            "java.util.Optional",
            "java.util.concurrent.CompletableFuture");

    private final GeneratorOptions options;

    public TransitionCodeGenerator() {
        this(GeneratorOptions.defaults());
    }

    public TransitionCodeGenerator(GeneratorOptions options) {
        this.options = Objects.requireNonNull(options, "Generator options cannot be null");
    }

    public GeneratorOptions getOptions() {
        return options;
    }

    /**
     * Generates the complete source file.
     *
     * @param graph           a graph without validation errors
     * @param sourceReference where the graph came from, recorded in the header and metadata
     * @return Java source text
     * @throws CodeGenerationException if a target or the start node cannot be resolved
     */
    public String generate(TransitionGraph graph, String sourceReference) {
        Objects.requireNonNull(graph, "Transition graph cannot be null");
        Objects.requireNonNull(sourceReference, "Source reference cannot be null");

        String baseName = JavaIdentifiers.toClassName(graph.getEntrypoint());
        String className = getClassName(graph);
        String context = options.getContextType();

        StringBuilder sb = new StringBuilder();
        sb.append(generateHeader(sourceReference)).append('\n');
        if (!options.getPackageName().isEmpty()) {
            sb.append("package ").append(options.getPackageName()).append(";\n\n");
        }
        sb.append(generateImports()).append('\n');

        sb.append("/**\n");
        sb.append(" * Transitions for entrypoint ").append(JavaLiterals.comment(graph.getEntrypoint())).append(".\n");
        if (!graph.getDescription().isEmpty()) {
            sb.append(" * <p>").append(JavaLiterals.comment(graph.getDescription())).append('\n');
        }
        sb.append(" */\n");
        sb.append("public final class ").append(className).append(" {\n\n");

        sb.append(INDENT).append("public static final String START_NODE = ")
                .append(JavaLiterals.quote(graph.getStartNode())).append(";\n");
        sb.append(INDENT).append("public static final int MAX_ITERATIONS = ")
                .append(graph.getOptions().getMaxIterations()).append(";\n\n");

        sb.append(generateStateEnum(graph)).append('\n');
        sb.append(generateExitConstants(graph)).append('\n');
        sb.append(generateNodeReferences(graph)).append('\n');
        sb.append(generateTransitionTable(graph)).append('\n');
        sb.append(generateMetadata(graph, sourceReference)).append('\n');

        sb.append(INDENT).append("private ").append(className).append("() {\n");
        sb.append(INDENT).append("}\n\n");

        NodeDefinition start = graph.getNode(graph.getStartNode())
                .orElseThrow(() -> new CodeGenerationException(
                        "Start node '" + graph.getStartNode() + "' is not defined"));
        sb.append(INDENT).append("public static StartNode<").append(context).append("> startNode() {\n");
        sb.append(INDENT).append(INDENT).append("return ").append(nodeReference(start)).append(";\n");
        sb.append(INDENT).append("}\n\n");

        sb.append(INDENT).append("public static Optional<TransitionTarget<").append(context)
                .append(">> nextStep(String state) {\n");
        sb.append(INDENT).append(INDENT).append("return TRANSITION_TABLE.lookup(state);\n");
        sb.append(INDENT).append("}\n\n");

        sb.append(INDENT).append("public static Optional<TransitionTarget<").append(context)
                .append(">> nextStep(").append(baseName).append("State state) {\n");
        sb.append(INDENT).append(INDENT).append("return nextStep(state.value());\n");
        sb.append(INDENT).append("}\n\n");

        sb.append(INDENT).append("public static DagRunnerResult run(DagRunner runner) {\n");
        sb.append(INDENT).append(INDENT).append("return runner.run(START_NODE, startNode(), TRANSITION_TABLE);\n");
        sb.append(INDENT).append("}\n\n");

        sb.append(INDENT).append("public static CompletableFuture<DagRunnerResult> runAsync(AsyncDagRunner runner) {\n");
        sb.append(INDENT).append(INDENT)
                .append("return runner.run(START_NODE, AsyncStartNode.of(startNode()), TRANSITION_TABLE);\n");
        sb.append(INDENT).append("}\n");
        sb.append("}\n");

        logger.fine("Generated " + className + " from " + sourceReference
                + " (" + graph.getTransitions().size() + " transitions)");
        return sb.toString();
    }

    public String getClassName(TransitionGraph graph) {
        return JavaIdentifiers.toClassName(graph.getEntrypoint()) + options.getClassSuffix();
    }

    public String generateHeader(String sourceReference) {
        return HEADER_LINE + "\n"
                + "// Source: " + JavaLiterals.comment(sourceReference) + "\n";
    }

    public String generateImports() {
        StringBuilder sb = new StringBuilder();
        for (String name : IMPORTS) {
            sb.append("import ").append(name).append(";\n");
        }
        sb.append('\n');
        for (String name : JDK_IMPORTS) {
            sb.append("import ").append(name).append(";\n");
        }
        return sb.toString();
    }

    /**
     * One constant per distinct state string, in declaration order.
     */
    public String generateStateEnum(TransitionGraph graph) {
        String enumName = JavaIdentifiers.toClassName(graph.getEntrypoint()) + "State";
        Map<String, StateTransition> states = new LinkedHashMap<>();
        for (StateTransition transition : graph.getTransitions()) {
            states.putIfAbsent(transition.getStateString(), transition);
        }

        Set<String> used = new HashSet<>();
        List<String> constants = new ArrayList<>();
        for (Map.Entry<String, StateTransition> state : states.entrySet()) {
            String candidate = JavaIdentifiers.toConstantName(
                    state.getValue().getFromNode(), state.getValue().getFromState());
            String constant = JavaIdentifiers.unique(candidate, used);
            constants.add(constant + "(" + JavaLiterals.quote(state.getKey()) + ")");
        }

        String inner = INDENT + INDENT;
        StringBuilder sb = new StringBuilder();
        sb.append(INDENT).append("/**\n");
        sb.append(INDENT).append(" * Every state the nodes of this graph can produce.\n");
        sb.append(INDENT).append(" */\n");
        sb.append(INDENT).append("public enum ").append(enumName).append(" implements NodeOutcome {\n");
        if (constants.isEmpty()) {
            sb.append(inner).append(";\n");
        } else {
            sb.append(inner).append(String.join(",\n" + inner, constants)).append(";\n");
        }
        sb.append('\n');
        sb.append(inner).append("private final String value;\n\n");
        sb.append(inner).append(enumName).append("(String value) {\n");
        sb.append(inner).append(INDENT).append("this.value = value;\n");
        sb.append(inner).append("}\n\n");
        sb.append(inner).append("@Override\n");
        sb.append(inner).append("public String value() {\n");
        sb.append(inner).append(INDENT).append("return value;\n");
        sb.append(inner).append("}\n");
        sb.append(INDENT).append("}\n");
        return sb.toString();
    }

    /**
     * Legacy exits become marker strings, exit nodes their numeric code.
     */
    public String generateExitConstants(TransitionGraph graph) {
        Set<String> used = new HashSet<>(CLASS_MEMBERS);
        StringBuilder sb = new StringBuilder();
        sb.append(INDENT).append("// ").append(JavaIdentifiers.toClassName(graph.getEntrypoint()))
                .append(" exit codes\n");
        for (ExitDefinition exit : graph.getExits()) {
            String constant = JavaIdentifiers.unique(JavaIdentifiers.toConstantName(exit.getName()), used);
            sb.append(INDENT).append("public static final String ").append(constant).append(" = ")
                    .append(JavaLiterals.quote(exit.toMarker())).append(";\n");
        }
        for (NodeDefinition exitNode : graph.getExitNodes()) {
            String constant = JavaIdentifiers.unique(JavaIdentifiers.toConstantName(exitNode.getName()), used);
            sb.append(INDENT).append("public static final int ").append(constant).append(" = ")
                    .append(exitNode.getExitCode()).append(";\n");
        }
        return sb.toString();
    }

    public String generateNodeReferences(TransitionGraph graph) {
        List<String> entries = new ArrayList<>();
        for (NodeDefinition node : graph.getNodes()) {
            entries.add("Map.entry(" + JavaLiterals.quote(node.getName()) + ", "
                    + JavaLiterals.quote(nodeReference(node)) + ")");
        }
        StringBuilder sb = new StringBuilder();
        sb.append(INDENT).append("/**\n");
        sb.append(INDENT).append(" * Implementation of every node, keyed by node name.\n");
        sb.append(INDENT).append(" */\n");
        sb.append(INDENT).append("public static final Map<String, String> NODE_REFERENCES = ");
        appendEntries(sb, "Map.ofEntries(", entries);
        return sb.toString();
    }

    /**
     * @throws CodeGenerationException for malformed or duplicate states and unresolved targets
     */
    public String generateTransitionTable(TransitionGraph graph) {
        String context = options.getContextType();
        String rowIndent = INDENT + INDENT + INDENT + INDENT;
        Set<String> seen = new HashSet<>();

        StringBuilder sb = new StringBuilder();
        sb.append(INDENT).append("public static final TransitionTable<").append(context)
                .append("> TRANSITION_TABLE = buildTransitionTable();\n\n");
        sb.append(INDENT).append("private static TransitionTable<").append(context)
                .append("> buildTransitionTable() {\n");
        sb.append(INDENT).append(INDENT).append("return TransitionTable.<").append(context).append(">builder()\n");

        for (StateTransition transition : graph.getTransitions()) {
            String state = transition.getStateString();
            checkState(state);
            if (!seen.add(state)) {
                throw new CodeGenerationException("Duplicate transition for state '" + state + "'");
            }
            sb.append(rowIndent).append(transitionRow(graph, transition)).append('\n');
        }

        sb.append(rowIndent).append(".build();\n");
        sb.append(INDENT).append("}\n");
        return sb.toString();
    }

    public String generateMetadata(TransitionGraph graph, String sourceReference) {
        GraphOptions graphOptions = graph.getOptions();
        List<String> entries = List.of(
                entry("version", JavaLiterals.quote(graph.getVersion())),
                entry("entrypoint", JavaLiterals.quote(graph.getEntrypoint())),
                entry("description", JavaLiterals.quote(graph.getDescription())),
                entry("start_node", JavaLiterals.quote(graph.getStartNode())),
                entry("max_iterations", String.valueOf(graphOptions.getMaxIterations())),
                entry("enable_loop_detection", String.valueOf(graphOptions.isEnableLoopDetection())),
                entry("strict_state_check", String.valueOf(graphOptions.isStrictStateCheck())),
                entry("source_file", JavaLiterals.quote(sourceReference)));

        StringBuilder sb = new StringBuilder();
        sb.append(INDENT).append("public static final Map<String, Object> GRAPH_METADATA = ");
        appendEntries(sb, "Map.<String, Object>ofEntries(", entries);
        return sb.toString();
    }

    /**
     * {@code module::function} with every segment sanitized; the function is reduced to
     * its last dotted segment.
     */
    public static String nodeReference(NodeDefinition node) {
        return JavaIdentifiers.qualifiedName(node.getModule()) + "::" + JavaIdentifiers.functionName(node.getFunction());
    }

    /**
     * Runtime marker for a legacy {@code exit::} target: a declared exit, or a spelled
     * out {@code colour::name} or {@code category::detail} pair.
     */
    static String legacyMarker(TransitionGraph graph, String exitName) {
        if (exitName != null) {
            for (ExitDefinition exit : graph.getExits()) {
                if (exit.getName().equals(exitName)) {
                    return exit.toMarker();
                }
            }
            int separator = exitName.indexOf(StateStrings.SEPARATOR);
            if (separator > 0) {
                String prefix = exitName.substring(0, separator);
                String rest = exitName.substring(separator + StateStrings.SEPARATOR.length())
                        .replace(StateStrings.SEPARATOR, ".");
                if (!rest.isEmpty()) {
                    if (isColour(prefix)) {
                        return StateStrings.makeExit(prefix, rest);
                    }
                    if (isCategory(prefix)) {
                        return StateStrings.makeExit(ExitClassification.of(prefix, rest).colour(), rest);
                    }
                }
            }
        }
        throw new CodeGenerationException("Exit '" + exitName + "' is not defined");
    }

    private String transitionRow(TransitionGraph graph, StateTransition transition) {
        String state = JavaLiterals.quote(transition.getStateString());
        if (transition.isLegacyExit()) {
            return ".terminate(" + state + ", "
                    + JavaLiterals.quote(legacyMarker(graph, transition.getExitName())) + ")";
        }
        NodeDefinition target = graph.getNode(transition.getToTarget())
                .orElseThrow(() -> new CodeGenerationException("Target node '" + transition.getToTarget()
                        + "' of state '" + transition.getStateString() + "' is not defined"));
        String name = JavaLiterals.quote(target.getName());
        if (target.isExit()) {
            return ".exit(" + state + ", " + name + ", " + target.getExitCode() + ", " + nodeReference(target) + ")";
        }
        return ".next(" + state + ", " + name + ", " + nodeReference(target) + ")";
    }

    private static void checkState(String state) {
        try {
            StateStrings.parseState(state);
        } catch (StateFormatException e) {
            throw new CodeGenerationException("Invalid state '" + state + "': " + e.getMessage(), e);
        }
    }

    private static boolean isColour(String value) {
        return ExitClassification.GREEN.equals(value)
                || ExitClassification.RED.equals(value)
                || ExitClassification.YELLOW.equals(value);
    }

    private static boolean isCategory(String value) {
        return ExitClassification.SUCCESS.equals(value)
                || ExitClassification.FAILURE.equals(value)
                || ExitClassification.WARNING.equals(value);
    }

    private static String entry(String key, String valueSource) {
        return "Map.entry(" + JavaLiterals.quote(key) + ", " + valueSource + ")";
    }

    private static void appendEntries(StringBuilder sb, String opening, List<String> entries) {
        sb.append(opening);
        if (entries.isEmpty()) {
            sb.append(");\n");
            return;
        }
        String entryIndent = INDENT + INDENT + INDENT;
        sb.append('\n');
        sb.append(entryIndent).append(String.join(",\n" + entryIndent, entries)).append(");\n");
    }
}
