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

import dev.mars.railway.core.Outcome;
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
import java.util.function.Predicate;

/**
 * Emits minimal placeholder classes for nodes that have no implementation yet. Which
 * nodes already exist is decided by the caller; the generator never looks at the
 * filesystem.
 *
 * <p>The start node stub takes no argument, regular node stubs succeed with
 * {@code done} and exit node stubs return the context unchanged.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class NodeStubGenerator {

    private static final String INDENT = TransitionCodeGenerator.INDENT;

    private final GeneratorOptions options;

    public NodeStubGenerator() {
        this(GeneratorOptions.defaults());
    }

    public NodeStubGenerator(GeneratorOptions options) {
        this.options = Objects.requireNonNull(options, "Generator options cannot be null");
    }

    /**
     * One stub per module holding at least one node without an implementation, in node
     * declaration order.
     */
    public List<StubSpec> generateStubs(TransitionGraph graph, Predicate<NodeDefinition> hasImplementation) {
        Objects.requireNonNull(graph, "Transition graph cannot be null");
        Objects.requireNonNull(hasImplementation, "Implementation predicate cannot be null");

        Map<String, List<NodeDefinition>> byModule = new LinkedHashMap<>();
        for (NodeDefinition node : graph.getNodes()) {
            if (!hasImplementation.test(node)) {
                byModule.computeIfAbsent(JavaIdentifiers.qualifiedName(node.getModule()), key -> new ArrayList<>())
                        .add(node);
            }
        }

        Set<String> targets = new HashSet<>();
        for (StateTransition transition : graph.getTransitions()) {
            if (!transition.isLegacyExit()) {
                targets.add(transition.getToTarget());
            }
        }

        List<StubSpec> stubs = new ArrayList<>();
        for (Map.Entry<String, List<NodeDefinition>> entry : byModule.entrySet()) {
            String module = entry.getKey();
            List<String> names = entry.getValue().stream().map(NodeDefinition::getName).toList();
            String source = generateStub(module, entry.getValue(), graph.getStartNode(), targets);
            stubs.add(new StubSpec(module, relativePath(module), source, names));
        }
        return stubs;
    }

    /**
     * {@code nodes.exit.success.done} becomes {@code nodes/exit/success/done.java}.
     */
    public static String relativePath(String module) {
        return JavaIdentifiers.qualifiedName(module).replace('.', '/') + ".java";
    }

    String generateStub(String module, List<NodeDefinition> nodes, String startNode, Set<String> targets) {
        int dot = module.lastIndexOf('.');
        String packageName = dot >= 0 ? module.substring(0, dot) : "";
        String className = dot >= 0 ? module.substring(dot + 1) : module;
        String context = options.getContextType();

        StringBuilder sb = new StringBuilder();
        if (!packageName.isEmpty()) {
            sb.append("package ").append(packageName).append(";\n\n");
        }
        sb.append("import dev.mars.railway.core.NodeResult;\n\n");
        sb.append("/**\n");
        sb.append(" * Placeholder for ");
        sb.append(JavaLiterals.comment(String.join(", ", nodes.stream().map(NodeDefinition::getName).toList())));
        sb.append(".\n */\n");
        sb.append("public final class ").append(className).append(" {\n\n");
        sb.append(INDENT).append("private ").append(className).append("() {\n");
        sb.append(INDENT).append("}\n");

        Set<String> emitted = new HashSet<>();
        for (NodeDefinition node : nodes) {
            String method = JavaIdentifiers.functionName(node.getFunction());
            sb.append('\n');
            if (!node.getDescription().isEmpty()) {
                sb.append(INDENT).append("// ").append(node.getName()).append(": ")
                        .append(JavaLiterals.comment(node.getDescription())).append('\n');
            }
            if (node.isExit()) {
                if (emitted.add(method + "/1")) {
                    sb.append(INDENT).append("public static Object ").append(method)
                            .append("(").append(context).append(" context) {\n");
                    sb.append(INDENT).append(INDENT).append("return context;\n");
                    sb.append(INDENT).append("}\n");
                }
                continue;
            }
            if (node.getName().equals(startNode) && emitted.add(method + "/0")) {
                sb.append(INDENT).append("public static NodeResult<").append(context).append("> ")
                        .append(method).append("() {\n");
                sb.append(INDENT).append(INDENT).append("return NodeResult.success(null, ")
                        .append(JavaLiterals.quote(Outcome.DEFAULT_SUCCESS_DETAIL)).append(");\n");
                sb.append(INDENT).append("}\n");
            }
            boolean regular = !node.getName().equals(startNode) || targets.contains(node.getName());
            if (regular && emitted.add(method + "/1")) {
                if (node.getName().equals(startNode)) {
                    sb.append('\n');
                }
                sb.append(INDENT).append("public static NodeResult<").append(context).append("> ")
                        .append(method).append("(").append(context).append(" context) {\n");
                sb.append(INDENT).append(INDENT).append("return NodeResult.success(context, ")
                        .append(JavaLiterals.quote(Outcome.DEFAULT_SUCCESS_DETAIL)).append(");\n");
                sb.append(INDENT).append("}\n");
            }
        }
        sb.append("}\n");
        return sb.toString();
    }
}
