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

import dev.mars.railway.workflow.codegen.CodeGenerationException;
import dev.mars.railway.workflow.codegen.StubSpec;
import dev.mars.railway.workflow.model.TransitionGraph;
import dev.mars.railway.workflow.validation.ValidationResult;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Everything one compile run produced. The generated source is absent when validation
 * reported errors.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class CompilationResult {

    private final TransitionGraph graph;
    private final ValidationResult validation;
    private final String relativePath;
    private final String source;
    private final List<StubSpec> stubs;

    CompilationResult(TransitionGraph graph, ValidationResult validation, String relativePath,
                      String source, List<StubSpec> stubs) {
        this.graph = Objects.requireNonNull(graph, "Transition graph cannot be null");
        this.validation = Objects.requireNonNull(validation, "Validation result cannot be null");
        this.relativePath = relativePath;
        this.source = source;
        this.stubs = List.copyOf(stubs);
    }

    public TransitionGraph getGraph() {
        return graph;
    }

    public ValidationResult getValidation() {
        return validation;
    }

    public boolean isSuccessful() {
        return source != null;
    }

    /**
     * Source path of the generated class relative to a source root, e.g.
     * {@code transitions/MyWorkflowTransitions.java}.
     */
    public Optional<String> getRelativePath() {
        return Optional.ofNullable(relativePath);
    }

    public Optional<String> getSource() {
        return Optional.ofNullable(source);
    }

    /**
     * @throws CodeGenerationException listing the validation errors when nothing was generated
     */
    public String getSourceOrThrow() {
        if (source == null) {
            String errors = validation.getErrors().stream()
                    .map(Object::toString)
                    .collect(Collectors.joining("; "));
            throw new CodeGenerationException("Graph '" + graph.getEntrypoint()
                    + "' has validation errors: " + errors);
        }
        return source;
    }

    public List<StubSpec> getStubs() {
        return stubs;
    }

    @Override
    public String toString() {
        return "CompilationResult{" +
               "entrypoint='" + graph.getEntrypoint() + '\'' +
               ", successful=" + isSuccessful() +
               ", validation=" + validation +
               ", stubs=" + stubs.size() +
               '}';
    }
}
