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

import dev.mars.railway.workflow.codegen.GeneratedSourceVerifier;
import dev.mars.railway.workflow.codegen.GeneratorOptions;
import dev.mars.railway.workflow.codegen.NodeStubGenerator;
import dev.mars.railway.workflow.codegen.StubSpec;
import dev.mars.railway.workflow.codegen.TransitionCodeGenerator;
import dev.mars.railway.workflow.model.NodeDefinition;
import dev.mars.railway.workflow.model.TransitionGraph;
import dev.mars.railway.workflow.validation.GraphValidator;
import dev.mars.railway.workflow.validation.ValidationResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Parse, validate, generate and verify in one call. Writing the results out is left
 * to the caller.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class TransitionGraphCompiler {

    private static final Logger logger = Logger.getLogger(TransitionGraphCompiler.class.getName());

    private final TransitionGraphParser parser;
    private final GraphValidator validator;
    private final TransitionCodeGenerator generator;
    private final NodeStubGenerator stubGenerator;
    private final GeneratedSourceVerifier verifier;

    public TransitionGraphCompiler() {
        this(GeneratorOptions.defaults());
    }

    public TransitionGraphCompiler(GeneratorOptions options) {
        this(new YamlTransitionGraphParser(), new GraphValidator(), new TransitionCodeGenerator(options),
                new NodeStubGenerator(options), new GeneratedSourceVerifier());
    }

    public TransitionGraphCompiler(TransitionGraphParser parser, GraphValidator validator,
                                   TransitionCodeGenerator generator, NodeStubGenerator stubGenerator,
                                   GeneratedSourceVerifier verifier) {
        this.parser = Objects.requireNonNull(parser, "Parser cannot be null");
        this.validator = Objects.requireNonNull(validator, "Validator cannot be null");
        this.generator = Objects.requireNonNull(generator, "Generator cannot be null");
        this.stubGenerator = Objects.requireNonNull(stubGenerator, "Stub generator cannot be null");
        this.verifier = Objects.requireNonNull(verifier, "Verifier cannot be null");
    }

    public CompilationResult compile(Path file) throws TransitionGraphParseException {
        return compile(file, node -> true);
    }

    /**
     * @param hasImplementation decides which nodes need a stub
     */
    public CompilationResult compile(Path file, Predicate<NodeDefinition> hasImplementation)
            throws TransitionGraphParseException {
        TransitionGraph graph = parser.parse(file);
        Path fileName = file.getFileName();
        return compile(graph, fileName != null ? fileName.toString() : file.toString(), hasImplementation);
    }

    public CompilationResult compileFromString(String content, String sourceReference)
            throws TransitionGraphParseException {
        return compile(parser.parseFromString(content), sourceReference, node -> true);
    }

    /**
     * @throws dev.mars.railway.workflow.codegen.CodeGenerationException if the emitted
     *         source fails the syntax check
     */
    public CompilationResult compile(TransitionGraph graph, String sourceReference,
                                     Predicate<NodeDefinition> hasImplementation) {
        ValidationResult validation = validator.validate(graph);
        for (ValidationResult.ValidationIssue warning : validation.getWarnings()) {
            logger.warning(graph.getEntrypoint() + ": " + warning);
        }
        if (!validation.isValid()) {
            logger.warning("Graph '" + graph.getEntrypoint() + "' has " + validation.getErrorCount()
                    + " validation error(s); nothing generated");
            return new CompilationResult(graph, validation, null, null, List.of());
        }

        String className = generator.getClassName(graph);
        String source = generator.generate(graph, sourceReference);
        verifier.verify(className + ".java", source);

        List<StubSpec> stubs = stubGenerator.generateStubs(graph, hasImplementation);
        for (StubSpec stub : stubs) {
            verifier.verify(stub.relativePath(), stub.source());
        }

        String packageName = generator.getOptions().getPackageName();
        String relativePath = packageName.isEmpty()
                ? className + ".java"
                : packageName.replace('.', '/') + "/" + className + ".java";

        logger.info("Compiled graph '" + graph.getEntrypoint() + "' from " + sourceReference
                + " into " + relativePath + " with " + stubs.size() + " stub(s)");
        return new CompilationResult(graph, validation, relativePath, source, stubs);
    }
}
