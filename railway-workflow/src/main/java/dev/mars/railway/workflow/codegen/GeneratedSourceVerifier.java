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

import com.sun.source.util.JavacTask;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.ToolProvider;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Syntax check for generated sources using the JDK compiler's parser. Only parsing is
 * performed, so referenced node classes need not exist.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class GeneratedSourceVerifier {

    private static final Logger logger = Logger.getLogger(GeneratedSourceVerifier.class.getName());

    private final JavaCompiler compiler;

    public GeneratedSourceVerifier() {
        this(ToolProvider.getSystemJavaCompiler());
    }

    GeneratedSourceVerifier(JavaCompiler compiler) {
        this.compiler = compiler;
    }

    /**
     * @return syntax error messages, empty when the source parses
     * @throws CodeGenerationException when no compiler is available or parsing fails
     */
    public List<String> findSyntaxErrors(String fileName, String source) {
        Objects.requireNonNull(fileName, "File name cannot be null");
        Objects.requireNonNull(source, "Source cannot be null");
        if (compiler == null) {
            throw new CodeGenerationException("No system Java compiler available to verify " + fileName);
        }

        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        JavaFileObject file = new InMemorySource(fileName, source);
        JavacTask task = (JavacTask) compiler.getTask(null, null, diagnostics,
                List.of("-proc:none"), null, List.of(file));
        try {
            task.parse();
        } catch (IOException e) {
            throw new CodeGenerationException("Failed to parse " + fileName, e);
        }

        List<String> errors = new ArrayList<>();
        for (Diagnostic<? extends JavaFileObject> diagnostic : diagnostics.getDiagnostics()) {
            if (diagnostic.getKind() == Diagnostic.Kind.ERROR) {
                errors.add(fileName + ":" + diagnostic.getLineNumber() + ": " + diagnostic.getMessage(Locale.ROOT));
            }
        }
        return errors;
    }

    /**
     * @throws CodeGenerationException listing every syntax error found
     */
    public void verify(String fileName, String source) {
        List<String> errors = findSyntaxErrors(fileName, source);
        if (!errors.isEmpty()) {
            logger.warning("Generated source " + fileName + " has " + errors.size() + " syntax error(s)");
            throw new CodeGenerationException("Generated source is not valid Java: " + String.join("; ", errors));
        }
        logger.fine("Verified generated source " + fileName);
    }

    private static final class InMemorySource extends SimpleJavaFileObject {

        private final String source;

        InMemorySource(String fileName, String source) {
            super(URI.create("string:///" + fileName.replace('\\', '/')), Kind.SOURCE);
            this.source = source;
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) {
            return source;
        }
    }
}
