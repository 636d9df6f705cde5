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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
/**
 * Description for GeneratedSourceVerifierTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */

class GeneratedSourceVerifierTest {

    private final GeneratedSourceVerifier verifier = new GeneratedSourceVerifier();

    @Test
    void testValidSourceHasNoErrors() {
        String source = "package demo;\n\npublic final class Demo {\n    private Demo() {\n    }\n}\n";

        assertThat(verifier.findSyntaxErrors("Demo.java", source)).isEmpty();
        assertDoesNotThrow(() -> verifier.verify("Demo.java", source));
    }

    @Test
    void testMissingReferencesAreNotSyntaxErrors() {
        String source = "package demo;\n\nimport missing.Thing;\n\nclass Demo {\n    Thing thing;\n}\n";

        assertThat(verifier.findSyntaxErrors("Demo.java", source)).isEmpty();
    }

    @Test
    void testInvalidSourceReportsErrors() {
        String source = "package demo;\n\npublic class Broken {\n    int x = ;\n";

        List<String> errors = verifier.findSyntaxErrors("Broken.java", source);

        assertThat(errors).isNotEmpty();
        assertTrue(errors.get(0).startsWith("Broken.java:"));
    }

    @Test
    void testVerifyThrowsOnInvalidSource() {
        CodeGenerationException exception = assertThrows(CodeGenerationException.class,
                () -> verifier.verify("Broken.java", "class Broken {"));

        assertTrue(exception.getMessage().contains("Broken.java"));
    }

    @Test
    void testMissingCompilerFails() {
        GeneratedSourceVerifier noCompiler = new GeneratedSourceVerifier(null);

        assertThrows(CodeGenerationException.class, () -> noCompiler.findSyntaxErrors("Demo.java", "class Demo {}"));
    }
}
