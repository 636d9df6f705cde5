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

import dev.mars.railway.workflow.model.ExitDefinition;
import dev.mars.railway.workflow.model.NodeDefinition;
import dev.mars.railway.workflow.model.ParseWarning;
import dev.mars.railway.workflow.model.StateTransition;
import dev.mars.railway.workflow.model.TransitionGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
/**
 * Description for YamlTransitionGraphParserTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */

class YamlTransitionGraphParserTest {

    private YamlTransitionGraphParser parser;

    @BeforeEach
    void setUp() {
        parser = new YamlTransitionGraphParser();
    }

    static Path resource(String name) throws URISyntaxException {
        return Paths.get(YamlTransitionGraphParserTest.class.getResource("/graphs/" + name).toURI());
    }

    @Test
    void testParseSimpleGraph() throws TransitionGraphParseException {
        String yaml = """
                version: "1.0"
                entrypoint: simple
                description: "A simple graph"
                nodes:
                  start:
                    module: nodes.start
                    function: start
                    description: "First step"
                  exit:
                    success:
                      done:
                start: start
                transitions:
                  start:
                    success::done: exit.success.done
                """;

        TransitionGraph graph = parser.parseFromString(yaml);

        assertEquals("1.0", graph.getVersion());
        assertEquals("simple", graph.getEntrypoint());
        assertEquals("A simple graph", graph.getDescription());
        assertEquals("start", graph.getStartNode());
        assertEquals(2, graph.getNodes().size());

        NodeDefinition start = graph.getNode("start").orElseThrow();
        assertEquals("nodes.start", start.getModule());
        assertEquals("start", start.getFunction());
        assertEquals("First step", start.getDescription());
        assertFalse(start.isExit());

        assertEquals(1, graph.getTransitions().size());
        StateTransition transition = graph.getTransitions().get(0);
        assertEquals("start", transition.getFromNode());
        assertEquals("success::done", transition.getFromState());
        assertEquals("exit.success.done", transition.getToTarget());
        assertEquals(100, graph.getOptions().getMaxIterations());
    }

    @Test
    void testParseExitTreeWithDefaults() throws Exception {
        TransitionGraph graph = parser.parse(resource("alert_check.yml"));

        assertThat(graph.getExitNodes())
                .extracting(NodeDefinition::getName)
                .containsExactly("exit.success.done", "exit.success.resolved",
                        "exit.failure.http", "exit.warning.partial");

        NodeDefinition done = graph.getNode("exit.success.done").orElseThrow();
        assertTrue(done.isExit());
        assertEquals(0, done.getExitCode());
        assertEquals("nodes.exit.success.done", done.getModule());
        assertEquals("done", done.getFunction());
        assertEquals("Finished", done.getDescription());

        assertEquals(1, graph.getNode("exit.failure.http").orElseThrow().getExitCode());
        assertEquals(2, graph.getNode("exit.warning.partial").orElseThrow().getExitCode());
        assertEquals(20, graph.getOptions().getMaxIterations());
        assertTrue(graph.getOptions().isStrictStateCheck());
    }

    @Test
    void testExplicitExitCodeOverridesCategoryDefault() throws TransitionGraphParseException {
        String yaml = """
                version: "1.0"
                entrypoint: codes
                nodes:
                  start:
                    module: nodes.start
                    function: start
                  exit:
                    failure:
                      timeout:
                        exit_code: 4
                        description: "Timed out"
                start: start
                transitions:
                  start:
                    failure::timeout: exit.failure.timeout
                """;

        TransitionGraph graph = parser.parseFromString(yaml);

        NodeDefinition timeout = graph.getNode("exit.failure.timeout").orElseThrow();
        assertEquals(4, timeout.getExitCode());
        assertEquals("Timed out", timeout.getDescription());
    }

    @Test
    void testParseNestedNodeGroups() throws Exception {
        TransitionGraph graph = parser.parse(resource("nested_nodes.yml"));

        NodeDefinition process = graph.getNode("sub.deep.process").orElseThrow();
        assertEquals("nodes.deep_test.sub.deep.process", process.getModule());
        assertEquals("process", process.getFunction());
        assertEquals("process", process.getLeafName());

        assertThat(graph.getTransitionsForNode("sub.deep.process"))
                .extracting(StateTransition::getToTarget)
                .containsExactly("exit.success.done");
        assertThat(graph.getTransitionsForNode("start"))
                .extracting(StateTransition::getToTarget)
                .containsExactly("sub.deep.process");
    }

    @Test
    void testParseLegacyExits() throws Exception {
        TransitionGraph graph = parser.parse(resource("legacy_exits.yml"));

        assertThat(graph.getExits())
                .extracting(ExitDefinition::getName)
                .containsExactly("green_success", "red_timeout", "yellow_partial");
        ExitDefinition timeout = graph.getExit("red_timeout").orElseThrow();
        assertEquals(1, timeout.getCode());
        assertEquals("Timed out", timeout.getDescription());
        assertEquals("exit::red::timeout", timeout.toMarker());

        StateTransition legacy = graph.getTransitionsForNode("process").get(0);
        assertTrue(legacy.isLegacyExit());
        assertEquals("green_success", legacy.getExitName());
        assertTrue(graph.isExitTarget(legacy.getToTarget()));
    }

    @Test
    void testMissingRequiredFieldFails() {
        String yaml = """
                version: "1.0"
                entrypoint: broken
                nodes:
                  start:
                    module: nodes.start
                    function: start
                transitions: {}
                """;

        TransitionGraphParseException exception = assertThrows(TransitionGraphParseException.class,
                () -> parser.parseFromString(yaml));
        assertEquals("start", exception.getFieldPath());
        assertTrue(exception.getMessage().contains("Required field 'start' is missing"));
    }

    @Test
    void testNodeWithoutModuleFails() {
        String yaml = """
                version: "1.0"
                entrypoint: broken
                nodes:
                  start:
                    function: start
                start: start
                transitions: {}
                """;

        TransitionGraphParseException exception = assertThrows(TransitionGraphParseException.class,
                () -> parser.parseFromString(yaml));
        assertEquals("nodes.start", exception.getFieldPath());
        assertTrue(exception.getMessage().contains("module"));
    }

    @Test
    void testRootMustBeMapping() {
        TransitionGraphParseException exception = assertThrows(TransitionGraphParseException.class,
                () -> parser.parseFromString("- just\n- a list\n"));
        assertTrue(exception.getMessage().contains("mapping"));
    }

    @Test
    void testSyntaxErrorReportsLineNumber() {
        String yaml = """
                version: "1.0"
                entrypoint: broken
                nodes: [unclosed
                start: start
                """;

        TransitionGraphParseException exception = assertThrows(TransitionGraphParseException.class,
                () -> parser.parseFromString(yaml));
        assertTrue(exception.getLineNumber() > 0);
        assertTrue(exception.getMessage().contains("Line "));
    }

    @Test
    void testNonPositiveMaxIterationsFails() {
        String yaml = """
                version: "1.0"
                entrypoint: broken
                nodes:
                  start:
                    module: nodes.start
                    function: start
                start: start
                transitions: {}
                options:
                  max_iterations: 0
                """;

        TransitionGraphParseException exception = assertThrows(TransitionGraphParseException.class,
                () -> parser.parseFromString(yaml));
        assertEquals("options.max_iterations", exception.getFieldPath());
    }

    @Test
    void testMalformedTransitionsLeaveNodeWithoutTransitions() throws TransitionGraphParseException {
        String yaml = """
                version: "1.0"
                entrypoint: malformed
                nodes:
                  start:
                    module: nodes.start
                    function: start
                  next:
                    module: nodes.next
                    function: next
                start: start
                transitions:
                  start:
                    success::done: next
                  next: "not a mapping"
                """;

        TransitionGraph graph = parser.parseFromString(yaml);

        assertEquals(1, graph.getTransitions().size());
        assertTrue(graph.getTransitionsForNode("next").isEmpty());
    }

    @Test
    void testNodeLocalTransitionWinsAndRecordsConflict() throws TransitionGraphParseException {
        String yaml = """
                version: "1.0"
                entrypoint: merge
                nodes:
                  start:
                    module: nodes.start
                    function: start
                    transitions:
                      success::done: local_target
                  local_target:
                    module: nodes.local_target
                    function: local_target
                  top_target:
                    module: nodes.top_target
                    function: top_target
                start: start
                transitions:
                  start:
                    success::done: top_target
                    failure::error: top_target
                """;

        TransitionGraph graph = parser.parseFromString(yaml);

        assertThat(graph.getTransitionsForNode("start"))
                .extracting(StateTransition::toString)
                .containsExactlyInAnyOrder(
                        "start::success::done -> local_target",
                        "start::failure::error -> top_target");

        assertEquals(1, graph.getParseWarnings().size());
        ParseWarning warning = graph.getParseWarnings().get(0);
        assertEquals("W002", warning.getCode());
        assertEquals("transitions.start", warning.getFieldPath());
        assertTrue(warning.getMessage().contains("local_target"));
        assertTrue(warning.getMessage().contains("top_target"));
    }

    @Test
    void testIdenticalLocalAndTopLevelTransitionIsNotAConflict() throws TransitionGraphParseException {
        String yaml = """
                version: "1.0"
                entrypoint: merge
                nodes:
                  start:
                    module: nodes.start
                    function: start
                    transitions:
                      success::done: exit.success.done
                  exit:
                    success:
                      done:
                start: start
                transitions:
                  start:
                    success::done: exit.success.done
                """;

        TransitionGraph graph = parser.parseFromString(yaml);

        assertEquals(1, graph.getTransitions().size());
        assertTrue(graph.getParseWarnings().isEmpty());
    }

    @Test
    void testNonStringScalarsAreStringified() throws TransitionGraphParseException {
        String yaml = """
                version: 1.0
                entrypoint: scalars
                nodes:
                  start:
                    module: nodes.start
                    function: start
                start: start
                transitions:
                  start:
                    success::done: 42
                """;

        TransitionGraph graph = parser.parseFromString(yaml);

        assertEquals("1.0", graph.getVersion());
        assertEquals("42", graph.getTransitions().get(0).getToTarget());
    }

    @Test
    void testParseMissingFileFails() {
        Path missing = Paths.get("does-not-exist", "graph.yml");

        TransitionGraphParseException exception = assertThrows(TransitionGraphParseException.class,
                () -> parser.parse(missing));
        assertTrue(exception.getMessage().contains("File not found"));
    }

    @Test
    void testParseFileAttributesErrorsToSource(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "version: \"1.0\"\n");

        TransitionGraphParseException exception = assertThrows(TransitionGraphParseException.class,
                () -> parser.parse(file));
        assertEquals(file.toString(), exception.getSource());
        assertTrue(exception.getMessage().startsWith("Graph '" + file + "'"));
    }
}
