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
import dev.mars.railway.workflow.model.StateTransition;
import dev.mars.railway.workflow.model.TransitionGraph;
import dev.mars.railway.workflow.validation.GraphValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
/**
 * Description for ExitFormatConverterTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */

class ExitFormatConverterTest {

    private ExitFormatConverter converter;

    @BeforeEach
    void setUp() {
        converter = new ExitFormatConverter();
    }

    private TransitionGraph legacyGraph() {
        return TransitionGraph.builder()
                .entrypoint("legacy")
                .node("start", "nodes.start", "start")
                .exit(new ExitDefinition("green_success", 0, "Completed"))
                .exit(new ExitDefinition("green_resolved", 0, ""))
                .exit(new ExitDefinition("red_ssh.timeout", 1, "SSH timed out"))
                .exit(new ExitDefinition("yellow_partial", 2, ""))
                .transition("start", "success::done", "exit::green_success")
                .transition("start", "success::resolved", "exit::green_resolved")
                .transition("start", "failure::timeout", "exit::red_ssh.timeout")
                .transition("start", "success::partial", "exit::yellow_partial")
                .startNode("start")
                .build();
    }

    @Test
    void testExitNodeNames() {
        assertEquals("exit.success.done", ExitFormatConverter.toExitNodeName(new ExitDefinition("green_success", 0, "")));
        assertEquals("exit.success.resolved", ExitFormatConverter.toExitNodeName(new ExitDefinition("green_resolved", 0, "")));
        assertEquals("exit.failure.timeout", ExitFormatConverter.toExitNodeName(new ExitDefinition("red_timeout", 1, "")));
        assertEquals("exit.warning.partial", ExitFormatConverter.toExitNodeName(new ExitDefinition("yellow_partial", 2, "")));
        assertEquals("exit.success.unknown", ExitFormatConverter.toExitNodeName(new ExitDefinition("unknown", 0, "")));
        assertEquals("exit.failure.failure", ExitFormatConverter.toExitNodeName(new ExitDefinition("red_failure", 1, "")));
    }

    @Test
    void testColourPrefixTakesPriorityOverCode() {
        assertEquals("exit.success.odd", ExitFormatConverter.toExitNodeName(new ExitDefinition("green_odd", 3, "")));
        assertEquals("exit.warning.plain", ExitFormatConverter.toExitNodeName(new ExitDefinition("plain", 2, "")));
    }

    @Test
    void testToCurrentFormat() {
        TransitionGraph converted = converter.toCurrentFormat(legacyGraph());

        assertTrue(converted.getExits().isEmpty());
        assertThat(converted.getExitNodes())
                .extracting(NodeDefinition::getName)
                .containsExactly("exit.success.done", "exit.success.resolved",
                        "exit.failure.ssh.timeout", "exit.warning.partial");

        NodeDefinition done = converted.getNode("exit.success.done").orElseThrow();
        assertEquals(0, done.getExitCode());
        assertEquals("Completed", done.getDescription());
        assertEquals("nodes.exit.success.done", done.getModule());
        assertEquals("done", done.getFunction());
        assertEquals(2, converted.getNode("exit.warning.partial").orElseThrow().getExitCode());

        assertThat(converted.getTransitions())
                .extracting(StateTransition::getToTarget)
                .containsExactly("exit.success.done", "exit.success.resolved",
                        "exit.failure.ssh.timeout", "exit.warning.partial");
        assertTrue(new GraphValidator().validate(converted).isValid());
    }

    @Test
    void testNestedLegacyTargetsBecomeExitNodes() {
        TransitionGraph graph = TransitionGraph.builder()
                .entrypoint("nested")
                .node("start", "nodes.start", "start")
                .transition("start", "success::done", "exit::success::done")
                .transition("start", "failure::ssh", "exit::failure::ssh::handshake")
                .startNode("start")
                .build();

        TransitionGraph converted = converter.toCurrentFormat(graph);

        assertThat(converted.getTransitions())
                .extracting(StateTransition::getToTarget)
                .containsExactly("exit.success.done", "exit.failure.ssh.handshake");
        assertEquals(1, converted.getNode("exit.failure.ssh.handshake").orElseThrow().getExitCode());
    }

    @Test
    void testLegacyRoundTripIsLossless() {
        TransitionGraph legacy = legacyGraph();

        assertEquals(legacy, converter.toLegacyFormat(converter.toCurrentFormat(legacy)));
    }

    @Test
    void testCurrentRoundTripIsLossless() {
        TransitionGraph current = TransitionGraph.builder()
                .entrypoint("current")
                .description("Exit nodes only")
                .node("start", "nodes.start", "start")
                .node(NodeDefinition.exitNode("exit.success.done", "nodes.exit.success.done", "done", "Finished", 0))
                .node(NodeDefinition.exitNode("exit.failure.ssh.handshake",
                        "nodes.exit.failure.ssh.handshake", "handshake", "", 1))
                .node(NodeDefinition.exitNode("exit.warning.partial", "nodes.exit.warning.partial", "partial", "", 2))
                .transition("start", "success::done", "exit.success.done")
                .transition("start", "failure::ssh", "exit.failure.ssh.handshake")
                .transition("start", "success::partial", "exit.warning.partial")
                .startNode("start")
                .build();

        TransitionGraph legacy = converter.toLegacyFormat(current);

        assertThat(legacy.getExits())
                .extracting(ExitDefinition::getName)
                .containsExactly("green_success", "red_ssh.handshake", "yellow_partial");
        assertEquals("exit::green_success", legacy.getTransitions().get(0).getToTarget());
        assertEquals(current, converter.toCurrentFormat(legacy));
    }

    @Test
    void testCustomExitNodesAreKept() {
        TransitionGraph graph = TransitionGraph.builder()
                .entrypoint("custom")
                .node("start", "nodes.start", "start")
                .node(NodeDefinition.exitNode("exit.success.done", "app.Exits", "finish", "", 0))
                .node(NodeDefinition.exitNode("exit.skipped.none", "nodes.exit.skipped.none", "none", "", 0))
                .transition("start", "success::done", "exit.success.done")
                .transition("start", "success::skip", "exit.skipped.none")
                .startNode("start")
                .build();

        TransitionGraph legacy = converter.toLegacyFormat(graph);

        assertTrue(legacy.getExits().isEmpty());
        assertEquals(graph, legacy);
    }
}
