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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
/**
 * Description for TransitionGraphTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */

class TransitionGraphTest {

    private TransitionGraph sampleGraph() {
        return TransitionGraph.builder()
                .entrypoint("sample")
                .node("start", "nodes.start", "start")
                .node("process", "nodes.process", "process")
                .exitNode("exit.success.done", 0)
                .exit(new ExitDefinition("red_error", 1, "Failed"))
                .transition("start", "success::done", "process")
                .transition("start", "failure::error", "exit::red_error")
                .transition("process", "success::done", "exit.success.done")
                .startNode("start")
                .build();
    }

    @Test
    void testLookups() {
        TransitionGraph graph = sampleGraph();

        assertEquals("1.0", graph.getVersion());
        assertTrue(graph.hasNode("process"));
        assertFalse(graph.hasNode("missing"));
        assertEquals("red_error", graph.getExit("red_error").orElseThrow().getName());
        assertEquals(List.of("success::done", "failure::error"), graph.getStatesForNode("start"));
        assertThat(graph.getExitNodes()).extracting(NodeDefinition::getName).containsExactly("exit.success.done");
        assertThat(graph.getRegularNodes()).extracting(NodeDefinition::getName).containsExactly("start", "process");
    }

    @Test
    void testExitTargets() {
        TransitionGraph graph = sampleGraph();

        assertTrue(graph.isExitTarget("exit::red_error"));
        assertTrue(graph.isExitTarget("exit.success.done"));
        assertFalse(graph.isExitTarget("process"));
        assertFalse(graph.isExitTarget("undeclared"));
    }

    @Test
    void testExitNodeDefaults() {
        NodeDefinition exit = sampleGraph().getNode("exit.success.done").orElseThrow();

        assertTrue(exit.isExit());
        assertEquals("nodes.exit.success.done", exit.getModule());
        assertEquals("done", exit.getFunction());
        assertEquals("done", exit.getLeafName());
    }

    @Test
    void testStateTransitionDetails() {
        StateTransition legacy = new StateTransition("start", "failure::error", "exit::red_error");
        StateTransition regular = new StateTransition("start", "success::done", "process");

        assertEquals("start::failure::error", legacy.getStateString());
        assertTrue(legacy.isLegacyExit());
        assertEquals("red_error", legacy.getExitName());
        assertFalse(regular.isLegacyExit());
        assertNull(regular.getExitName());
        assertEquals("exit.success.done", regular.withTarget("exit.success.done").getToTarget());
    }

    @Test
    void testDuplicateNodeNamesRejected() {
        TransitionGraph.Builder builder = TransitionGraph.builder()
                .entrypoint("dup")
                .node("start", "nodes.start", "start")
                .node("start", "nodes.other", "start")
                .startNode("start");

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, builder::build);
        assertTrue(exception.getMessage().contains("start"));
    }

    @Test
    void testGraphIsImmutable() {
        TransitionGraph graph = sampleGraph();

        assertThrows(UnsupportedOperationException.class,
                () -> graph.getNodes().add(new NodeDefinition("x", "m", "f", "")));
        assertThrows(UnsupportedOperationException.class,
                () -> graph.getTransitions().clear());
    }

    @Test
    void testToBuilderProducesEqualGraph() {
        TransitionGraph graph = sampleGraph();

        assertEquals(graph, graph.toBuilder().build());
        assertEquals(graph.hashCode(), graph.toBuilder().build().hashCode());
        assertNotEquals(graph, graph.toBuilder().description("changed").build());
    }

    @Test
    void testGraphOptionsValidation() {
        GraphOptions defaults = GraphOptions.defaults();

        assertEquals(GraphOptions.DEFAULT_MAX_ITERATIONS, defaults.getMaxIterations());
        assertTrue(defaults.isEnableLoopDetection());
        assertTrue(defaults.isStrictStateCheck());
        assertThrows(IllegalArgumentException.class, () -> new GraphOptions(0, true, true));
    }

    @Test
    void testLegacyExitColourAndDetail() {
        assertEquals("exit::green::resolved", new ExitDefinition("green_resolved", 0, "").toMarker());
        assertEquals("exit::yellow::partial", new ExitDefinition("yellow_partial", 2, "").toMarker());
        assertEquals("exit::red::unknown", new ExitDefinition("unknown", 3, "").toMarker());
        assertEquals("exit::green::ok", new ExitDefinition("ok", 0, "").toMarker());
        assertEquals("green", new ExitDefinition("green_", 1, "").getColour());
        assertEquals("green_", new ExitDefinition("green_", 1, "").getDetail());
    }
}
