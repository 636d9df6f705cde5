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

package dev.mars.railway.core;

import dev.mars.railway.core.observability.StepObserver;
import dev.mars.railway.core.observability.StepRecorder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Description for DagRunnerTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
class DagRunnerTest {

    private static Map<String, Object> with(Map<String, Object> context, String key, Object value) {
        Map<String, Object> copy = new HashMap<>(context);
        copy.put(key, value);
        return copy;
    }

    @Test
    void testLinearRunReachesGreenExit() {
        TransitionTable<Map<String, Object>> table = TransitionTable.<Map<String, Object>>builder()
                .next("start::success::done", "second", ctx -> NodeResult.success(with(ctx, "second", true), "done"))
                .terminate("second::success::done", "exit::green::done")
                .build();

        DagRunnerResult result = new DagRunner().run("start",
                () -> NodeResult.success(Map.of("start", true), "done"), table);

        assertEquals(2, result.iterations());
        assertEquals(List.of("start", "second"), result.executionPath());
        assertTrue(result.isSuccess());
        assertEquals("green", result.exitCode());
        assertEquals(0, result.exitStatus());
        assertEquals("success.done", result.exitState());
        assertEquals(Map.of("start", true, "second", true), result.context());
    }

    @Test
    void testBranchFollowsOutcomeDetail() {
        List<String> visited = new ArrayList<>();
        for (String detail : List.of("true", "false")) {
            TransitionTable<String> table = TransitionTable.<String>builder()
                    .next("check::success::true", "on_true", ctx -> NodeResult.success(ctx, "done"))
                    .next("check::success::false", "on_false", ctx -> NodeResult.success(ctx, "done"))
                    .terminate("on_true::success::done", "exit::green::done")
                    .terminate("on_false::success::done", "exit::green::done")
                    .build();

            DagRunnerResult result = new DagRunner().run("check", () -> NodeResult.success("ctx", detail), table);
            visited.add(result.lastNode());
        }

        assertEquals(List.of("on_true", "on_false"), visited);
    }

    @Test
    void testMaxIterationsStopsAfterExactBound() {
        AtomicInteger invocations = new AtomicInteger();
        TransitionTable<Integer> table = TransitionTable.<Integer>builder()
                .next("start::success::done", "loop", ctx -> {
                    invocations.incrementAndGet();
                    return NodeResult.success(ctx + 1, "done");
                })
                .next("loop::success::done", "loop", ctx -> {
                    invocations.incrementAndGet();
                    return NodeResult.success(ctx + 1, "done");
                })
                .build();

        DagRunner runner = new DagRunner(RunnerOptions.builder().maxIterations(5).build());
        MaxIterationsException e = assertThrows(MaxIterationsException.class, () -> runner.run("start", () -> {
            invocations.incrementAndGet();
            return NodeResult.success(0, "done");
        }, table));

        assertEquals(5, invocations.get());
        assertEquals(5, e.getMaxIterations());
        assertEquals(List.of("start", "loop", "loop", "loop", "loop"), e.getPathTail());
        assertThat(e.getMessage()).contains("(5)").contains("start -> loop");
    }

    @Test
    void testMaxIterationsTailIsBounded() {
        TransitionTable<Integer> table = TransitionTable.<Integer>builder()
                .next("start::success::done", "loop", ctx -> NodeResult.success(ctx, "done"))
                .next("loop::success::done", "loop", ctx -> NodeResult.success(ctx, "done"))
                .build();

        DagRunner runner = new DagRunner(RunnerOptions.builder().maxIterations(25).pathTailSize(10).build());
        MaxIterationsException e = assertThrows(MaxIterationsException.class,
                () -> runner.run("start", () -> NodeResult.success(0, "done"), table));

        assertEquals(10, e.getPathTail().size());
        assertThat(e.getPathTail()).containsOnly("loop");
    }

    @Test
    void testLenientUndefinedStateReturnsEmptyExitCode() {
        TransitionTable<String> table = TransitionTable.<String>builder()
                .terminate("start::success::done", "exit::green::done")
                .build();

        DagRunner runner = new DagRunner(RunnerOptions.builder().strict(false).build());
        DagRunnerResult result = runner.run("start", () -> NodeResult.failure("partial", "unexpected"), table);

        assertEquals("", result.exitCode());
        assertTrue(result.isUndefined());
        assertFalse(result.isSuccess());
        assertEquals(1, result.iterations());
        assertEquals(List.of("start"), result.executionPath());
        assertEquals("partial", result.context());
    }

    @Test
    void testStrictUndefinedStateThrows() {
        TransitionTable<String> table = TransitionTable.<String>builder()
                .terminate("start::success::done", "exit::green::done")
                .build();

        UndefinedStateException e = assertThrows(UndefinedStateException.class,
                () -> new DagRunner().run("start", () -> NodeResult.failure("ctx", "boom"), table));

        assertEquals("start::failure::boom", e.getState());
        assertEquals("start", e.getNodeName());
        assertThat(e.getMessage()).contains("start::failure::boom");
    }

    @Test
    void testExitNodeWrapsBarePayload() {
        StepRecorder recorder = new StepRecorder();
        TransitionTable<String> table = TransitionTable.<String>builder()
                .exit("start::failure::timeout", "exit.failure.timeout", ctx -> ctx + ":final")
                .build();

        DagRunner runner = new DagRunner(RunnerOptions.builder().observer(recorder).build());
        DagRunnerResult result = runner.run("start", () -> NodeResult.failure("ctx", "timeout"), table);

        assertEquals(2, result.iterations());
        assertEquals(List.of("start", "exit.failure.timeout"), result.executionPath());
        assertEquals("red", result.exitCode());
        assertEquals(1, result.exitStatus());
        assertEquals("failure.timeout", result.exitState());
        assertFalse(result.isSuccess());
        assertEquals("ctx:final", result.context());
        assertInstanceOf(DefaultExitContract.class, result.getExitContract().orElseThrow());

        assertEquals(List.of("start", "exit.failure.timeout"), recorder.getNodeNames());
        assertEquals("exit::failure.timeout", recorder.getHistory().get(1).state());
    }

    @Test
    void testExitNodeContractIsPreserved() {
        ExitContract custom = new ExitContract() {
            @Override
            public String exitState() {
                return "warning.partial";
            }

            @Override
            public Object context() {
                return "custom";
            }
        };
        TransitionTable<String> table = TransitionTable.<String>builder()
                .exit("start::success::done", "exit.success.done", ctx -> custom)
                .build();

        DagRunnerResult result = new DagRunner().run("start", () -> NodeResult.success("ctx", "done"), table);

        assertSame(custom, result.getExitContract().orElseThrow());
        assertEquals("warning.partial", result.exitState());
        assertEquals("yellow", result.exitCode());
        assertTrue(result.isSuccess());
        assertEquals("custom", result.context());
    }

    @Test
    void testDeclaredExitCodeOverridesCategoryDefault() {
        TransitionTable<String> table = TransitionTable.<String>builder()
                .exit("start::success::done", "exit.skipped.weekend", 0, ctx -> ctx)
                .build();

        DagRunnerResult result = new DagRunner().run("start", () -> NodeResult.success("ctx", "done"), table);

        assertEquals("green", result.exitCode());
        assertEquals("skipped.weekend", result.exitState());
        assertEquals(0, result.exitStatus());
        assertTrue(result.isSuccess());
    }

    @Test
    void testCustomCategoryWithNonZeroCodeKeepsItsLabel() {
        TransitionTable<String> table = TransitionTable.<String>builder()
                .exit("start::success::done", "exit.skipped.weekend", 3, ctx -> ctx)
                .build();

        DagRunnerResult result = new DagRunner().run("start", () -> NodeResult.success("ctx", "done"), table);

        assertEquals("skipped", result.exitCode());
        assertEquals(3, result.exitStatus());
        assertFalse(result.isSuccess());
    }

    @Test
    void testExitNodeCountsAgainstBound() {
        AtomicInteger exitCalls = new AtomicInteger();
        TransitionTable<String> table = TransitionTable.<String>builder()
                .exit("start::success::done", "exit.success.done", ctx -> {
                    exitCalls.incrementAndGet();
                    return ctx;
                })
                .build();

        DagRunner runner = new DagRunner(RunnerOptions.builder().maxIterations(1).build());
        assertThrows(MaxIterationsException.class,
                () -> runner.run("start", () -> NodeResult.success("ctx", "done"), table));
        assertEquals(0, exitCalls.get());
    }

    @Test
    void testObserverSeesEveryStepInOrder() {
        List<String> states = new ArrayList<>();
        StepObserver observer = (node, state, context) -> states.add(node + "|" + state);
        TransitionTable<String> table = TransitionTable.<String>builder()
                .next("a::success::done", "b", ctx -> NodeResult.failure(ctx, "retry"))
                .next("b::failure::retry", "c", ctx -> NodeResult.success(ctx, "done"))
                .exit("c::success::done", "exit.success.done", ctx -> ctx)
                .build();

        new DagRunner(RunnerOptions.builder().observer(observer).build())
                .run("a", () -> NodeResult.success("ctx", "done"), table);

        assertEquals(List.of(
                "a|a::success::done",
                "b|b::failure::retry",
                "c|c::success::done",
                "exit.success.done|exit::success.done"), states);
    }

    @Test
    void testObserverExceptionAbortsRun() {
        AtomicInteger secondCalls = new AtomicInteger();
        TransitionTable<String> table = TransitionTable.<String>builder()
                .next("a::success::done", "b", ctx -> {
                    secondCalls.incrementAndGet();
                    return NodeResult.success(ctx, "done");
                })
                .build();
        StepObserver failing = (node, state, context) -> {
            throw new IllegalStateException("observer failed");
        };

        DagRunner runner = new DagRunner(RunnerOptions.builder().observer(failing).build());
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> runner.run("a", () -> NodeResult.success("ctx", "done"), table));

        assertEquals("observer failed", e.getMessage());
        assertEquals(0, secondCalls.get());
    }

    @Test
    void testNodeExceptionPropagates() {
        TransitionTable<String> table = TransitionTable.<String>builder()
                .next("a::success::done", "b", ctx -> {
                    throw new IllegalArgumentException("bad input");
                })
                .build();

        assertThrows(IllegalArgumentException.class,
                () -> new DagRunner().run("a", () -> NodeResult.success("ctx", "done"), table));
    }

    @Test
    void testAsyncNodesAreAwaited() {
        TransitionTable<Integer> table = TransitionTable.<Integer>builder()
                .nextAsync("a::success::done", "b",
                        ctx -> CompletableFuture.supplyAsync(() -> NodeResult.success(ctx * 10, "done")))
                .exitAsync("b::success::done", "exit.success.done",
                        ctx -> CompletableFuture.completedFuture(ctx + 1))
                .build();

        DagRunnerResult result = new DagRunner().run("a", () -> NodeResult.success(4, "done"), table);

        assertEquals(41, result.context());
        assertEquals(3, result.iterations());
    }

    @Test
    void testAsyncNodeFailureIsUnwrapped() {
        TransitionTable<Integer> table = TransitionTable.<Integer>builder()
                .nextAsync("a::success::done", "b",
                        ctx -> CompletableFuture.failedFuture(new IllegalStateException("remote down")))
                .build();

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new DagRunner().run("a", () -> NodeResult.success(1, "done"), table));
        assertEquals("remote down", e.getMessage());
    }

    @Test
    void testNullNodeResultRejected() {
        TransitionTable<String> table = TransitionTable.<String>builder().build();

        assertThrows(DagRunnerException.class, () -> new DagRunner().run("a", () -> null, table));
    }

    @Test
    void testFromConfiguration() {
        java.util.Properties properties = new java.util.Properties();
        properties.setProperty(RunnerConfiguration.MAX_ITERATIONS_KEY, "3");
        properties.setProperty(RunnerConfiguration.STRICT_KEY, "false");
        properties.setProperty(RunnerConfiguration.METRICS_ENABLED_KEY, "false");

        DagRunner runner = DagRunner.fromConfiguration(new RunnerConfiguration(properties));

        assertEquals(3, runner.getOptions().getMaxIterations());
        assertFalse(runner.getOptions().isStrict());
    }
}
