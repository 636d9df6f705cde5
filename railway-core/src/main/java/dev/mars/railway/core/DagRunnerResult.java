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

import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot produced once per run.
 * <p>
 * {@code classification} is {@code null} when a lenient run stopped on an undefined
 * state; {@link #exitCode()} is then the empty string. {@code exitContract} is the
 * contract returned by the exit node, if it returned one.
 */
public record DagRunnerResult(ExitClassification classification,
                              Object context,
                              int iterations,
                              List<String> executionPath,
                              ExitContract exitContract) implements ExitContract {

    public DagRunnerResult {
        executionPath = List.copyOf(executionPath);
    }

    /**
     * Colour label of the exit class ({@code green}, {@code red}, {@code yellow} or the
     * custom category), or {@code ""} when no exit was reached.
     */
    public String exitCode() {
        return classification != null ? classification.colour() : "";
    }

    public boolean isUndefined() {
        return classification == null;
    }

    @Override
    public String exitState() {
        if (exitContract != null) {
            return exitContract.exitState();
        }
        return classification != null ? classification.exitState() : "";
    }

    @Override
    public boolean isSuccess() {
        return classification != null && classification.isSuccess();
    }

    @Override
    public int exitStatus() {
        return classification != null ? classification.exitCode() : 1;
    }

    public Optional<ExitContract> getExitContract() {
        return Optional.ofNullable(exitContract);
    }

    public String lastNode() {
        return executionPath.isEmpty() ? null : executionPath.get(executionPath.size() - 1);
    }
}
