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

import java.util.Objects;

/**
 * A named step of a transition graph.
 * <p>
 * {@code module} is the fully qualified class holding the implementation and
 * {@code function} the static method name. Exit nodes are terminal and carry the exit
 * code reported when the run ends there.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class NodeDefinition {

    private final String name;
    private final String module;
    private final String function;
    private final String description;
    private final boolean exit;
    private final int exitCode;

    public NodeDefinition(String name, String module, String function, String description) {
        this(name, module, function, description, false, 0);
    }

    public NodeDefinition(String name, String module, String function, String description,
                          boolean exit, int exitCode) {
        this.name = Objects.requireNonNull(name, "Node name cannot be null");
        this.module = Objects.requireNonNull(module, "Module cannot be null");
        this.function = Objects.requireNonNull(function, "Function cannot be null");
        this.description = description != null ? description : "";
        this.exit = exit;
        this.exitCode = exitCode;
    }

    public static NodeDefinition exitNode(String name, String module, String function,
                                          String description, int exitCode) {
        return new NodeDefinition(name, module, function, description, true, exitCode);
    }

    public String getName() {
        return name;
    }

    public String getModule() {
        return module;
    }

    public String getFunction() {
        return function;
    }

    public String getDescription() {
        return description;
    }

    public boolean isExit() {
        return exit;
    }

    /**
     * Only meaningful when {@link #isExit()} is true.
     */
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Last dot-separated segment of the name.
     */
    public String getLeafName() {
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeDefinition that = (NodeDefinition) o;
        return exit == that.exit &&
               exitCode == that.exitCode &&
               Objects.equals(name, that.name) &&
               Objects.equals(module, that.module) &&
               Objects.equals(function, that.function) &&
               Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, module, function, description, exit, exitCode);
    }

    @Override
    public String toString() {
        return "NodeDefinition{" +
               "name='" + name + '\'' +
               ", module='" + module + '\'' +
               ", function='" + function + '\'' +
               (exit ? ", exitCode=" + exitCode : "") +
               '}';
    }
}
