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

import java.util.List;
import java.util.Objects;

/**
 * A placeholder class for one implementation module.
 *
 * @param module       qualified class name the nodes reference
 * @param relativePath source path relative to a source root, e.g. {@code nodes/fetch.java}
 * @param source       compilable Java text
 * @param nodeNames    nodes whose methods the class declares
 */
public record StubSpec(String module, String relativePath, String source, List<String> nodeNames) {

    public StubSpec {
        Objects.requireNonNull(module, "Module cannot be null");
        Objects.requireNonNull(relativePath, "Relative path cannot be null");
        Objects.requireNonNull(source, "Source cannot be null");
        nodeNames = List.copyOf(nodeNames);
    }
}
