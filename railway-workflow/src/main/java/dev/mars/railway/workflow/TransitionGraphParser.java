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

import dev.mars.railway.workflow.model.TransitionGraph;

import java.nio.file.Path;

/**
 * Turns a graph description into a {@link TransitionGraph}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public interface TransitionGraphParser {

    /**
     * Reads and parses a graph description file. This is the only file-system access of
     * the compile pipeline.
     *
     * @throws TransitionGraphParseException if the file cannot be read or parsed
     */
    TransitionGraph parse(Path file) throws TransitionGraphParseException;

    /**
     * Parses graph description text. Pure: no I/O, no shared state.
     *
     * @throws TransitionGraphParseException if the text is not a valid description
     */
    TransitionGraph parseFromString(String content) throws TransitionGraphParseException;
}
