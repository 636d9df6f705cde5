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

/**
 * Thrown in strict mode when a node produces a state with no transition entry.
 */
public class UndefinedStateException extends DagRunnerException {

    private final String state;
    private final String nodeName;

    public UndefinedStateException(String state, String nodeName) {
        super("Undefined state: " + state + " (node: " + nodeName + ")");
        this.state = state;
        this.nodeName = nodeName;
    }

    public String getState() {
        return state;
    }

    public String getNodeName() {
        return nodeName;
    }
}
