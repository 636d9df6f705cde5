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
 * Thrown when an {@link Outcome} has no matching constant in a state enumeration.
 */
public class OutcomeMappingException extends DagRunnerException {

    private final String state;

    public OutcomeMappingException(String state, Class<?> stateType) {
        super("No constant in " + stateType.getSimpleName() + " matches state: " + state);
        this.state = state;
    }

    public String getState() {
        return state;
    }
}
