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

import java.util.Objects;

/**
 * Envelope for exit nodes that return a bare payload instead of an {@link ExitContract}.
 */
public record DefaultExitContract(ExitClassification classification, Object context) implements ExitContract {

    public DefaultExitContract {
        Objects.requireNonNull(classification, "Classification cannot be null");
    }

    public static DefaultExitContract forExitNode(String exitNodeName, Object payload) {
        return new DefaultExitContract(ExitClassification.fromExitNodeName(exitNodeName), payload);
    }

    @Override
    public String exitState() {
        return classification.exitState();
    }
}
