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

package dev.mars.railway.core.observability;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One observed step.
 */
public record StepRecord(String nodeName, String state, Object context, Instant timestamp) {

    public StepRecord {
        Objects.requireNonNull(nodeName, "Node name cannot be null");
        Objects.requireNonNull(state, "State cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("node_name", nodeName);
        map.put("state", state);
        map.put("timestamp", timestamp.toString());
        map.put("context", context != null ? context.toString() : null);
        return map;
    }
}
