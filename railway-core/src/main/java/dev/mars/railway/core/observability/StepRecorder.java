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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Observer that keeps the full step history of a run for later inspection.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class StepRecorder implements StepObserver {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<StepRecord> history = new ArrayList<>();
    private final Clock clock;

    public StepRecorder() {
        this(Clock.systemUTC());
    }

    public StepRecorder(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    @Override
    public synchronized void onStep(String nodeName, String state, Object context) {
        history.add(new StepRecord(nodeName, state, context, clock.instant()));
    }

    public synchronized List<StepRecord> getHistory() {
        return List.copyOf(history);
    }

    public synchronized List<String> getNodeNames() {
        return history.stream().map(StepRecord::nodeName).toList();
    }

    public synchronized void clear() {
        history.clear();
    }

    public synchronized Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("steps", history.stream().map(StepRecord::toMap).toList());
        return map;
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(toMap());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize step history", e);
        }
    }
}
