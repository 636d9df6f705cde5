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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class StepRecorderTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-08-18T10:15:30Z"), ZoneOffset.UTC);

    @Test
    void testRecordsStepsInOrder() {
        StepRecorder recorder = new StepRecorder(clock);

        recorder.onStep("fetch", "fetch::success::done", Map.of("id", 1));
        recorder.onStep("exit.success.done", "exit::success.done", "payload");

        List<StepRecord> history = recorder.getHistory();
        assertEquals(2, history.size());
        assertEquals("fetch", history.get(0).nodeName());
        assertEquals("fetch::success::done", history.get(0).state());
        assertEquals(Instant.parse("2025-08-18T10:15:30Z"), history.get(0).timestamp());
        assertEquals(List.of("fetch", "exit.success.done"), recorder.getNodeNames());
    }

    @Test
    void testHistoryIsSnapshot() {
        StepRecorder recorder = new StepRecorder(clock);
        recorder.onStep("a", "a::success::done", null);

        List<StepRecord> snapshot = recorder.getHistory();
        recorder.onStep("b", "b::success::done", null);

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(null));
    }

    @Test
    void testClear() {
        StepRecorder recorder = new StepRecorder(clock);
        recorder.onStep("a", "a::success::done", null);

        recorder.clear();

        assertTrue(recorder.getHistory().isEmpty());
    }

    @Test
    void testToJson() throws Exception {
        StepRecorder recorder = new StepRecorder(clock);
        recorder.onStep("fetch", "fetch::failure::timeout", "ctx");

        JsonNode json = new ObjectMapper().readTree(recorder.toJson());

        assertTrue(json.has("steps"));
        JsonNode step = json.get("steps").get(0);
        assertEquals("fetch", step.get("node_name").asText());
        assertEquals("fetch::failure::timeout", step.get("state").asText());
        assertEquals("2025-08-18T10:15:30Z", step.get("timestamp").asText());
        assertEquals("ctx", step.get("context").asText());
    }

    @Test
    void testRecordToMap() {
        StepRecord record = new StepRecord("a", "a::success::done", null, clock.instant());

        assertThat(record.toMap()).containsEntry("node_name", "a")
                .containsEntry("state", "a::success::done")
                .containsEntry("context", null);
    }
}
