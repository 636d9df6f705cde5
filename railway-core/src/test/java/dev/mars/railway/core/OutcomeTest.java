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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeTest {

    @Test
    void testSuccessDefaultsToDone() {
        Outcome outcome = Outcome.success();

        assertTrue(outcome.isSuccess());
        assertFalse(outcome.isFailure());
        assertEquals("done", outcome.detail());
        assertEquals(OutcomeType.SUCCESS, outcome.type());
    }

    @Test
    void testFailureDefaultsToError() {
        Outcome outcome = Outcome.failure();

        assertTrue(outcome.isFailure());
        assertEquals("error", outcome.detail());
    }

    @Test
    void testToStateString() {
        assertEquals("fetch::success::done", Outcome.success().toStateString("fetch"));
        assertEquals("fetch::failure::timeout", Outcome.failure("timeout").toStateString("fetch"));
        assertEquals("sub.deep.process::success::true", Outcome.success("true").toStateString("sub.deep.process"));
    }

    @Test
    void testEmptyDetailRejected() {
        assertThrows(IllegalArgumentException.class, () -> Outcome.success(""));
        assertThrows(NullPointerException.class, () -> Outcome.failure(null));
    }

    @Test
    void testEquality() {
        assertEquals(Outcome.success("done"), Outcome.success());
        assertNotEquals(Outcome.success("done"), Outcome.failure("done"));
    }

    @Test
    void testOutcomeTypeFromLabel() {
        assertEquals(OutcomeType.SUCCESS, OutcomeType.fromLabel("success"));
        assertEquals(OutcomeType.FAILURE, OutcomeType.fromLabel("failure"));
        assertThrows(IllegalArgumentException.class, () -> OutcomeType.fromLabel("SUCCESS"));
    }
}
