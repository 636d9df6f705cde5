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

import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CompositeStepObserverTest {

    @Test
    void testDelegatesToAllObserversInOrder() {
        StepObserver first = mock(StepObserver.class);
        StepObserver second = mock(StepObserver.class);
        CompositeStepObserver composite = new CompositeStepObserver(first, second);

        composite.onStep("fetch", "fetch::success::done", "ctx");

        InOrder inOrder = inOrder(first, second);
        inOrder.verify(first).onStep("fetch", "fetch::success::done", "ctx");
        inOrder.verify(second).onStep("fetch", "fetch::success::done", "ctx");
        assertEquals(2, composite.getObservers().size());
    }

    @Test
    void testFailureStopsLaterObservers() {
        StepObserver failing = mock(StepObserver.class);
        StepObserver later = mock(StepObserver.class);
        doThrow(new IllegalStateException("boom")).when(failing).onStep(anyString(), anyString(), any());

        CompositeStepObserver composite = new CompositeStepObserver(failing, later);

        assertThrows(IllegalStateException.class, () -> composite.onStep("a", "a::success::done", null));
        verifyNoInteractions(later);
    }
}
