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

import java.util.List;
import java.util.Objects;

/**
 * Fans each step out to several observers in registration order.
 */
public class CompositeStepObserver implements StepObserver {

    private final List<StepObserver> observers;

    public CompositeStepObserver(StepObserver... observers) {
        this(List.of(observers));
    }

    public CompositeStepObserver(List<StepObserver> observers) {
        Objects.requireNonNull(observers, "Observers cannot be null");
        this.observers = List.copyOf(observers);
    }

    @Override
    public void onStep(String nodeName, String state, Object context) {
        for (StepObserver observer : observers) {
            observer.onStep(nodeName, state, context);
        }
    }

    public List<StepObserver> getObservers() {
        return observers;
    }
}
