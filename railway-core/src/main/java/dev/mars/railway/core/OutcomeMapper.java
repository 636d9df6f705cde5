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
 * Bridges {@link Outcome} values and generated state enumerations.
 */
public final class OutcomeMapper {

    private OutcomeMapper() {
    }

    /**
     * Finds the constant of {@code stateType} whose value equals the state string the
     * outcome produces for {@code nodeName}.
     *
     * @throws OutcomeMappingException if no constant matches
     */
    public static <E extends Enum<E> & NodeOutcome> E mapToState(Outcome outcome, String nodeName, Class<E> stateType) {
        Objects.requireNonNull(outcome, "Outcome cannot be null");
        Objects.requireNonNull(stateType, "State type cannot be null");
        String state = outcome.toStateString(nodeName);
        for (E constant : stateType.getEnumConstants()) {
            if (constant.value().equals(state)) {
                return constant;
            }
        }
        throw new OutcomeMappingException(state, stateType);
    }
}
