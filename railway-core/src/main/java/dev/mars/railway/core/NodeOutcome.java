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
 * Implemented by generated state enumerations. Each constant wraps one state string.
 */
public interface NodeOutcome {

    /**
     * The {@code node::outcome::detail} state string.
     */
    String value();

    default String nodeName() {
        return StateStrings.parseState(value()).nodeName();
    }

    default OutcomeType outcomeType() {
        return OutcomeType.fromLabel(StateStrings.parseState(value()).outcomeType());
    }

    default String detail() {
        return StateStrings.parseState(value()).detail();
    }

    default boolean isSuccess() {
        return outcomeType() == OutcomeType.SUCCESS;
    }

    default Outcome toOutcome() {
        return new Outcome(outcomeType(), detail());
    }
}
