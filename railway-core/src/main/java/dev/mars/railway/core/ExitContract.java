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
 * Terminal-result shape: an exit state ({@code category.detail}) and the final context.
 * Exit nodes returning an implementation of this interface have it passed through the
 * runner unchanged.
 */
public interface ExitContract {

    String exitState();

    Object context();

    default ExitClassification classification() {
        return ExitClassification.fromExitState(exitState());
    }

    default boolean isSuccess() {
        return classification().isSuccess();
    }

    /**
     * Numeric process exit status derived from the classification.
     */
    default int exitStatus() {
        return classification().exitCode();
    }
}
