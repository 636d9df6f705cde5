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

package dev.mars.railway.workflow.model;

import java.util.Objects;

/**
 * Non-fatal problem noticed while parsing, kept on the graph so the validator can
 * report it together with the structural checks.
 */
public final class ParseWarning {

    private final String code;
    private final String fieldPath;
    private final String message;

    public ParseWarning(String code, String fieldPath, String message) {
        this.code = Objects.requireNonNull(code, "Code cannot be null");
        this.fieldPath = fieldPath;
        this.message = Objects.requireNonNull(message, "Message cannot be null");
    }

    public String getCode() {
        return code;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParseWarning that = (ParseWarning) o;
        return Objects.equals(code, that.code) &&
               Objects.equals(fieldPath, that.fieldPath) &&
               Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, fieldPath, message);
    }

    @Override
    public String toString() {
        return code + " " + (fieldPath != null ? fieldPath + ": " : "") + message;
    }
}
