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

package dev.mars.railway.workflow.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Errors and warnings reported for a transition graph. Valid when there are no errors;
 * warnings never block generation.
 */
public class ValidationResult {

    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;

    public ValidationResult() {
        this.errors = new ArrayList<>();
        this.warnings = new ArrayList<>();
    }

    public ValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        this.errors = new ArrayList<>(errors != null ? errors : List.of());
        this.warnings = new ArrayList<>(warnings != null ? warnings : List.of());
    }

    public static ValidationResult valid() {
        return new ValidationResult();
    }

    /**
     * Concatenates the errors and warnings of all results, in order.
     */
    public static ValidationResult combine(ValidationResult... results) {
        ValidationResult combined = new ValidationResult();
        for (ValidationResult result : results) {
            combined.errors.addAll(result.errors);
            combined.warnings.addAll(result.warnings);
        }
        return combined;
    }

    public void addError(String code, String message) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, code, null, null, message, null));
    }

    public void addError(String code, String nodeName, String state, String message) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, code, nodeName, state, message, null));
    }

    public void addError(String code, String nodeName, String state, String message, String suggestion) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, code, nodeName, state, message, suggestion));
    }

    public void addWarning(String code, String message) {
        warnings.add(new ValidationIssue(ValidationIssue.Severity.WARNING, code, null, null, message, null));
    }

    public void addWarning(String code, String nodeName, String state, String message) {
        warnings.add(new ValidationIssue(ValidationIssue.Severity.WARNING, code, nodeName, state, message, null));
    }

    public List<ValidationIssue> getErrors() {
        return List.copyOf(errors);
    }

    public List<ValidationIssue> getWarnings() {
        return List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    public int getWarningCount() {
        return warnings.size();
    }

    public boolean hasErrorCode(String code) {
        return errors.stream().anyMatch(issue -> issue.getCode().equals(code));
    }

    public boolean hasWarningCode(String code) {
        return warnings.stream().anyMatch(issue -> issue.getCode().equals(code));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ValidationResult{");
        sb.append("valid=").append(isValid());
        sb.append(", errors=").append(errors.size());
        sb.append(", warnings=").append(warnings.size());
        sb.append("}");
        return sb.toString();
    }

    /**
     * Represents a single validation issue (error or warning) with a stable code.
     */
    public static class ValidationIssue {

        public enum Severity {
            ERROR, WARNING
        }

        private final Severity severity;
        private final String code;
        private final String nodeName;
        private final String state;
        private final String message;
        private final String suggestion;

        public ValidationIssue(Severity severity, String code, String nodeName, String state,
                               String message, String suggestion) {
            this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
            this.code = Objects.requireNonNull(code, "Code cannot be null");
            this.nodeName = nodeName;
            this.state = state;
            this.message = Objects.requireNonNull(message, "Message cannot be null");
            this.suggestion = suggestion;
        }

        public Severity getSeverity() {
            return severity;
        }

        public String getCode() {
            return code;
        }

        /**
         * @return the offending node, or {@code null} for graph-level issues
         */
        public String getNodeName() {
            return nodeName;
        }

        public String getState() {
            return state;
        }

        public String getMessage() {
            return message;
        }

        public String getSuggestion() {
            return suggestion;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ValidationIssue that = (ValidationIssue) o;
            return severity == that.severity &&
                   Objects.equals(code, that.code) &&
                   Objects.equals(nodeName, that.nodeName) &&
                   Objects.equals(state, that.state) &&
                   Objects.equals(message, that.message) &&
                   Objects.equals(suggestion, that.suggestion);
        }

        @Override
        public int hashCode() {
            return Objects.hash(severity, code, nodeName, state, message, suggestion);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(severity).append(" ").append(code);

            if (nodeName != null) {
                sb.append(" [").append(nodeName);
                if (state != null) {
                    sb.append(" / ").append(state);
                }
                sb.append("]");
            }

            sb.append(": ").append(message);

            if (suggestion != null) {
                sb.append(" (suggestion: ").append(suggestion).append(")");
            }

            return sb.toString();
        }
    }
}
