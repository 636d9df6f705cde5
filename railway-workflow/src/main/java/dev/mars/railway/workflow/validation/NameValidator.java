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

/**
 * Checks names typed by users before they reach a graph description. Entry names must
 * be a single identifier; node names may be dot-separated, each segment an identifier.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class NameValidator {

    private NameValidator() {
    }

    public static NameValidation validateEntryName(String name) {
        String value = name != null ? name : "";
        if (IdentifierRules.isValidIdentifier(value)) {
            return NameValidation.ok(value);
        }
        if (value.contains("/") || value.contains(".")) {
            String flattened = IdentifierRules.suggestValidName(value.replace('/', '_').replace('.', '_'));
            return NameValidation.invalid(value,
                    "Entry name '" + value + "' must be a single identifier without '.' or '/'", flattened);
        }
        return NameValidation.invalid(value, describeSegmentProblem(value), IdentifierRules.suggestValidName(value));
    }

    public static NameValidation validateNodeName(String name) {
        String value = name != null ? name : "";
        if (value.contains("/")) {
            String dotted = value.replace('/', '.');
            return NameValidation.invalid(value,
                    "Node name '" + value + "' must not contain '/'; use '.' to separate hierarchy levels",
                    suggestDotted(dotted));
        }
        String[] segments = value.split("\\.", -1);
        for (String segment : segments) {
            if (segment.isEmpty()) {
                return NameValidation.invalid(value,
                        "Node name '" + value + "' has an empty segment (leading, trailing or doubled '.')",
                        suggestDotted(value));
            }
            if (!IdentifierRules.isValidIdentifier(segment)) {
                return NameValidation.invalid(value, describeSegmentProblem(segment), suggestDotted(value));
            }
        }
        return NameValidation.ok(value);
    }

    static String describeSegmentProblem(String segment) {
        if (segment.isEmpty()) {
            return "Name cannot be empty";
        }
        if (IdentifierRules.isReservedWord(segment)) {
            return "'" + segment + "' is a reserved word";
        }
        if (segment.contains("-")) {
            return "'" + segment + "' contains '-'; use '_' instead";
        }
        if (Character.isDigit(segment.charAt(0))) {
            return "'" + segment + "' starts with a digit";
        }
        return "'" + segment + "' is not a valid identifier";
    }

    private static String suggestDotted(String value) {
        List<String> fixed = new ArrayList<>();
        for (String segment : value.split("\\.")) {
            if (segment.isEmpty()) {
                continue;
            }
            fixed.add(IdentifierRules.isValidIdentifier(segment) ? segment : IdentifierRules.suggestValidName(segment));
        }
        return fixed.isEmpty() ? "unnamed" : String.join(".", fixed);
    }
}
