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

package dev.mars.railway.workflow.codegen;

import dev.mars.railway.workflow.validation.IdentifierRules;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The one sanitizing transform applied wherever a graph name becomes a Java symbol.
 * State strings and node names used as values are never passed through here.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class JavaIdentifiers {

    private JavaIdentifiers() {
    }

    /**
     * {@code sub.deep.process} and {@code success::done} become
     * {@code SUB_DEEP_PROCESS_SUCCESS_DONE}.
     */
    public static String toConstantName(String nodeName, String state) {
        return toConstantName(nodeName + "_" + state);
    }

    public static String toConstantName(String name) {
        StringBuilder sb = new StringBuilder();
        String flattened = name.replace("::", "_").replace('.', '_');
        flattened.codePoints().forEach(cp ->
                sb.appendCodePoint(Character.isJavaIdentifierPart(cp) ? cp : '_'));
        String constant = sb.toString().toUpperCase(Locale.ROOT);
        // "_" alone is a keyword
        if (constant.isEmpty() || constant.equals("_")) {
            return "UNNAMED";
        }
        if (!Character.isJavaIdentifierStart(constant.codePointAt(0))) {
            constant = "_" + constant;
        }
        return constant;
    }

    /**
     * {@code my_workflow} becomes {@code MyWorkflow}.
     */
    public static String toClassName(String name) {
        StringBuilder sb = new StringBuilder();
        boolean upperNext = true;
        for (int i = 0; i < name.length(); ) {
            int cp = name.codePointAt(i);
            i += Character.charCount(cp);
            if (!Character.isLetterOrDigit(cp)) {
                upperNext = true;
                continue;
            }
            sb.appendCodePoint(upperNext ? Character.toUpperCase(cp) : cp);
            upperNext = false;
        }
        if (sb.length() == 0) {
            return "Unnamed";
        }
        if (Character.isDigit(sb.charAt(0))) {
            sb.insert(0, 'N');
        }
        return sb.toString();
    }

    /**
     * A single identifier usable as a package segment, class or method name.
     */
    public static String safeSegment(String segment) {
        if (IdentifierRules.isValidIdentifier(segment)) {
            return segment;
        }
        if (IdentifierRules.isReservedWord(segment)) {
            return segment + "_";
        }
        return IdentifierRules.suggestValidName(segment);
    }

    /**
     * Sanitizes each dot segment of a qualified name.
     */
    public static String qualifiedName(String dotted) {
        List<String> segments = new ArrayList<>();
        for (String segment : dotted.split("\\.")) {
            if (!segment.isEmpty()) {
                segments.add(safeSegment(segment));
            }
        }
        return segments.isEmpty() ? "unnamed" : String.join(".", segments);
    }

    /**
     * Method name for a node function: the last dotted segment, sanitized.
     */
    public static String functionName(String function) {
        int dot = function.lastIndexOf('.');
        return safeSegment(dot >= 0 ? function.substring(dot + 1) : function);
    }

    /**
     * Appends {@code _2}, {@code _3}, ... until the candidate is not in {@code used},
     * then records it.
     */
    public static String unique(String candidate, Set<String> used) {
        String name = candidate;
        int suffix = 2;
        while (!used.add(name)) {
            name = candidate + "_" + suffix++;
        }
        return name;
    }
}
