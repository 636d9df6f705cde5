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

import java.util.Set;

/**
 * Rules for names that end up as Java identifiers in generated sources.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class IdentifierRules {

    /** Java keywords, the boolean and null literals and the underscore. */
    public static final Set<String> RESERVED_WORDS = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char",
            "class", "const", "continue", "default", "do", "double", "else", "enum",
            "extends", "final", "finally", "float", "for", "goto", "if", "implements",
            "import", "instanceof", "int", "interface", "long", "native", "new",
            "package", "private", "protected", "public", "return", "short", "static",
            "strictfp", "super", "switch", "synchronized", "this", "throw", "throws",
            "transient", "try", "void", "volatile", "while",
            "true", "false", "null", "_");

    private IdentifierRules() {
    }

    public static boolean isReservedWord(String name) {
        return RESERVED_WORDS.contains(name);
    }

    /**
     * True when the name is a legal Java identifier that is not reserved. Unicode letters
     * are accepted.
     */
    public static boolean isValidIdentifier(String name) {
        if (name == null || name.isEmpty() || isReservedWord(name)) {
            return false;
        }
        if (!Character.isJavaIdentifierStart(name.codePointAt(0))) {
            return false;
        }
        return name.codePoints().allMatch(Character::isJavaIdentifierPart);
    }

    /**
     * Closest valid identifier: hyphens become underscores, reserved words get a
     * trailing underscore, a leading digit gets a prefix and an empty name becomes
     * {@code unnamed}.
     */
    public static String suggestValidName(String name) {
        if (name == null || name.isEmpty()) {
            return "unnamed";
        }
        String candidate = name.replace('-', '_');
        if (isReservedWord(candidate)) {
            return candidate + "_";
        }
        if (candidate.chars().allMatch(Character::isDigit)) {
            return "exit_" + candidate;
        }
        if (Character.isDigit(candidate.charAt(0))) {
            candidate = "n_" + candidate;
        }
        StringBuilder sb = new StringBuilder();
        candidate.codePoints().forEach(cp ->
                sb.appendCodePoint(Character.isJavaIdentifierPart(cp) ? cp : '_'));
        return sb.toString();
    }
}
