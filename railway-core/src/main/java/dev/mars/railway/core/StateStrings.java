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
 * Builds and parses the string keys used by transition tables.
 * <p>
 * State strings have the shape {@code node::outcome::detail}; legacy exit markers have
 * the shape {@code exit::colour::name}. Exactly three {@code ::}-separated segments are
 * required in both cases.
 */
public final class StateStrings {

    public static final String SEPARATOR = "::";
    public static final String EXIT_PREFIX = "exit";
    public static final String EXIT_MARKER_PREFIX = EXIT_PREFIX + SEPARATOR;

    private StateStrings() {
    }

    public static String makeState(String nodeName, String outcomeType, String detail) {
        Objects.requireNonNull(nodeName, "Node name cannot be null");
        Objects.requireNonNull(outcomeType, "Outcome type cannot be null");
        Objects.requireNonNull(detail, "Detail cannot be null");
        return nodeName + SEPARATOR + outcomeType + SEPARATOR + detail;
    }

    public static ParsedState parseState(String state) {
        String[] parts = split(state, "state");
        return new ParsedState(parts[0], parts[1], parts[2]);
    }

    public static String makeExit(String colour, String name) {
        Objects.requireNonNull(colour, "Exit colour cannot be null");
        Objects.requireNonNull(name, "Exit name cannot be null");
        return EXIT_MARKER_PREFIX + colour + SEPARATOR + name;
    }

    public static ParsedExit parseExit(String exit) {
        String[] parts = split(exit, "exit");
        if (!EXIT_PREFIX.equals(parts[0])) {
            throw new StateFormatException(exit, "exit marker must start with '" + EXIT_MARKER_PREFIX + "'");
        }
        return new ParsedExit(parts[1], parts[2]);
    }

    public static boolean isExitMarker(String value) {
        return value != null && value.startsWith(EXIT_MARKER_PREFIX);
    }

    private static String[] split(String value, String kind) {
        if (value == null) {
            throw new StateFormatException(null, kind + " string cannot be null");
        }
        String[] parts = value.split(SEPARATOR, -1);
        if (parts.length != 3) {
            throw new StateFormatException(value,
                    "expected 3 segments separated by '" + SEPARATOR + "' but found " + parts.length);
        }
        return parts;
    }

    /**
     * Components of a {@code node::outcome::detail} state string.
     */
    public record ParsedState(String nodeName, String outcomeType, String detail) {

        public boolean isSuccess() {
            return OutcomeType.SUCCESS.label().equals(outcomeType);
        }

        public String toStateString() {
            return makeState(nodeName, outcomeType, detail);
        }
    }

    /**
     * Components of an {@code exit::colour::name} legacy exit marker.
     */
    public record ParsedExit(String colour, String name) {

        public String toExitString() {
            return makeExit(colour, name);
        }
    }
}
