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
 * Final classification of a run: a category ({@code success}, {@code failure},
 * {@code warning} or a custom label), a detail and the numeric exit code.
 * <p>
 * Exit nodes are named {@code exit.<category>.<detail...>} (or the older
 * {@code _exit_<category>_<detail>}); legacy markers are {@code exit::<colour>::<name>}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public record ExitClassification(String category, String detail, int exitCode) {

    public static final String SUCCESS = "success";
    public static final String FAILURE = "failure";
    public static final String WARNING = "warning";

    public static final String GREEN = "green";
    public static final String RED = "red";
    public static final String YELLOW = "yellow";

    public static final String EXIT_NODE_PREFIX = "exit.";
    public static final String UNDERSCORE_EXIT_NODE_PREFIX = "_exit_";

    public ExitClassification {
        Objects.requireNonNull(category, "Category cannot be null");
        Objects.requireNonNull(detail, "Detail cannot be null");
        if (category.isEmpty()) {
            throw new IllegalArgumentException("Category cannot be empty");
        }
    }

    public static ExitClassification of(String category, String detail) {
        return new ExitClassification(category, detail, defaultExitCode(category));
    }

    public static ExitClassification success(String detail) {
        return of(SUCCESS, detail);
    }

    public static ExitClassification failure(String detail) {
        return of(FAILURE, detail);
    }

    public static ExitClassification warning(String detail) {
        return of(WARNING, detail);
    }

    /**
     * Exit code implied by a category when none is declared.
     */
    public static int defaultExitCode(String category) {
        if (SUCCESS.equals(category)) {
            return 0;
        }
        if (WARNING.equals(category)) {
            return 2;
        }
        return 1;
    }

    public static boolean isExitNodeName(String nodeName) {
        return nodeName != null
                && (nodeName.startsWith(EXIT_NODE_PREFIX) || nodeName.startsWith(UNDERSCORE_EXIT_NODE_PREFIX));
    }

    /**
     * Strips the exit prefix from a node name: {@code exit.success.done} becomes
     * {@code success.done}, {@code _exit_failure_timeout} becomes {@code failure.timeout}.
     * Names without a prefix are returned unchanged.
     */
    public static String deriveExitState(String nodeName) {
        if (nodeName.startsWith(EXIT_NODE_PREFIX)) {
            return nodeName.substring(EXIT_NODE_PREFIX.length());
        }
        if (nodeName.startsWith(UNDERSCORE_EXIT_NODE_PREFIX)) {
            return nodeName.substring(UNDERSCORE_EXIT_NODE_PREFIX.length()).replace('_', '.');
        }
        return nodeName;
    }

    public static ExitClassification fromExitNodeName(String nodeName) {
        Objects.requireNonNull(nodeName, "Exit node name cannot be null");
        return fromExitState(deriveExitState(nodeName));
    }

    /**
     * Parses {@code category.detail}; the detail may itself contain dots.
     */
    public static ExitClassification fromExitState(String exitState) {
        Objects.requireNonNull(exitState, "Exit state cannot be null");
        int dot = exitState.indexOf('.');
        if (dot < 0) {
            return of(exitState, "");
        }
        return of(exitState.substring(0, dot), exitState.substring(dot + 1));
    }

    /**
     * Classifies a legacy {@code exit::colour::name} marker. Green maps to success,
     * yellow to warning and every other colour to failure.
     */
    public static ExitClassification fromLegacyMarker(String marker) {
        if (!StateStrings.isExitMarker(marker)) {
            throw new StateFormatException(marker, "legacy exit marker must start with '"
                    + StateStrings.EXIT_MARKER_PREFIX + "'");
        }
        String[] parts = marker.split(StateStrings.SEPARATOR, -1);
        String colour = parts.length > 1 && !parts[1].isEmpty() ? parts[1] : GREEN;
        String name = parts.length > 2 && !parts[2].isEmpty() ? parts[2] : Outcome.DEFAULT_SUCCESS_DETAIL;
        return of(categoryForColour(colour), name);
    }

    public static String categoryForColour(String colour) {
        switch (colour) {
            case GREEN:
                return SUCCESS;
            case YELLOW:
                return WARNING;
            default:
                return FAILURE;
        }
    }

    public ExitClassification withExitCode(int code) {
        return new ExitClassification(category, detail, code);
    }

    /**
     * {@code category.detail}, or just the category when there is no detail.
     */
    public String exitState() {
        return detail.isEmpty() ? category : category + "." + detail;
    }

    public String colour() {
        switch (category) {
            case SUCCESS:
                return GREEN;
            case FAILURE:
                return RED;
            case WARNING:
                return YELLOW;
            default:
                return exitCode == 0 ? GREEN : category;
        }
    }

    /**
     * Success and warning count as success, failure never does; custom categories
     * fall back to the exit code.
     */
    public boolean isSuccess() {
        switch (category) {
            case SUCCESS:
            case WARNING:
                return true;
            case FAILURE:
                return false;
            default:
                return exitCode == 0;
        }
    }
}
