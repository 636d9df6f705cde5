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

import dev.mars.railway.core.ExitClassification;
import dev.mars.railway.core.StateStrings;

import java.util.List;
import java.util.Objects;

/**
 * Legacy flat exit declared in the {@code exits} section and referenced by
 * {@code exit::<name>} targets. Superseded by exit nodes.
 */
public final class ExitDefinition {

    private static final List<String> COLOURS =
            List.of(ExitClassification.GREEN, ExitClassification.RED, ExitClassification.YELLOW);

    private final String name;
    private final int code;
    private final String description;

    public ExitDefinition(String name, int code, String description) {
        this.name = Objects.requireNonNull(name, "Exit name cannot be null");
        this.code = code;
        this.description = description != null ? description : "";
    }

    public String getName() {
        return name;
    }

    public int getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Colour taken from a {@code green_}, {@code red_} or {@code yellow_} name prefix,
     * otherwise from the code: 0 is green, 2 is yellow, anything else red.
     */
    public String getColour() {
        for (String colour : COLOURS) {
            if (name.startsWith(colour + "_")) {
                return colour;
            }
        }
        if (code == 0) {
            return ExitClassification.GREEN;
        }
        return code == 2 ? ExitClassification.YELLOW : ExitClassification.RED;
    }

    /**
     * Name without its colour prefix.
     */
    public String getDetail() {
        for (String colour : COLOURS) {
            String prefix = colour + "_";
            if (name.startsWith(prefix) && name.length() > prefix.length()) {
                return name.substring(prefix.length());
            }
        }
        return name;
    }

    /**
     * Runtime marker, e.g. {@code green_resolved} becomes {@code exit::green::resolved}.
     */
    public String toMarker() {
        return StateStrings.makeExit(getColour(), getDetail());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExitDefinition that = (ExitDefinition) o;
        return code == that.code &&
               Objects.equals(name, that.name) &&
               Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, code, description);
    }

    @Override
    public String toString() {
        return "ExitDefinition{name='" + name + "', code=" + code + '}';
    }
}
