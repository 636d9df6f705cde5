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

import java.util.Objects;

/**
 * Settings for {@link TransitionCodeGenerator}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class GeneratorOptions {

    public static final String DEFAULT_PACKAGE = "transitions";
    public static final String DEFAULT_CONTEXT_TYPE = "java.lang.Object";
    public static final String DEFAULT_CLASS_SUFFIX = "Transitions";

    private final String packageName;
    private final String contextType;
    private final String classSuffix;

    private GeneratorOptions(Builder builder) {
        this.packageName = builder.packageName;
        this.contextType = builder.contextType;
        this.classSuffix = builder.classSuffix;
    }

    public static GeneratorOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Package of the generated class; empty for the default package.
     */
    public String getPackageName() {
        return packageName;
    }

    /**
     * Source text of the workflow context type, used as the type argument of the table.
     */
    public String getContextType() {
        return contextType;
    }

    public String getClassSuffix() {
        return classSuffix;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GeneratorOptions that = (GeneratorOptions) o;
        return Objects.equals(packageName, that.packageName) &&
               Objects.equals(contextType, that.contextType) &&
               Objects.equals(classSuffix, that.classSuffix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(packageName, contextType, classSuffix);
    }

    @Override
    public String toString() {
        return "GeneratorOptions{" +
               "packageName='" + packageName + '\'' +
               ", contextType='" + contextType + '\'' +
               ", classSuffix='" + classSuffix + '\'' +
               '}';
    }

    public static class Builder {
        private String packageName = DEFAULT_PACKAGE;
        private String contextType = DEFAULT_CONTEXT_TYPE;
        private String classSuffix = DEFAULT_CLASS_SUFFIX;

        public Builder packageName(String packageName) {
            this.packageName = Objects.requireNonNull(packageName, "Package name cannot be null");
            return this;
        }

        public Builder contextType(String contextType) {
            this.contextType = Objects.requireNonNull(contextType, "Context type cannot be null");
            return this;
        }

        public Builder classSuffix(String classSuffix) {
            this.classSuffix = Objects.requireNonNull(classSuffix, "Class suffix cannot be null");
            return this;
        }

        public GeneratorOptions build() {
            if (contextType.isBlank()) {
                throw new IllegalArgumentException("Context type cannot be blank");
            }
            return new GeneratorOptions(this);
        }
    }
}
