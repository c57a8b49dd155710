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
package dev.mars.assay.core.reflect;

import dev.mars.assay.api.introspection.AssemblyInfo;
import dev.mars.assay.api.introspection.AttributeInfo;

import java.util.List;
import java.util.Objects;

/**
 * Treats a Java package as the assembly of the test classes it contains.
 * Package-level annotations come from the package's {@code package-info.java}.
 */
public class ReflectionAssemblyInfo implements AssemblyInfo {

    private final Package javaPackage;

    public ReflectionAssemblyInfo(Package javaPackage) {
        this.javaPackage = Objects.requireNonNull(javaPackage, "Package cannot be null");
    }

    @Override
    public String getName() {
        return javaPackage.getName();
    }

    @Override
    public List<AttributeInfo> getCustomAttributes(String attributeTypeName) {
        return Reflector.findAttributes(javaPackage.getAnnotations(), attributeTypeName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return javaPackage.getName().equals(((ReflectionAssemblyInfo) o).javaPackage.getName());
    }

    @Override
    public int hashCode() {
        return javaPackage.getName().hashCode();
    }

    @Override
    public String toString() {
        return "ReflectionAssemblyInfo{" + getName() + "}";
    }
}
