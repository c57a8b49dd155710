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
import dev.mars.assay.api.introspection.TypeInfo;

import java.util.List;
import java.util.Objects;

public class ReflectionTypeInfo implements TypeInfo {

    private final Class<?> type;

    public ReflectionTypeInfo(Class<?> type) {
        this.type = Objects.requireNonNull(type, "Type cannot be null");
    }

    public Class<?> getType() {
        return type;
    }

    @Override
    public String getName() {
        return type.getName();
    }

    @Override
    public AssemblyInfo getAssembly() {
        return new ReflectionAssemblyInfo(type.getPackage());
    }

    @Override
    public List<AttributeInfo> getCustomAttributes(String attributeTypeName) {
        return Reflector.findAttributes(type.getAnnotations(), attributeTypeName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return type.equals(((ReflectionTypeInfo) o).type);
    }

    @Override
    public int hashCode() {
        return type.hashCode();
    }

    @Override
    public String toString() {
        return "ReflectionTypeInfo{" + type.getName() + "}";
    }
}
