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

import dev.mars.assay.api.introspection.AttributeInfo;
import dev.mars.assay.api.introspection.MethodInfo;
import dev.mars.assay.api.introspection.ParameterInfo;
import dev.mars.assay.api.introspection.TypeInfo;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link MethodInfo} over a reflected method. Parameter names are only meaningful when the
 * test classes are compiled with {@code -parameters}.
 */
public class ReflectionMethodInfo implements MethodInfo {

    private final Method method;

    public ReflectionMethodInfo(Method method) {
        this.method = Objects.requireNonNull(method, "Method cannot be null");
    }

    public Method getMethod() {
        return method;
    }

    @Override
    public String getName() {
        return method.getName();
    }

    @Override
    public TypeInfo getType() {
        return new ReflectionTypeInfo(method.getDeclaringClass());
    }

    @Override
    public List<ParameterInfo> getParameters() {
        List<ParameterInfo> parameters = new ArrayList<>();
        for (Parameter parameter : method.getParameters()) {
            parameters.add(parameter::getName);
        }
        return parameters;
    }

    @Override
    public List<AttributeInfo> getCustomAttributes(String attributeTypeName) {
        return Reflector.findAttributes(method.getAnnotations(), attributeTypeName);
    }

    @Override
    public String toString() {
        return "ReflectionMethodInfo{" + method.getDeclaringClass().getName() + "." + method.getName() + "}";
    }
}
