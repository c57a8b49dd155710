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

import java.lang.annotation.Annotation;
import java.lang.annotation.Repeatable;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Annotation lookups shared by the reflection-backed introspection types.
 */
final class Reflector {

    private Reflector() {
        // Utility class - no instantiation
    }

    /**
     * Finds the annotations whose type is {@code attributeTypeName} or is meta-annotated with it,
     * unwrapping repeatable containers. Declaration order is kept.
     */
    static List<AttributeInfo> findAttributes(Annotation[] annotations, String attributeTypeName) {
        List<AttributeInfo> result = new ArrayList<>();
        for (Annotation annotation : annotations) {
            for (Annotation candidate : unwrap(annotation)) {
                if (matches(candidate.annotationType(), attributeTypeName, new HashSet<>())) {
                    result.add(new ReflectionAttributeInfo(candidate));
                }
            }
        }
        return result;
    }

    private static boolean matches(Class<? extends Annotation> type, String attributeTypeName,
                                   Set<Class<?>> visited) {
        if (type.getName().equals(attributeTypeName)) {
            return true;
        }
        if (!visited.add(type)) {
            return false;
        }
        for (Annotation meta : type.getAnnotations()) {
            Class<? extends Annotation> metaType = meta.annotationType();
            if (!metaType.getName().startsWith("java.lang.annotation.")
                && matches(metaType, attributeTypeName, visited)) {
                return true;
            }
        }
        return false;
    }

    private static List<Annotation> unwrap(Annotation annotation) {
        Method value;
        try {
            value = annotation.annotationType().getMethod("value");
        } catch (NoSuchMethodException e) {
            return List.of(annotation);
        }
        Class<?> returnType = value.getReturnType();
        if (!returnType.isArray() || !returnType.getComponentType().isAnnotation()) {
            return List.of(annotation);
        }
        Repeatable repeatable = returnType.getComponentType().getAnnotation(Repeatable.class);
        if (repeatable == null || repeatable.value() != annotation.annotationType()) {
            return List.of(annotation);
        }
        return List.of((Annotation[]) invoke(value, annotation));
    }

    static Object invoke(Method member, Annotation annotation) {
        try {
            member.setAccessible(true);
            return member.invoke(annotation);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot read member '" + member.getName() + "' of @"
                + annotation.annotationType().getName(), e);
        }
    }
}
