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
import java.lang.reflect.Method;
import java.util.List;
import java.util.Objects;

/**
 * {@link AttributeInfo} over a Java annotation instance.
 *
 * <p>Java annotations only have named members, so there are no constructor arguments.
 * A member holding an empty string reads back as absent.</p>
 */
public class ReflectionAttributeInfo implements AttributeInfo {

    private final Annotation annotation;

    public ReflectionAttributeInfo(Annotation annotation) {
        this.annotation = Objects.requireNonNull(annotation, "Annotation cannot be null");
    }

    public Annotation getAnnotation() {
        return annotation;
    }

    @Override
    public String getAttributeTypeName() {
        return annotation.annotationType().getName();
    }

    @Override
    public List<Object> getConstructorArguments() {
        return List.of();
    }

    @Override
    public <T> T getNamedArgument(String argumentName, Class<T> type) {
        Objects.requireNonNull(argumentName, "Argument name cannot be null");
        Objects.requireNonNull(type, "Type cannot be null");
        Method member;
        try {
            member = annotation.annotationType().getMethod(argumentName);
        } catch (NoSuchMethodException e) {
            return null;
        }
        Object value = Reflector.invoke(member, annotation);
        if (value instanceof String && ((String) value).isEmpty()) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(String.format("Member '%s' of @%s is a %s, not a %s",
                argumentName, getAttributeTypeName(), value.getClass().getName(), type.getName()));
        }
        return type.cast(value);
    }

    @Override
    public String toString() {
        return annotation.toString();
    }
}
