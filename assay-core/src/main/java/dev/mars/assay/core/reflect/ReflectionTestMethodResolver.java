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

import dev.mars.assay.api.annotations.Fact;
import dev.mars.assay.api.error.SerializationException;
import dev.mars.assay.api.introspection.TestMethod;
import dev.mars.assay.core.testcase.TestMethodResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.Objects;

/**
 * Resolves serialized test method coordinates by loading the class and looking the method up
 * by name. When a name is overloaded, the overload carrying a fact-like annotation wins.
 */
public class ReflectionTestMethodResolver implements TestMethodResolver {
    private static final Logger logger = LoggerFactory.getLogger(ReflectionTestMethodResolver.class);

    private final ClassLoader classLoader;

    public ReflectionTestMethodResolver() {
        this(ReflectionTestMethodResolver.class.getClassLoader());
    }

    public ReflectionTestMethodResolver(ClassLoader classLoader) {
        this.classLoader = Objects.requireNonNull(classLoader, "Class loader cannot be null");
    }

    /**
     * Builds a {@link TestMethod} for a method of a loaded class.
     *
     * @throws IllegalArgumentException if the class has no method with that name
     */
    public static TestMethod testMethodOf(Class<?> testClass, String methodName) {
        Method method = findMethod(testClass, methodName);
        if (method == null) {
            throw new IllegalArgumentException("No method '" + methodName + "' on " + testClass.getName());
        }
        return new TestMethod(new ReflectionTypeInfo(testClass), new ReflectionMethodInfo(method));
    }

    @Override
    public TestMethod resolve(String assemblyName, String className, String methodName) {
        Class<?> testClass;
        try {
            testClass = Class.forName(className, false, classLoader);
        } catch (ClassNotFoundException e) {
            throw new SerializationException("Test class " + className + " could not be loaded", e);
        }
        String packageName = testClass.getPackage().getName();
        if (!packageName.equals(assemblyName)) {
            throw new SerializationException(String.format(
                "Test class %s belongs to '%s', not to '%s'", className, packageName, assemblyName));
        }
        Method method = findMethod(testClass, methodName);
        if (method == null) {
            throw new SerializationException("Test method " + className + "." + methodName + " does not exist");
        }
        logger.debug("Resolved test method {}.{}", className, methodName);
        return new TestMethod(new ReflectionTypeInfo(testClass), new ReflectionMethodInfo(method));
    }

    private static Method findMethod(Class<?> testClass, String methodName) {
        Method fallback = null;
        for (Class<?> type = testClass; type != null && type != Object.class; type = type.getSuperclass()) {
            for (Method method : type.getDeclaredMethods()) {
                if (!method.getName().equals(methodName) || method.isSynthetic()) {
                    continue;
                }
                if (!Reflector.findAttributes(method.getAnnotations(), Fact.class.getName()).isEmpty()) {
                    return method;
                }
                if (fallback == null) {
                    fallback = method;
                }
            }
        }
        return fallback;
    }
}
