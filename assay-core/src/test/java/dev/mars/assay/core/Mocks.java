package dev.mars.assay.core;

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

import dev.mars.assay.api.annotations.Fact;
import dev.mars.assay.api.annotations.Theory;
import dev.mars.assay.api.annotations.Trait;
import dev.mars.assay.api.introspection.AssemblyInfo;
import dev.mars.assay.api.introspection.AttributeInfo;
import dev.mars.assay.api.introspection.MethodInfo;
import dev.mars.assay.api.introspection.ParameterInfo;
import dev.mars.assay.api.introspection.TestMethod;
import dev.mars.assay.api.introspection.TypeInfo;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Mockito-backed introspection doubles.
 *
 * <p>Lookups for {@code @Fact} return the fact-like attributes; lookups for the trait
 * meta-annotation return every other attribute.</p>
 */
public final class Mocks {

    private Mocks() {
        // Utility class - no instantiation
    }

    public static AssemblyInfo assemblyInfo(String name, AttributeInfo... attributes) {
        AssemblyInfo assembly = mock(AssemblyInfo.class);
        when(assembly.getName()).thenReturn(name);
        when(assembly.getCustomAttributes(anyString()))
            .thenAnswer(invocation -> filter(attributes, invocation.getArgument(0)));
        return assembly;
    }

    public static TypeInfo typeInfo(String name, AssemblyInfo assembly, AttributeInfo... attributes) {
        TypeInfo type = mock(TypeInfo.class);
        when(type.getName()).thenReturn(name);
        when(type.getAssembly()).thenReturn(assembly);
        when(type.getCustomAttributes(anyString()))
            .thenAnswer(invocation -> filter(attributes, invocation.getArgument(0)));
        return type;
    }

    public static MethodInfo methodInfo(String name, TypeInfo type, List<String> parameterNames,
                                        AttributeInfo... attributes) {
        MethodInfo method = mock(MethodInfo.class);
        List<ParameterInfo> parameters = new ArrayList<>();
        for (String parameterName : parameterNames) {
            parameters.add(() -> parameterName);
        }
        when(method.getName()).thenReturn(name);
        when(method.getType()).thenReturn(type);
        when(method.getParameters()).thenReturn(parameters);
        when(method.getCustomAttributes(anyString()))
            .thenAnswer(invocation -> filter(attributes, invocation.getArgument(0)));
        return method;
    }

    /**
     * A test method named {@code methodName} on class {@code com.acme.MyTests} in assembly {@code com.acme}.
     */
    public static TestMethod testMethod(String methodName, List<String> parameterNames, AttributeInfo... methodAttributes) {
        AssemblyInfo assembly = assemblyInfo("com.acme");
        TypeInfo type = typeInfo("com.acme.MyTests", assembly);
        return new TestMethod(type, methodInfo(methodName, type, parameterNames, methodAttributes));
    }

    public static AttributeInfo factAttribute() {
        return factAttribute(null, null, null);
    }

    public static AttributeInfo factAttribute(String displayName, String skip, Integer timeout) {
        return factLike(Fact.class.getName(), displayName, skip, timeout);
    }

    public static AttributeInfo theoryAttribute() {
        return factLike(Theory.class.getName(), null, null, null);
    }

    private static AttributeInfo factLike(String typeName, String displayName, String skip, Integer timeout) {
        AttributeInfo attribute = mock(AttributeInfo.class);
        when(attribute.getAttributeTypeName()).thenReturn(typeName);
        when(attribute.getNamedArgument("displayName", String.class)).thenReturn(displayName);
        when(attribute.getNamedArgument("skip", String.class)).thenReturn(skip);
        when(attribute.getNamedArgument("timeout", Integer.class)).thenReturn(timeout);
        return attribute;
    }

    public static AttributeInfo traitAttribute(String name, String value) {
        AttributeInfo attribute = mock(AttributeInfo.class);
        when(attribute.getAttributeTypeName()).thenReturn(Trait.class.getName());
        when(attribute.getNamedArgument("name", String.class)).thenReturn(name);
        when(attribute.getNamedArgument("value", String.class)).thenReturn(value);
        return attribute;
    }

    /**
     * A trait attribute of a custom annotation type, positional arguments only.
     */
    public static AttributeInfo customTraitAttribute(String typeName, Object... constructorArguments) {
        AttributeInfo attribute = mock(AttributeInfo.class);
        when(attribute.getAttributeTypeName()).thenReturn(typeName);
        when(attribute.getConstructorArguments()).thenReturn(Arrays.asList(constructorArguments));
        return attribute;
    }

    private static List<AttributeInfo> filter(AttributeInfo[] attributes, String requestedTypeName) {
        boolean factLookup = Fact.class.getName().equals(requestedTypeName);
        List<AttributeInfo> result = new ArrayList<>();
        for (AttributeInfo attribute : attributes) {
            if (isFactLike(attribute.getAttributeTypeName()) == factLookup) {
                result.add(attribute);
            }
        }
        return result;
    }

    private static boolean isFactLike(String typeName) {
        return Fact.class.getName().equals(typeName) || Theory.class.getName().equals(typeName);
    }
}
