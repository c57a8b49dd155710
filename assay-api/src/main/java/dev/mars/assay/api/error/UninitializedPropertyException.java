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
package dev.mars.assay.api.error;

/**
 * Thrown when a property is read before its one-time initialization or write.
 * This always indicates a programming defect in the caller.
 */
public class UninitializedPropertyException extends IllegalStateException {

    private final String propertyName;
    private final String ownerTypeName;

    public UninitializedPropertyException(String propertyName, Class<?> ownerType) {
        this(propertyName, ownerType.getName());
    }

    public UninitializedPropertyException(String propertyName, String ownerTypeName) {
        super("Attempted to get " + propertyName + " on an uninitialized '" + ownerTypeName + "' object");
        this.propertyName = propertyName;
        this.ownerTypeName = ownerTypeName;
    }

    public String getPropertyName() {
        return propertyName;
    }

    public String getOwnerTypeName() {
        return ownerTypeName;
    }

    public String getErrorCode() {
        return AssayErrorCodes.UNINITIALIZED_PROPERTY;
    }
}
