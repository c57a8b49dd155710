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
 * Thrown when a required key is absent from a serialization bag.
 */
public class MissingFieldException extends SerializationException {

    private final String fieldName;
    private final String ownerTypeName;

    public MissingFieldException(String fieldName, String ownerTypeName) {
        super(AssayErrorCodes.MISSING_FIELD,
              "Missing required field '" + fieldName + "' while deserializing '" + ownerTypeName + "'",
              null);
        this.fieldName = fieldName;
        this.ownerTypeName = ownerTypeName;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getOwnerTypeName() {
        return ownerTypeName;
    }
}
