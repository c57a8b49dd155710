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
 * Thrown when a test case cannot be written to, or rebuilt from, its serialized form.
 * A (de)serialization call that throws this never hands back a partially built entity.
 */
public class SerializationException extends RuntimeException {

    private final String errorCode;

    public SerializationException(String message) {
        this(AssayErrorCodes.SERIALIZATION_FAILED, message, null);
    }

    public SerializationException(String message, Throwable cause) {
        this(AssayErrorCodes.SERIALIZATION_FAILED, message, cause);
    }

    protected SerializationException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
