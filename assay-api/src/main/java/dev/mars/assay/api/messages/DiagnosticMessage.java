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
package dev.mars.assay.api.messages;

import java.util.Objects;

/**
 * Informational message about discovery or execution. Diagnostics are never fatal.
 */
public class DiagnosticMessage extends AssayMessage {

    private final String message;
    private final String code;

    public DiagnosticMessage(String message) {
        this(message, null);
    }

    public DiagnosticMessage(String message, String code) {
        this.message = Objects.requireNonNull(message, "Message cannot be null");
        this.code = code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return the diagnostic code, or null
     */
    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code == null ? message : "[" + code + "] " + message;
    }
}
