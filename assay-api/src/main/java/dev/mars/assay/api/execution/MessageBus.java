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
package dev.mars.assay.api.execution;

import dev.mars.assay.api.messages.AssayMessage;

/**
 * Transport for execution messages. Ordering, delivery and cross-process marshaling are
 * the implementation's concern.
 */
public interface MessageBus {

    /**
     * @return true to continue, false when the receiver asked to stop
     */
    boolean queueMessage(AssayMessage message);
}
