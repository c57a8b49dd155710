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

/**
 * Receives messages. Used both for diagnostics and for discovery results.
 */
@FunctionalInterface
public interface MessageSink {

    /**
     * @param message the message
     * @return true to continue, false to ask the producer to stop
     */
    boolean onMessage(AssayMessage message);

    /**
     * @return a sink that discards every message
     */
    static MessageSink nullSink() {
        return message -> true;
    }
}
