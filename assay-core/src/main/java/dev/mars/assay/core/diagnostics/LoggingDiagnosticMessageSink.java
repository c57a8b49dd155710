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
package dev.mars.assay.core.diagnostics;

import dev.mars.assay.api.messages.AssayMessage;
import dev.mars.assay.api.messages.DiagnosticMessage;
import dev.mars.assay.api.messages.MessageSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Diagnostic sink that writes every diagnostic to the log. Other message types are
 * logged at debug level and otherwise ignored.
 */
public class LoggingDiagnosticMessageSink implements MessageSink {
    private static final Logger logger = LoggerFactory.getLogger(LoggingDiagnosticMessageSink.class);

    @Override
    public boolean onMessage(AssayMessage message) {
        if (message instanceof DiagnosticMessage) {
            logger.info("{}", message);
        } else {
            logger.debug("Ignoring non-diagnostic message: {}", message);
        }
        return true;
    }
}
