/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.docmatch.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes trace lines to an SLF4J logger at INFO level. Used when verbose matching is requested.
 */
public class Slf4jDiagnosticSink implements DiagnosticSink {
    private static final Logger LOGGER = LoggerFactory.getLogger(Slf4jDiagnosticSink.class);

    private final Logger logger;

    public Slf4jDiagnosticSink() {
        this(LOGGER);
    }

    public Slf4jDiagnosticSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public boolean isEnabled() {
        return logger.isInfoEnabled();
    }

    @Override
    public void trace(String format, Object... arguments) {
        logger.info(format, arguments);
    }
}
