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

/**
 * Receives trace lines explaining why two values compared equal or not. A sink only ever
 * observes a comparison; what it does with the lines has no effect on the outcome.
 * <p>
 * Messages use SLF4J style {@code {}} placeholders. Arguments are rendered lazily, callers
 * may pass values whose {@code toString} is expensive.
 */
public interface DiagnosticSink {

    /**
     * Discards everything.
     */
    DiagnosticSink NOOP = new DiagnosticSink() {
        @Override
        public boolean isEnabled() {
            return false;
        }

        @Override
        public void trace(String format, Object... arguments) {
        }
    };

    boolean isEnabled();

    void trace(String format, Object... arguments);
}
