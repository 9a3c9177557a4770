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

import com.google.common.collect.ImmutableList;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps every trace line in memory, e.g. to attach the reasoning behind a failed match to an
 * assertion message.
 */
public class RecordingDiagnosticSink implements DiagnosticSink {
    private final List<String> messages = new ArrayList<>();

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public synchronized void trace(String format, Object... arguments) {
        messages.add(MessageFormatter.arrayFormat(format, arguments).getMessage());
    }

    public synchronized List<String> messages() {
        return ImmutableList.copyOf(messages);
    }

    public synchronized void clear() {
        messages.clear();
    }

    @Override
    public synchronized String toString() {
        return String.join(System.lineSeparator(), messages);
    }
}
