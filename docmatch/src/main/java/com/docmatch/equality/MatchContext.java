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

package com.docmatch.equality;

import com.docmatch.diagnostics.DiagnosticSink;

import javax.annotation.Nullable;

/**
 * Parameters threaded through one recursive comparison.
 *
 * @param identifierField field skipped when document values are compared
 * @param sink            receives trace lines
 * @param comparator      scalar comparator, {@code null} selects {@link ScalarComparators#NATIVE}
 */
record MatchContext(String identifierField, DiagnosticSink sink, @Nullable ScalarComparator comparator) {

    static MatchContext of(MatchOptions options, @Nullable ScalarComparator comparator) {
        return new MatchContext(options.getIdentifierField(), options.getDiagnosticSink(), comparator);
    }

    MatchContext withoutComparator() {
        if (comparator == null) {
            return this;
        }
        return new MatchContext(identifierField, sink, null);
    }

    boolean scalarEquals(DocValue left, DocValue right) {
        ScalarComparator effective = comparator == null ? ScalarComparators.NATIVE : comparator;
        return effective.test(left.bson(), right.bson());
    }

    void trace(String format, Object... arguments) {
        if (sink.isEnabled()) {
            sink.trace(format, arguments);
        }
    }
}
