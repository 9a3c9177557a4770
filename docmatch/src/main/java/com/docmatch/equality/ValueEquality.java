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

/**
 * Entry point of the recursive comparison: dispatches on the shape of the left value.
 * <ul>
 *     <li>an array only equals an array, compared as a multiset by {@link ArrayEquality}</li>
 *     <li>a document only equals a document, compared by {@link DocumentEquality}</li>
 *     <li>a scalar only equals a scalar, compared by the context's comparator</li>
 * </ul>
 */
final class ValueEquality {

    private ValueEquality() {
    }

    static boolean anyEq(MatchContext context, DocValue left, DocValue right) {
        boolean equal = switch (left.kind()) {
            case SEQUENCE -> sequenceEq(context, left, right);
            case STRUCTURED -> structuredEq(context, left, right);
            case SCALAR -> scalarEq(context, left, right);
        };
        if (equal) {
            context.trace("anyEq: these are equal: {} == {}", left, right);
        }
        return equal;
    }

    private static boolean sequenceEq(MatchContext context, DocValue left, DocValue right) {
        if (right.kind() != ValueKind.SEQUENCE) {
            context.trace("anyEq: ar is not an array {}", right);
            return false;
        }
        if (!ArrayEquality.arrayEq(context, left, right)) {
            context.trace("anyEq: arrayEq(al, ar): false; al={}, ar={}", left, right);
            return false;
        }
        return true;
    }

    private static boolean structuredEq(MatchContext context, DocValue left, DocValue right) {
        if (right.kind() != ValueKind.STRUCTURED) {
            context.trace("anyEq: ar is not an object {}", right);
            return false;
        }
        if (!DocumentEquality.documentEq(context, left, right)) {
            context.trace("anyEq: documentEq(al, ar): false; al={}, ar={}", left, right);
            return false;
        }
        return true;
    }

    private static boolean scalarEq(MatchContext context, DocValue left, DocValue right) {
        if (right.kind() != ValueKind.SCALAR || !context.scalarEquals(left, right)) {
            context.trace("anyEq: (al != ar): false; al={}, ar={}", left, right);
            return false;
        }
        return true;
    }
}
