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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;

/**
 * Compares two result sets as multisets of documents, ignoring order and identifier values.
 * Only the built-in scalar equality is used, a custom comparator is never applied here.
 * <p>
 * The right-hand side is copied into a pool of unmatched documents. Every left document
 * removes the first pooled document equal to it, the same greedy first-fit pairing as
 * {@link ArrayEquality}. The caller's lists are never modified.
 */
final class ResultSetEquality {

    private ResultSetEquality() {
    }

    static boolean resultsEq(MatchContext context, DocValue rl, DocValue rr) {
        MatchContext defaultEquality = context.withoutComparator();

        List<DocValue> left = arrayShallowCopy(rl);
        List<DocValue> right = arrayShallowCopy(rr);

        if (left.size() != right.size()) {
            defaultEquality.trace("resultsEq:  array lengths do not match {}, {}", rl, rr);
            return false;
        }

        LinkedList<DocValue> remaining = new LinkedList<>(right);
        for (int i = 0; i < left.size(); i++) {
            DocValue target = left.get(i);
            boolean found = false;

            Iterator<DocValue> candidates = remaining.iterator();
            while (candidates.hasNext()) {
                if (ValueEquality.anyEq(defaultEquality, target, candidates.next())) {
                    candidates.remove();
                    found = true;
                    break;
                }
            }

            if (!found) {
                defaultEquality.trace("resultsEq: search target missing index {} ({})", i, target);
                return false;
            }
        }

        ensureExhausted(remaining);
        return true;
    }

    /**
     * Makes a shallow copy of an array: a new list holding the same elements.
     *
     * @param value the array to copy
     * @return a mutable copy
     * @throws IllegalArgumentException if the value is not an array
     */
    static List<DocValue> arrayShallowCopy(DocValue value) {
        if (value.kind() != ValueKind.SEQUENCE) {
            throw new IllegalArgumentException("arrayShallowCopy: argument is not an array");
        }
        return new ArrayList<>(((DocValue.Sequence) value).elements());
    }

    static void ensureExhausted(List<DocValue> remaining) {
        if (!remaining.isEmpty()) {
            throw new MatchingInvariantException(
                    "resultsEq: " + remaining.size() + " unmatched documents left after every document found a match: " + remaining
            );
        }
    }
}
