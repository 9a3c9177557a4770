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

import java.util.BitSet;

/**
 * Compares two arrays as multisets: same length, and every left element paired with a
 * distinct equal right element, in any order.
 * <p>
 * Pairing is greedy first-fit. Each left element, in order, takes the lowest-indexed
 * unconsumed right element equal to it, and a pairing is never revisited. This finds a
 * pairing whenever element equality is an equivalence relation, which holds for the
 * built-in comparators. With a comparator that is not one (e.g. {@code <}) the outcome can
 * depend on element order: a valid pairing may exist that the greedy pass does not find.
 * The cost is O(n^2) element comparisons, each of them recursive.
 */
final class ArrayEquality {

    private ArrayEquality() {
    }

    static boolean arrayEq(MatchContext context, DocValue left, DocValue right) {
        if (left.kind() != ValueKind.SEQUENCE) {
            context.trace("arrayEq: al is not an array: {}", left);
            return false;
        }
        if (right.kind() != ValueKind.SEQUENCE) {
            context.trace("arrayEq: ar is not an array: {}", right);
            return false;
        }

        DocValue.Sequence al = (DocValue.Sequence) left;
        DocValue.Sequence ar = (DocValue.Sequence) right;

        if (al.size() != ar.size()) {
            context.trace("arrayEq:  array lengths do not match {}, {}", al, ar);
            return false;
        }

        // Indexes of ar already paired, [1, 1] must not match [1, 2].
        BitSet matched = new BitSet(ar.size());
        for (int leftIndex = 0; leftIndex < al.size(); leftIndex++) {
            DocValue leftElement = al.get(leftIndex);
            int found = -1;
            for (int i = matched.nextClearBit(0); i < ar.size(); i = matched.nextClearBit(i + 1)) {
                if (ValueEquality.anyEq(context, leftElement, ar.get(i))) {
                    found = i;
                    break;
                }
            }
            if (found < 0) {
                context.trace("arrayEq: no match for element {} at index {}", leftElement, leftIndex);
                return false;
            }
            matched.set(found);
        }
        return true;
    }
}
