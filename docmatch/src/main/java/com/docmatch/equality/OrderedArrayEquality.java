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
 * Positional comparison of two arrays with the built-in scalar equality.
 */
final class OrderedArrayEquality {

    private OrderedArrayEquality() {
    }

    static boolean orderedArrayEq(MatchContext context, DocValue left, DocValue right) {
        MatchContext defaultEquality = context.withoutComparator();
        if (left.kind() != ValueKind.SEQUENCE || right.kind() != ValueKind.SEQUENCE) {
            defaultEquality.trace("orderedArrayEq:  arguments must be arrays {}, {}", left, right);
            return false;
        }

        DocValue.Sequence al = (DocValue.Sequence) left;
        DocValue.Sequence ar = (DocValue.Sequence) right;
        if (al.size() != ar.size()) {
            defaultEquality.trace("orderedArrayEq:  array lengths do not match {}, {}", al, ar);
            return false;
        }

        for (int i = 0; i < al.size(); i++) {
            if (!ValueEquality.anyEq(defaultEquality, al.get(i), ar.get(i))) {
                return false;
            }
        }
        return true;
    }
}
