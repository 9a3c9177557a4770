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

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Structural equality predicates bound to a set of {@link MatchOptions}.
 * <p>
 * Every argument may be a {@link org.bson.BsonValue}, a {@link org.bson.Document}, a
 * {@link java.util.Map}, a {@link java.util.Collection}, an array or a boxed primitive; see
 * {@link DocValue#of(Object)}. None of the predicates throws for mismatching values, a type
 * mismatch is simply a {@code false} result.
 */
public class EqualityMatcher {
    private final MatchOptions options;

    public EqualityMatcher(MatchOptions options) {
        this.options = options;
    }

    public MatchOptions getOptions() {
        return options;
    }

    /**
     * Compares any two values. Arrays compare as multisets, documents ignore field order and
     * the identifier field's value.
     */
    public boolean anyEq(Object left, Object right) {
        return anyEq(left, right, null);
    }

    /**
     * Same as {@link #anyEq(Object, Object)}, scalars compared with the given comparator.
     */
    public boolean anyEq(Object left, Object right, @Nullable ScalarComparator valueComparator) {
        return ValueEquality.anyEq(context(valueComparator), DocValue.of(left), DocValue.of(right));
    }

    public boolean documentEq(Object left, Object right) {
        return documentEq(left, right, null);
    }

    /**
     * Compares two documents. Either argument not being a document yields {@code false}.
     */
    public boolean documentEq(Object left, Object right, @Nullable ScalarComparator valueComparator) {
        return DocumentEquality.documentEq(context(valueComparator), DocValue.of(left), DocValue.of(right));
    }

    public boolean arrayEq(Object left, Object right) {
        return arrayEq(left, right, null);
    }

    /**
     * Compares two arrays regardless of element order. Either argument not being an array
     * yields {@code false}.
     */
    public boolean arrayEq(Object left, Object right, @Nullable ScalarComparator valueComparator) {
        return ArrayEquality.arrayEq(context(valueComparator), DocValue.of(left), DocValue.of(right));
    }

    /**
     * Compares two result sets regardless of order and identifier values, with the built-in
     * scalar equality.
     *
     * @throws IllegalArgumentException   if an argument is not an array
     * @throws MatchingInvariantException if the matching routine ends up in an inconsistent state
     */
    public boolean resultsEq(Object left, Object right) {
        return ResultSetEquality.resultsEq(context(null), DocValue.of(left), DocValue.of(right));
    }

    /**
     * Compares two arrays position by position with the built-in scalar equality.
     */
    public boolean orderedArrayEq(Object left, Object right) {
        return OrderedArrayEquality.orderedArrayEq(context(null), DocValue.of(left), DocValue.of(right));
    }

    /**
     * Returns a new list holding the same elements as the given array.
     *
     * @throws IllegalArgumentException if the value is not a list
     */
    @SuppressWarnings("unchecked")
    public <T> List<T> arrayShallowCopy(Object value) {
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("arrayShallowCopy: argument is not an array");
        }
        return new ArrayList<>((List<T>) list);
    }

    private MatchContext context(@Nullable ScalarComparator valueComparator) {
        return MatchContext.of(options, valueComparator);
    }
}
