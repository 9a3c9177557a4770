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

import java.util.List;

/**
 * Static shortcuts over {@link EqualityMatcher} configured with {@link MatchOptions#defaults()}.
 * The {@code verbose} flag routes the comparison trace to SLF4J.
 *
 * <pre>{@code
 * assertTrue(Equality.resultsEq(expected, collection.find().into(new ArrayList<>())));
 * assertTrue(Equality.anyEq(5, 6, false, (x, y) -> x.asNumber().intValue() < y.asNumber().intValue()));
 * }</pre>
 */
public final class Equality {

    private Equality() {
    }

    private static EqualityMatcher matcher(boolean verbose) {
        MatchOptions defaults = MatchOptions.defaults();
        return new EqualityMatcher(verbose == defaults.isVerbose() ? defaults : defaults.withVerbose(verbose));
    }

    public static boolean anyEq(Object left, Object right) {
        return anyEq(left, right, false);
    }

    public static boolean anyEq(Object left, Object right, boolean verbose) {
        return anyEq(left, right, verbose, null);
    }

    public static boolean anyEq(Object left, Object right, boolean verbose, ScalarComparator valueComparator) {
        return matcher(verbose).anyEq(left, right, valueComparator);
    }

    public static boolean documentEq(Object left, Object right) {
        return documentEq(left, right, false);
    }

    public static boolean documentEq(Object left, Object right, boolean verbose) {
        return documentEq(left, right, verbose, null);
    }

    public static boolean documentEq(Object left, Object right, boolean verbose, ScalarComparator valueComparator) {
        return matcher(verbose).documentEq(left, right, valueComparator);
    }

    public static boolean customDocumentEq(DocumentEqArgs args) {
        return args.evaluate(matcher(args.isVerbose()));
    }

    public static boolean arrayEq(Object left, Object right) {
        return arrayEq(left, right, false);
    }

    public static boolean arrayEq(Object left, Object right, boolean verbose) {
        return arrayEq(left, right, verbose, null);
    }

    public static boolean arrayEq(Object left, Object right, boolean verbose, ScalarComparator valueComparator) {
        return matcher(verbose).arrayEq(left, right, valueComparator);
    }

    public static boolean resultsEq(List<?> left, List<?> right) {
        return resultsEq(left, right, false);
    }

    public static boolean resultsEq(List<?> left, List<?> right, boolean verbose) {
        return matcher(verbose).resultsEq(left, right);
    }

    public static boolean orderedArrayEq(List<?> left, List<?> right) {
        return orderedArrayEq(left, right, false);
    }

    public static boolean orderedArrayEq(List<?> left, List<?> right, boolean verbose) {
        return matcher(verbose).orderedArrayEq(left, right);
    }

    public static <T> List<T> arrayShallowCopy(List<T> value) {
        return matcher(false).arrayShallowCopy(value);
    }
}
