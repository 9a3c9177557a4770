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
 * Named arguments of {@link Equality#customDocumentEq(DocumentEqArgs)}.
 */
public class DocumentEqArgs {
    private Object left;
    private Object right;
    private boolean verbose;
    private ScalarComparator valueComparator;

    public DocumentEqArgs left(Object left) {
        this.left = left;
        return this;
    }

    public DocumentEqArgs right(Object right) {
        this.right = right;
        return this;
    }

    public DocumentEqArgs verbose() {
        this.verbose = true;
        return this;
    }

    public DocumentEqArgs valueComparator(ScalarComparator valueComparator) {
        this.valueComparator = valueComparator;
        return this;
    }

    boolean evaluate(EqualityMatcher matcher) {
        return matcher.documentEq(left, right, valueComparator);
    }

    boolean isVerbose() {
        return verbose;
    }

    public static class Builder {
        private Builder() {
        }

        public static DocumentEqArgs left(Object left) {
            return new DocumentEqArgs().left(left);
        }

        public static DocumentEqArgs right(Object right) {
            return new DocumentEqArgs().right(right);
        }

        public static DocumentEqArgs verbose() {
            return new DocumentEqArgs().verbose();
        }

        public static DocumentEqArgs valueComparator(ScalarComparator valueComparator) {
            return new DocumentEqArgs().valueComparator(valueComparator);
        }
    }
}
