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
 * Compares two documents over their full field sets. Both documents must carry exactly the
 * same field names; the identifier field has to be present on both sides but its values are
 * never compared. Field order is irrelevant.
 */
final class DocumentEquality {

    private DocumentEquality() {
    }

    static boolean documentEq(MatchContext context, DocValue left, DocValue right) {
        if (left.kind() != ValueKind.STRUCTURED) {
            context.trace("documentEq:  dl is not an object {}", left);
            return false;
        }
        if (right.kind() != ValueKind.STRUCTURED) {
            context.trace("documentEq:  dr is not an object {}", right);
            return false;
        }

        DocValue.Structured dl = (DocValue.Structured) left;
        DocValue.Structured dr = (DocValue.Structured) right;

        for (String fieldName : dl.fieldNames()) {
            if (!dr.has(fieldName)) {
                context.trace("documentEq: dr doesn't have property {}", fieldName);
                return false;
            }
            if (fieldName.equals(context.identifierField())) {
                continue;
            }
            if (!ValueEquality.anyEq(context, dl.get(fieldName), dr.get(fieldName))) {
                return false;
            }
        }

        // Everything dl has was compared above, so only extra fields in dr remain.
        for (String fieldName : dr.fieldNames()) {
            if (!dl.has(fieldName)) {
                context.trace("documentEq: dl is missing property {}", fieldName);
                return false;
            }
        }

        context.trace("documentEq: these are equal: {} == {}", dl, dr);
        return true;
    }
}
