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

package com.docmatch.store;

import com.docmatch.common.DocMatchException;
import org.bson.BsonDocument;

/**
 * A command rejected by the database, carrying the server's numeric error code and message.
 */
public class StoreCommandException extends DocMatchException {
    private final int code;
    private final String codeName;
    private final String errmsg;
    private final BsonDocument response;

    public StoreCommandException(int code, String codeName, String errmsg, BsonDocument response) {
        this(code, codeName, errmsg, response, null);
    }

    public StoreCommandException(int code, String codeName, String errmsg, BsonDocument response, Throwable cause) {
        super(String.format("Command failed with error %d (%s): '%s'", code, codeName, errmsg), cause);
        this.code = code;
        this.codeName = codeName;
        this.errmsg = errmsg;
        this.response = response;
    }

    public int getCode() {
        return code;
    }

    public String getCodeName() {
        return codeName;
    }

    public String getErrmsg() {
        return errmsg;
    }

    /**
     * Raw server response, e.g. {@code {ok: 0, code: 40324, codeName: "Location40324", errmsg: "..."}}.
     */
    public BsonDocument getResponse() {
        return response;
    }
}
