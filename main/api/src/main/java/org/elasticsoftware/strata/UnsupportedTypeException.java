/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.strata;

public class UnsupportedTypeException extends StrataException {
    private final String kind;
    private final String typeName;

    public UnsupportedTypeException(String kind, String typeName) {
        super("Unsupported " + kind + " type " + typeName, null, null);
        this.kind = kind;
        this.typeName = typeName;
    }

    public String getKind() {
        return kind;
    }

    public String getTypeName() {
        return typeName;
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.UNSUPPORTED_TYPE;
    }
}
