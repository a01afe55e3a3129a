/*
 * Copyright 2014-2025 Andrew Gaul <andrew@gaul.org>
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.gaul.s3gateway;

import static java.util.Objects.requireNonNull;

import javax.servlet.http.HttpServletResponse;

import com.google.common.base.CaseFormat;

/**
 * Failure kinds surfaced to gateway callers.  Authorization denials share
 * UNAUTHORIZED with credential failures so that callers cannot enumerate
 * keys, roles or buckets.
 */
public enum GatewayErrorCode {
    UNAUTHORIZED(HttpServletResponse.SC_UNAUTHORIZED, "Unauthorized"),
    INVALID_REQUEST(HttpServletResponse.SC_BAD_REQUEST, "Invalid request"),
    METHOD_NOT_ALLOWED(HttpServletResponse.SC_METHOD_NOT_ALLOWED,
            "Method Not Allowed"),
    BUCKET_NOT_FOUND(HttpServletResponse.SC_NOT_FOUND,
            "The specified bucket does not exist"),
    OBJECT_NOT_FOUND(HttpServletResponse.SC_NOT_FOUND,
            "The specified key does not exist"),
    BACKEND_FAULT(HttpServletResponse.SC_INTERNAL_SERVER_ERROR,
            "Storage backend error"),
    INTERNAL_FAULT(HttpServletResponse.SC_INTERNAL_SERVER_ERROR,
            "Internal server error");

    private final String errorCode;
    private final int httpStatusCode;
    private final String message;

    GatewayErrorCode(int httpStatusCode, String message) {
        this.errorCode = CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.UPPER_CAMEL,
                name());
        this.httpStatusCode = httpStatusCode;
        this.message = requireNonNull(message);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public int getHttpStatusCode() {
        return httpStatusCode;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getHttpStatusCode() + " " + getErrorCode() + " " + getMessage();
    }
}
