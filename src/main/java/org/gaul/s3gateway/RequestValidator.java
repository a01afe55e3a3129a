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

import static com.google.common.base.Preconditions.checkArgument;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

import javax.annotation.Nullable;

import com.google.common.base.Strings;

/**
 * Structural checks performed before any identity or routing work.  The
 * path is either /bucket or /bucket/key where key is the remainder of the
 * path and may itself contain slashes.
 */
public final class RequestValidator {
    public static final long DEFAULT_MAX_PAYLOAD_SIZE = 100L * 1024 * 1024;

    private final long maxPayloadSize;

    public RequestValidator() {
        this(DEFAULT_MAX_PAYLOAD_SIZE);
    }

    public RequestValidator(long maxPayloadSize) {
        checkArgument(maxPayloadSize > 0,
                "must be greater than zero, was: %s", maxPayloadSize);
        this.maxPayloadSize = maxPayloadSize;
    }

    public long getMaxPayloadSize() {
        return maxPayloadSize;
    }

    /**
     * @param contentLength declared content length, or -1 when the request
     *     carries none
     */
    public GatewayRequest validate(String method, @Nullable String path,
            long contentLength) throws GatewayException {
        boolean mutating = method.equals("PUT");
        if (mutating) {
            checkPayloadSize(contentLength);
        }

        String uri = Strings.nullToEmpty(path);
        if (uri.startsWith("/")) {
            uri = uri.substring(1);
        }
        String[] parts = uri.split("/", 2);
        String bucket = decode(parts[0]);
        if (bucket.isEmpty()) {
            throw new GatewayException(GatewayErrorCode.INVALID_REQUEST,
                    "Invalid path format");
        }
        String key = null;
        if (parts.length > 1 && !parts[1].isEmpty()) {
            key = decode(parts[1]);
        }

        GatewayOperation operation;
        if (method.equals("GET")) {
            operation = key == null ? GatewayOperation.LIST_OBJECTS :
                    GatewayOperation.GET_OBJECT;
        } else if (mutating && key != null) {
            operation = GatewayOperation.PUT_OBJECT;
        } else {
            throw new GatewayException(GatewayErrorCode.METHOD_NOT_ALLOWED,
                    "Method " + method + " not allowed on " +
                    (key == null ? "bucket" : "object"));
        }
        return new GatewayRequest(operation, bucket, key);
    }

    void checkPayloadSize(long contentLength) throws GatewayException {
        if (contentLength > maxPayloadSize) {
            throw new GatewayException(GatewayErrorCode.INVALID_REQUEST,
                    "File size " + contentLength +
                    " exceeds maximum allowed size of " + maxPayloadSize +
                    " bytes");
        }
    }

    private static String decode(String segment) throws GatewayException {
        try {
            // a literal plus is not a space in a path
            return URLDecoder.decode(segment.replace("+", "%2B"),
                    StandardCharsets.UTF_8);
        } catch (IllegalArgumentException iae) {
            throw new GatewayException(GatewayErrorCode.INVALID_REQUEST,
                    "Invalid path format", iae);
        }
    }
}
