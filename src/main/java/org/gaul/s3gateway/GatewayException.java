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

@SuppressWarnings("serial")
public final class GatewayException extends Exception {
    private final GatewayErrorCode error;

    GatewayException(GatewayErrorCode error) {
        this(error, error.getMessage(), (Throwable) null);
    }

    GatewayException(GatewayErrorCode error, String message) {
        this(error, message, (Throwable) null);
    }

    GatewayException(GatewayErrorCode error, Throwable cause) {
        this(error, error.getMessage(), cause);
    }

    GatewayException(GatewayErrorCode error, String message,
            Throwable cause) {
        super(requireNonNull(message), cause);
        this.error = requireNonNull(error);
    }

    public GatewayErrorCode getError() {
        return error;
    }
}
