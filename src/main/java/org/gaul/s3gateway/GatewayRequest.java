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

import javax.annotation.Nullable;

/** Structural view of an inbound request after validation. */
public final class GatewayRequest {
    private final GatewayOperation operation;
    private final String bucket;
    @Nullable
    private final String key;

    GatewayRequest(GatewayOperation operation, String bucket,
            @Nullable String key) {
        this.operation = requireNonNull(operation);
        this.bucket = requireNonNull(bucket);
        this.key = key;
    }

    public GatewayOperation getOperation() {
        return operation;
    }

    public String getBucket() {
        return bucket;
    }

    @Nullable
    public String getKey() {
        return key;
    }

    @Override
    public String toString() {
        return operation + " " + bucket + (key == null ? "" : "/" + key);
    }
}
