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

/** Per-request state, created at pipeline entry and never shared. */
final class RequestContext {
    private final String method;
    private final GatewayRequest request;
    @Nullable
    private Identity identity;

    RequestContext(String method, GatewayRequest request) {
        this.method = requireNonNull(method);
        this.request = requireNonNull(request);
    }

    GatewayOperation getOperation() {
        return request.getOperation();
    }

    String getBucket() {
        return request.getBucket();
    }

    @Nullable
    String getKey() {
        return request.getKey();
    }

    void setIdentity(Identity identity) {
        this.identity = requireNonNull(identity);
    }

    @Override
    public String toString() {
        return "user=" + (identity == null ? "-" : identity.getUsername()) +
                " method=" + method + " operation=" + getOperation() +
                " bucket=" + getBucket() +
                " key=" + (getKey() == null ? "-" : getKey());
    }
}
