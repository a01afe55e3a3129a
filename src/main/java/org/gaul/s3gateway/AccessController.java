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

/** Stateless bucket visibility and write-permission checks. */
public final class AccessController {
    static final String WRITE_PERMISSION_DENIED = "Write permission denied";

    private AccessController() {
        throw new AssertionError("intentionally not implemented");
    }

    /**
     * Visibility is checked first; write permission only for mutating
     * operations.
     */
    public static void authorize(Identity identity, String bucket,
            GatewayOperation operation) throws GatewayException {
        if (!isBucketVisible(identity, bucket)) {
            throw new GatewayException(GatewayErrorCode.UNAUTHORIZED,
                    "Not allowed to access bucket: " + bucket);
        }
        if (operation.isMutating() && !canWrite(identity)) {
            throw new GatewayException(GatewayErrorCode.UNAUTHORIZED,
                    WRITE_PERMISSION_DENIED);
        }
    }

    public static boolean isBucketVisible(Identity identity, String bucket) {
        return identity.getAllowedBuckets().contains(Identity.ANY_BUCKET) ||
                identity.getAllowedBuckets().contains(bucket);
    }

    public static boolean canWrite(Identity identity) {
        return identity.getRole().canWrite();
    }
}
