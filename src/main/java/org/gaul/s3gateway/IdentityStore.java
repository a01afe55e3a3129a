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

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

/** Immutable table of caller identities keyed by API key. */
public final class IdentityStore {
    /**
     * Returned for every credential failure so callers cannot tell a
     * missing key from an unknown one.
     */
    static final String INVALID_API_KEY = "Invalid API key";

    private final Map<String, Identity> identities;

    public IdentityStore(Collection<Identity> identities) {
        var builder = ImmutableMap.<String, Identity>builder();
        Set<String> usernames = new HashSet<>();
        Set<String> apiKeys = new HashSet<>();
        for (Identity identity : identities) {
            checkArgument(usernames.add(identity.getUsername()),
                    "duplicate username: %s", identity.getUsername());
            checkArgument(!identity.getApiKey().isEmpty(),
                    "empty API key for user: %s", identity.getUsername());
            checkArgument(apiKeys.add(identity.getApiKey()),
                    "API key of user %s is already assigned",
                    identity.getUsername());
            builder.put(identity.getApiKey(), identity);
        }
        this.identities = builder.buildOrThrow();
    }

    public Identity resolveIdentity(@Nullable String apiKey)
            throws GatewayException {
        Identity identity = null;
        if (!Strings.isNullOrEmpty(apiKey)) {
            identity = identities.get(apiKey);
        }
        if (identity == null) {
            throw new GatewayException(GatewayErrorCode.UNAUTHORIZED,
                    INVALID_API_KEY);
        }
        return identity;
    }

    public int size() {
        return identities.size();
    }
}
