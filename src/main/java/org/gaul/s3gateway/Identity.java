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

import java.util.Collection;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

/** A caller recognized by API key. */
public final class Identity {
    /** Bucket pattern which matches every bucket. */
    public static final String ANY_BUCKET = "*";

    private final String username;
    private final Role role;
    private final String apiKey;
    private final Set<String> allowedBuckets;

    public Identity(String username, Role role, String apiKey,
            Collection<String> allowedBuckets) {
        this.username = requireNonNull(username);
        this.role = requireNonNull(role);
        this.apiKey = requireNonNull(apiKey);
        this.allowedBuckets = ImmutableSet.copyOf(allowedBuckets);
    }

    public String getUsername() {
        return username;
    }

    public Role getRole() {
        return role;
    }

    String getApiKey() {
        return apiKey;
    }

    public Set<String> getAllowedBuckets() {
        return allowedBuckets;
    }

    // never include the API key
    @Override
    public String toString() {
        return "Identity{username=" + username + ", role=" + role +
                ", allowedBuckets=" + allowedBuckets + "}";
    }
}
