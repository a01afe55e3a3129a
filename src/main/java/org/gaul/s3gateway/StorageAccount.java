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

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableSet;

/** A backend storage account owning a set of buckets. */
public final class StorageAccount {
    private final String id;
    private final String provider;
    @Nullable
    private final String endpoint;
    @Nullable
    private final String region;
    private final String identity;
    private final String credential;
    private final Set<String> buckets;

    public StorageAccount(String id, String provider,
            @Nullable String endpoint, @Nullable String region,
            String identity, String credential, Collection<String> buckets) {
        this.id = requireNonNull(id);
        this.provider = requireNonNull(provider);
        this.endpoint = endpoint;
        this.region = region;
        this.identity = requireNonNull(identity);
        this.credential = requireNonNull(credential);
        this.buckets = ImmutableSet.copyOf(buckets);
    }

    public String getId() {
        return id;
    }

    public String getProvider() {
        return provider;
    }

    @Nullable
    public String getEndpoint() {
        return endpoint;
    }

    @Nullable
    public String getRegion() {
        return region;
    }

    public String getIdentity() {
        return identity;
    }

    String getCredential() {
        return credential;
    }

    public Set<String> getBuckets() {
        return buckets;
    }

    @Override
    public String toString() {
        return "StorageAccount{id=" + id + ", provider=" + provider +
                ", endpoint=" + endpoint + ", region=" + region +
                ", buckets=" + buckets + "}";
    }
}
