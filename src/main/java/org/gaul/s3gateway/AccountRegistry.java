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
import java.util.HashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * Maps bucket names to the backend account that owns them.  Built once at
 * startup and read without locking afterwards.  A bucket claimed by more
 * than one account is a configuration error and rejected here.
 */
public final class AccountRegistry {
    private final Map<String, StorageAccount> accounts;
    private final Map<String, String> bucketToAccount;
    private final Map<String, BlobStoreClient> clients;

    public AccountRegistry(Collection<StorageAccount> accounts,
            Map<String, BlobStoreClient> clients) {
        var accountsBuilder = ImmutableMap.<String, StorageAccount>builder();
        Map<String, String> owners = new HashMap<>();
        for (StorageAccount account : accounts) {
            for (String bucket : account.getBuckets()) {
                String previous = owners.putIfAbsent(bucket, account.getId());
                checkArgument(previous == null,
                        "bucket %s claimed by both accounts %s and %s",
                        bucket, previous, account.getId());
            }
            accountsBuilder.put(account.getId(), account);
        }
        this.accounts = accountsBuilder.buildOrThrow();
        this.bucketToAccount = ImmutableMap.copyOf(owners);
        this.clients = ImmutableMap.copyOf(clients);
        for (String accountId : this.clients.keySet()) {
            checkArgument(this.accounts.containsKey(accountId),
                    "client registered for unknown account: %s", accountId);
        }
    }

    /** Returns the identifier and definition of the account owning bucket. */
    public Map.Entry<String, StorageAccount> resolveAccount(String bucket)
            throws GatewayException {
        String accountId = bucketToAccount.get(bucket);
        if (accountId == null) {
            throw new GatewayException(GatewayErrorCode.BUCKET_NOT_FOUND,
                    "Bucket not found: " + bucket);
        }
        return Map.entry(accountId, accounts.get(accountId));
    }

    /** Returns the backend client bound to the account owning bucket. */
    public BlobStoreClient locateClient(String bucket)
            throws GatewayException {
        String accountId = resolveAccount(bucket).getKey();
        BlobStoreClient client = clients.get(accountId);
        if (client == null) {
            throw new GatewayException(GatewayErrorCode.INTERNAL_FAULT,
                    "Storage client not found for account " + accountId);
        }
        return client;
    }
}
