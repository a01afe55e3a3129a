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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.assertj.core.api.Fail;
import org.junit.Before;
import org.junit.Test;

public final class AccountRegistryTest {
    private StorageAccount accountOne;
    private StorageAccount accountTwo;
    private BlobStoreClient clientOne;
    private BlobStoreClient clientTwo;

    @Before
    public void setUp() {
        accountOne = new StorageAccount("account1", "s3",
                "http://127.0.0.1:9000", "us-east-1", "access1", "secret1",
                List.of("bucket1", "bucket2"));
        accountTwo = new StorageAccount("account2", "s3", null, null,
                "access2", "secret2", List.of("bucket3"));
        clientOne = new BlobStoreClient(TestUtils.newTransientBlobStore());
        clientTwo = new BlobStoreClient(TestUtils.newTransientBlobStore());
    }

    @Test
    public void testResolveAccount() throws Exception {
        var registry = new AccountRegistry(List.of(accountOne, accountTwo),
                Map.of("account1", clientOne, "account2", clientTwo));

        Map.Entry<String, StorageAccount> entry =
                registry.resolveAccount("bucket2");
        assertThat(entry.getKey()).isEqualTo("account1");
        assertThat(entry.getValue()).isSameAs(accountOne);
        assertThat(registry.resolveAccount("bucket3").getKey())
                .isEqualTo("account2");

        assertThat(registry.locateClient("bucket1")).isSameAs(clientOne);
        assertThat(registry.locateClient("bucket3")).isSameAs(clientTwo);
    }

    @Test
    public void testResolutionIsStable() throws Exception {
        var registry = new AccountRegistry(List.of(accountOne, accountTwo),
                Map.of("account1", clientOne, "account2", clientTwo));
        for (int i = 0; i < 10; ++i) {
            assertThat(registry.resolveAccount("bucket1").getKey())
                    .isEqualTo("account1");
        }
    }

    @Test
    public void testUnknownBucket() {
        var registry = new AccountRegistry(List.of(accountOne),
                Map.of("account1", clientOne));
        try {
            registry.resolveAccount("bucket3");
            Fail.failBecauseExceptionWasNotThrown(GatewayException.class);
        } catch (GatewayException ge) {
            assertThat(ge.getError())
                    .isEqualTo(GatewayErrorCode.BUCKET_NOT_FOUND);
            assertThat(ge.getMessage()).isEqualTo("Bucket not found: bucket3");
        }
    }

    @Test
    public void testMissingClient() {
        var registry = new AccountRegistry(List.of(accountOne, accountTwo),
                Map.of("account1", clientOne));
        try {
            registry.locateClient("bucket3");
            Fail.failBecauseExceptionWasNotThrown(GatewayException.class);
        } catch (GatewayException ge) {
            assertThat(ge.getError())
                    .isEqualTo(GatewayErrorCode.INTERNAL_FAULT);
            assertThat(ge.getMessage()).isEqualTo(
                    "Storage client not found for account account2");
        }
    }

    @Test
    public void testDuplicateBucketRejected() {
        var duplicate = new StorageAccount("account3", "s3", null, null,
                "access3", "secret3", List.of("bucket1"));
        try {
            new AccountRegistry(List.of(accountOne, duplicate), Map.of());
            Fail.failBecauseExceptionWasNotThrown(
                    IllegalArgumentException.class);
        } catch (IllegalArgumentException iae) {
            assertThat(iae.getMessage()).contains("bucket1")
                    .contains("account1").contains("account3");
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testClientForUnknownAccount() {
        new AccountRegistry(List.of(accountOne),
                Map.of("account9", clientOne));
    }

    @Test
    public void testToStringOmitsSecret() {
        assertThat(accountOne.toString()).contains("account1")
                .doesNotContain("secret1");
    }
}
