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

import org.assertj.core.api.Fail;
import org.junit.Test;

public final class IdentityStoreTest {
    private final IdentityStore store = new IdentityStore(List.of(
            new Identity("admin", Role.ADMIN, "admin-key",
                    List.of(Identity.ANY_BUCKET)),
            new Identity("reader", Role.READONLY, "reader-key",
                    List.of("bucket1"))));

    @Test
    public void testResolve() throws Exception {
        Identity identity = store.resolveIdentity("reader-key");
        assertThat(identity.getUsername()).isEqualTo("reader");
        assertThat(identity.getRole()).isEqualTo(Role.READONLY);
        assertThat(identity.getAllowedBuckets()).containsExactly("bucket1");
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    public void testCredentialFailuresAreIndistinguishable() {
        String unknown = failureMessage("no-such-key");
        String missing = failureMessage(null);
        String empty = failureMessage("");
        // a username is not a key
        String username = failureMessage("admin");
        assertThat(unknown).isEqualTo("Invalid API key");
        assertThat(missing).isEqualTo(unknown);
        assertThat(empty).isEqualTo(unknown);
        assertThat(username).isEqualTo(unknown);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateApiKey() {
        new IdentityStore(List.of(
                new Identity("one", Role.USER, "shared", List.of()),
                new Identity("two", Role.USER, "shared", List.of())));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateUsername() {
        new IdentityStore(List.of(
                new Identity("one", Role.USER, "key1", List.of()),
                new Identity("one", Role.USER, "key2", List.of())));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyApiKey() {
        new IdentityStore(List.of(
                new Identity("one", Role.USER, "", List.of())));
    }

    @Test
    public void testToStringOmitsApiKey() throws Exception {
        assertThat(store.resolveIdentity("admin-key").toString())
                .contains("admin")
                .doesNotContain("admin-key");
    }

    @Test
    public void testRoleNames() {
        assertThat(Role.fromString("admin")).isEqualTo(Role.ADMIN);
        assertThat(Role.fromString("user")).isEqualTo(Role.USER);
        assertThat(Role.fromString("readonly")).isEqualTo(Role.READONLY);
    }

    @Test
    public void testRoleNamesAreLowerCase() {
        for (String name : List.of("ADMIN", "Admin", "ReadOnly")) {
            try {
                Role.fromString(name);
                Fail.failBecauseExceptionWasNotThrown(
                        IllegalArgumentException.class);
            } catch (IllegalArgumentException iae) {
                assertThat(iae.getMessage()).contains(name);
            }
        }
    }

    private String failureMessage(String apiKey) {
        try {
            store.resolveIdentity(apiKey);
            Fail.failBecauseExceptionWasNotThrown(GatewayException.class);
            return null;
        } catch (GatewayException ge) {
            assertThat(ge.getError()).isEqualTo(GatewayErrorCode.UNAUTHORIZED);
            return ge.getMessage();
        }
    }
}
