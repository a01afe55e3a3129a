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

import org.assertj.core.api.Fail;
import org.junit.Test;

public final class RequestValidatorTest {
    private final RequestValidator validator = new RequestValidator(1024);

    @Test
    public void testListBucket() throws Exception {
        GatewayRequest request = validator.validate("GET", "/mybucket", -1);
        assertThat(request.getOperation())
                .isEqualTo(GatewayOperation.LIST_OBJECTS);
        assertThat(request.getBucket()).isEqualTo("mybucket");
        assertThat(request.getKey()).isNull();
    }

    @Test
    public void testTrailingSlashListsBucket() throws Exception {
        GatewayRequest request = validator.validate("GET", "/mybucket/", -1);
        assertThat(request.getOperation())
                .isEqualTo(GatewayOperation.LIST_OBJECTS);
        assertThat(request.getKey()).isNull();
    }

    @Test
    public void testKeyIsRemainderOfPath() throws Exception {
        GatewayRequest request = validator.validate("GET",
                "/mybucket/dir/sub/file.txt", -1);
        assertThat(request.getOperation())
                .isEqualTo(GatewayOperation.GET_OBJECT);
        assertThat(request.getBucket()).isEqualTo("mybucket");
        assertThat(request.getKey()).isEqualTo("dir/sub/file.txt");
    }

    @Test
    public void testPercentDecoding() throws Exception {
        GatewayRequest request = validator.validate("GET",
                "/mybucket/my%20file+1.txt", -1);
        assertThat(request.getKey()).isEqualTo("my file+1.txt");
    }

    @Test
    public void testPutObject() throws Exception {
        GatewayRequest request = validator.validate("PUT", "/mybucket/key",
                1024);
        assertThat(request.getOperation())
                .isEqualTo(GatewayOperation.PUT_OBJECT);
        assertThat(request.getOperation().isMutating()).isTrue();
    }

    @Test
    public void testEmptyPath() {
        assertInvalid("GET", "", -1, GatewayErrorCode.INVALID_REQUEST,
                "Invalid path format");
        assertInvalid("GET", "/", -1, GatewayErrorCode.INVALID_REQUEST,
                "Invalid path format");
        assertInvalid("GET", null, -1, GatewayErrorCode.INVALID_REQUEST,
                "Invalid path format");
    }

    @Test
    public void testMalformedEscape() {
        assertInvalid("GET", "/mybucket/bad%zzkey", -1,
                GatewayErrorCode.INVALID_REQUEST, "Invalid path format");
    }

    @Test
    public void testPayloadTooLarge() {
        assertInvalid("PUT", "/mybucket/key", 1025,
                GatewayErrorCode.INVALID_REQUEST,
                "File size 1025 exceeds maximum allowed size of 1024 bytes");
    }

    @Test
    public void testPayloadSizeIgnoredForReads() throws Exception {
        validator.validate("GET", "/mybucket/key", 4096);
    }

    @Test
    public void testUnsupportedMethods() {
        assertInvalid("PUT", "/mybucket", 0,
                GatewayErrorCode.METHOD_NOT_ALLOWED,
                "Method PUT not allowed on bucket");
        assertInvalid("DELETE", "/mybucket/key", -1,
                GatewayErrorCode.METHOD_NOT_ALLOWED,
                "Method DELETE not allowed on object");
        assertInvalid("POST", "/mybucket", -1,
                GatewayErrorCode.METHOD_NOT_ALLOWED,
                "Method POST not allowed on bucket");
    }

    @Test
    public void testDefaultCeiling() {
        assertThat(new RequestValidator().getMaxPayloadSize())
                .isEqualTo(100L * 1024 * 1024);
    }

    private void assertInvalid(String method, String path,
            long contentLength, GatewayErrorCode code, String message) {
        try {
            validator.validate(method, path, contentLength);
            Fail.failBecauseExceptionWasNotThrown(GatewayException.class);
        } catch (GatewayException ge) {
            assertThat(ge.getError()).isEqualTo(code);
            assertThat(ge.getMessage()).isEqualTo(message);
        }
    }
}
