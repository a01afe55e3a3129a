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

public final class S3GatewayConstants {
    /** Request header carrying the caller's pre-shared API key. */
    public static final String API_KEY_HEADER = "x-api-key";

    /** Configuration file read when --config is not given. */
    public static final String DEFAULT_CONFIG_FILE = "config.json";

    /** jclouds provider used for accounts which do not name one. */
    public static final String DEFAULT_PROVIDER = "s3";

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_JETTY_MAX_THREADS = 200;

    /** Bound on backend socket and connect time, in milliseconds. */
    public static final long DEFAULT_BACKEND_TIMEOUT_MILLIS = 30 * 1000;

    private S3GatewayConstants() {
        throw new AssertionError("Cannot instantiate utility constructor");
    }
}
