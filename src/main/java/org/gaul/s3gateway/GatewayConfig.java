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

import static com.google.common.base.Preconditions.checkArgument;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON configuration document, read once at startup.  Keys use snake_case,
 * for example:
 *
 * <pre>
 * {
 *   "accounts": {"account1": {"endpoint_url": "http://localhost:9000",
 *       "region": "us-east-1", "access_key_id": "...",
 *       "secret_access_key": "...", "buckets": ["bucket1"]}},
 *   "users": {"admin": {"api_key": "...", "role": "admin",
 *       "allowed_buckets": ["*"]}},
 *   "server": {"host": "0.0.0.0", "port": 8080}
 * }
 * </pre>
 */
public final class GatewayConfig {
    private static final Logger logger = LoggerFactory.getLogger(
            GatewayConfig.class);

    @JsonProperty("accounts")
    private Map<String, AccountConfig> accounts = new LinkedHashMap<>();
    @JsonProperty("users")
    private Map<String, UserConfig> users = new LinkedHashMap<>();
    @JsonProperty("server")
    private ServerConfig server;
    @JsonProperty("max_file_size")
    private long maxFileSize = RequestValidator.DEFAULT_MAX_PAYLOAD_SIZE;
    @JsonProperty("rate_limit")
    private RateLimitConfig rateLimit = new RateLimitConfig();
    @JsonProperty("backend_timeout_millis")
    private long backendTimeoutMillis =
            S3GatewayConstants.DEFAULT_BACKEND_TIMEOUT_MILLIS;

    public static GatewayConfig load(Path path) throws IOException {
        logger.info("Loading configuration from {}", path);
        GatewayConfig config;
        try (InputStream is = Files.newInputStream(path)) {
            config = parse(is);
        }
        logger.info("Successfully loaded configuration with {} accounts" +
                " and {} users", config.accounts.size(), config.users.size());
        return config;
    }

    static GatewayConfig parse(InputStream is) throws IOException {
        GatewayConfig config = new ObjectMapper().readValue(is,
                GatewayConfig.class);
        config.validate();
        return config;
    }

    private void validate() {
        checkArgument(server != null,
                "Configuration must contain: server");
        checkArgument(server.port != null,
                "Configuration must contain: server.port");
        checkArgument(server.port >= 0 && server.port <= 65535,
                "server port out of range: %s", server.port);
        checkArgument(maxFileSize > 0,
                "max_file_size must be greater than zero, was: %s",
                maxFileSize);
        checkArgument(backendTimeoutMillis > 0,
                "backend_timeout_millis must be greater than zero, was: %s",
                backendTimeoutMillis);
        checkArgument(rateLimit.maxRequests > 0,
                "rate_limit.max_requests must be greater than zero, was: %s",
                rateLimit.maxRequests);
        checkArgument(rateLimit.windowSeconds > 0,
                "rate_limit.window_seconds must be greater than zero, was: %s",
                rateLimit.windowSeconds);
    }

    public List<StorageAccount> getStorageAccounts() {
        List<StorageAccount> result = new ArrayList<>();
        for (Map.Entry<String, AccountConfig> entry : accounts.entrySet()) {
            String id = entry.getKey();
            AccountConfig account = requireNonNull(entry.getValue(),
                    "account " + id);
            checkArgument(account.accessKeyId != null &&
                    account.secretAccessKey != null,
                    "account %s must contain access_key_id and" +
                    " secret_access_key", id);
            String provider = Strings.isNullOrEmpty(account.provider) ?
                    S3GatewayConstants.DEFAULT_PROVIDER : account.provider;
            if (provider.equals(S3GatewayConstants.DEFAULT_PROVIDER)) {
                checkArgument(!Strings.isNullOrEmpty(account.endpointUrl) &&
                        !Strings.isNullOrEmpty(account.region),
                        "account %s must contain endpoint_url and region",
                        id);
            }
            checkArgument(account.buckets != null,
                    "account %s must contain buckets", id);
            result.add(new StorageAccount(id, provider,
                    Strings.emptyToNull(account.endpointUrl),
                    Strings.emptyToNull(account.region),
                    account.accessKeyId, account.secretAccessKey,
                    account.buckets));
        }
        return result;
    }

    public List<Identity> getIdentities() {
        List<Identity> result = new ArrayList<>();
        for (Map.Entry<String, UserConfig> entry : users.entrySet()) {
            String username = entry.getKey();
            UserConfig user = requireNonNull(entry.getValue(),
                    "user " + username);
            checkArgument(user.apiKey != null,
                    "user %s must contain api_key", username);
            checkArgument(user.role != null,
                    "user %s must contain role", username);
            checkArgument(user.allowedBuckets != null,
                    "user %s must contain allowed_buckets", username);
            Role role;
            try {
                role = Role.fromString(user.role);
            } catch (IllegalArgumentException iae) {
                throw new IllegalArgumentException("user " + username +
                        " has invalid role: " + user.role, iae);
            }
            result.add(new Identity(username, role, user.apiKey,
                    user.allowedBuckets));
        }
        return result;
    }

    public String getHost() {
        return Strings.isNullOrEmpty(server.host) ?
                S3GatewayConstants.DEFAULT_HOST : server.host;
    }

    public int getPort() {
        return server.port;
    }

    public int getJettyMaxThreads() {
        return server.maxThreads;
    }

    public long getMaxFileSize() {
        return maxFileSize;
    }

    public int getRateLimitMaxRequests() {
        return rateLimit.maxRequests;
    }

    public Duration getRateLimitWindow() {
        return Duration.ofSeconds(rateLimit.windowSeconds);
    }

    public long getBackendTimeoutMillis() {
        return backendTimeoutMillis;
    }

    static final class AccountConfig {
        @JsonProperty("provider")
        private String provider;
        @JsonProperty("endpoint_url")
        private String endpointUrl;
        @JsonProperty("region")
        private String region;
        @JsonProperty("access_key_id")
        private String accessKeyId;
        @JsonProperty("secret_access_key")
        private String secretAccessKey;
        @JsonProperty("buckets")
        private List<String> buckets;
    }

    static final class UserConfig {
        @JsonProperty("api_key")
        private String apiKey;
        @JsonProperty("role")
        private String role;
        @JsonProperty("allowed_buckets")
        private List<String> allowedBuckets;
    }

    static final class ServerConfig {
        @JsonProperty("host")
        private String host;
        @JsonProperty("port")
        private Integer port;
        @JsonProperty("max_threads")
        private int maxThreads = S3GatewayConstants.DEFAULT_JETTY_MAX_THREADS;
    }

    static final class RateLimitConfig {
        @JsonProperty("max_requests")
        private int maxRequests = RateLimiter.DEFAULT_MAX_REQUESTS;
        @JsonProperty("window_seconds")
        private long windowSeconds = RateLimiter.DEFAULT_WINDOW.getSeconds();
    }
}
