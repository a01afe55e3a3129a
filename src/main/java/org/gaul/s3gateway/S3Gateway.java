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

import java.net.URI;
import java.net.URISyntaxException;

import com.google.common.base.Ticker;

import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;

/**
 * S3Gateway exposes several independently-credentialed storage accounts
 * behind one HTTP endpoint.  Callers authenticate with an API key and only
 * see the buckets their identity permits.
 */
public final class S3Gateway {
    private final Server server;
    private final S3GatewayHandlerJetty handler;

    S3Gateway(Builder builder) {
        requireNonNull(builder.endpoint, "Must provide endpoint");
        checkArgument(builder.endpoint.getPath().isEmpty(),
                "endpoint path must be empty, was: %s",
                builder.endpoint.getPath());
        requireNonNull(builder.identityStore, "Must provide identityStore");
        requireNonNull(builder.accountRegistry,
                "Must provide accountRegistry");

        QueuedThreadPool pool = new QueuedThreadPool(builder.jettyMaxThreads);
        pool.setName("S3Gateway-Jetty");
        server = new Server(pool);

        ServerConnector connector = new ServerConnector(server,
                new HttpConnectionFactory());
        connector.setHost(builder.endpoint.getHost());
        connector.setPort(builder.endpoint.getPort());
        server.addConnector(connector);

        // one limiter per gateway, shared by all request threads
        RateLimiter rateLimiter = builder.rateLimiter != null ?
                builder.rateLimiter : new RateLimiter();
        handler = new S3GatewayHandlerJetty(new GatewayPipeline(
                builder.identityStore, builder.accountRegistry, rateLimiter,
                new RequestValidator(builder.maxPayloadSize)));
        server.setHandler(handler);
    }

    public static final class Builder {
        private URI endpoint;
        private IdentityStore identityStore;
        private AccountRegistry accountRegistry;
        private RateLimiter rateLimiter;
        private long maxPayloadSize =
                RequestValidator.DEFAULT_MAX_PAYLOAD_SIZE;
        private int jettyMaxThreads =
                S3GatewayConstants.DEFAULT_JETTY_MAX_THREADS;

        Builder() {
        }

        public S3Gateway build() {
            return new S3Gateway(this);
        }

        /**
         * Populate listener and admission settings from configuration.  The
         * account registry still has to be supplied since it needs backend
         * clients.
         */
        public static Builder fromConfig(GatewayConfig config)
                throws URISyntaxException {
            return new Builder()
                    .endpoint(new URI("http", null, config.getHost(),
                            config.getPort(), null, null, null))
                    .identityStore(new IdentityStore(
                            config.getIdentities()))
                    .rateLimiter(new RateLimiter(
                            config.getRateLimitMaxRequests(),
                            config.getRateLimitWindow(),
                            Ticker.systemTicker()))
                    .maxPayloadSize(config.getMaxFileSize())
                    .jettyMaxThreads(config.getJettyMaxThreads());
        }

        public Builder endpoint(URI endpoint) {
            this.endpoint = requireNonNull(endpoint);
            return this;
        }

        public Builder identityStore(IdentityStore identityStore) {
            this.identityStore = requireNonNull(identityStore);
            return this;
        }

        public Builder accountRegistry(AccountRegistry accountRegistry) {
            this.accountRegistry = requireNonNull(accountRegistry);
            return this;
        }

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = requireNonNull(rateLimiter);
            return this;
        }

        public Builder maxPayloadSize(long maxPayloadSize) {
            if (maxPayloadSize <= 0) {
                throw new IllegalArgumentException(
                        "must be greater than zero, was: " + maxPayloadSize);
            }
            this.maxPayloadSize = maxPayloadSize;
            return this;
        }

        public Builder jettyMaxThreads(int jettyMaxThreads) {
            this.jettyMaxThreads = jettyMaxThreads;
            return this;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public void start() throws Exception {
        server.start();
    }

    public void stop() throws Exception {
        server.stop();
    }

    public int getPort() {
        return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
    }

    public String getState() {
        return server.getState();
    }
}
