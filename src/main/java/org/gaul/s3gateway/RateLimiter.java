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

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

/**
 * Sliding-window request counter per username.  At most maxRequests
 * admissions are recorded within any trailing window; a rejected attempt is
 * not recorded.  Purge, check and append run under one lock.
 */
public final class RateLimiter {
    public static final int DEFAULT_MAX_REQUESTS = 100;
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    private final int maxRequests;
    private final long windowNanos;
    private final Ticker ticker;
    /**
     * Windows idle for a full window length hold no live timestamps, so
     * expiring them never changes an admission decision.
     */
    private final Cache<String, Deque<Long>> windows;

    public RateLimiter() {
        this(DEFAULT_MAX_REQUESTS, DEFAULT_WINDOW, Ticker.systemTicker());
    }

    public RateLimiter(int maxRequests, Duration window, Ticker ticker) {
        checkArgument(maxRequests > 0,
                "max requests must be greater than zero, was: %s",
                maxRequests);
        checkArgument(!window.isNegative() && !window.isZero(),
                "window must be positive, was: %s", window);
        this.maxRequests = maxRequests;
        this.windowNanos = window.toNanos();
        this.ticker = requireNonNull(ticker);
        this.windows = CacheBuilder.newBuilder()
                .expireAfterAccess(windowNanos, TimeUnit.NANOSECONDS)
                .ticker(ticker)
                .build();
    }

    /** Returns true if the request is admitted, false if limited. */
    public synchronized boolean admit(String username) {
        long now = ticker.read();
        Deque<Long> timestamps = windows.asMap().computeIfAbsent(username,
                k -> new ArrayDeque<>());
        while (!timestamps.isEmpty() &&
                now - timestamps.peekFirst() >= windowNanos) {
            timestamps.removeFirst();
        }
        if (timestamps.size() >= maxRequests) {
            return false;
        }
        timestamps.addLast(now);
        return true;
    }

    /** Number of usernames currently holding a window. */
    synchronized long trackedUsers() {
        windows.cleanUp();
        return windows.size();
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public Duration getWindow() {
        return Duration.ofNanos(windowNanos);
    }
}
