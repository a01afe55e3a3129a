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

import java.io.InputStream;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import org.jclouds.blobstore.BlobStore;
import org.jclouds.blobstore.KeyNotFoundException;
import org.jclouds.blobstore.domain.Blob;
import org.jclouds.blobstore.domain.BlobBuilder;
import org.jclouds.blobstore.domain.PageSet;
import org.jclouds.blobstore.domain.StorageMetadata;
import org.jclouds.blobstore.domain.StorageType;
import org.jclouds.blobstore.options.ListContainerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Object-store operations against a single backend account.  Any failure
 * other than a missing key is reported as BACKEND_FAULT; nothing is retried
 * here beyond what the jclouds context itself does.
 */
public final class BlobStoreClient {
    private static final Logger logger = LoggerFactory.getLogger(
            BlobStoreClient.class);
    static final int DEFAULT_PAGE_SIZE = 1000;

    private final BlobStore blobStore;
    private final int pageSize;

    public BlobStoreClient(BlobStore blobStore) {
        this(blobStore, DEFAULT_PAGE_SIZE);
    }

    public BlobStoreClient(BlobStore blobStore, int pageSize) {
        checkArgument(pageSize > 0,
                "page size must be greater than zero, was: %s", pageSize);
        this.blobStore = requireNonNull(blobStore);
        this.pageSize = pageSize;
    }

    /**
     * List every object in the bucket, following continuation markers until
     * the backend reports no further pages.  Entries keep backend order.
     */
    public List<ObjectSummary> listObjects(String bucket,
            @Nullable String prefix) throws GatewayException {
        var options = new ListContainerOptions()
                .recursive()
                .maxResults(pageSize);
        if (!Strings.isNullOrEmpty(prefix)) {
            options.prefix(prefix);
        }

        var objects = ImmutableList.<ObjectSummary>builder();
        int pages = 0;
        String marker = null;
        try {
            do {
                if (marker != null) {
                    options.afterMarker(marker);
                }
                PageSet<? extends StorageMetadata> set = blobStore.list(
                        bucket, options);
                for (StorageMetadata metadata : set) {
                    if (metadata.getType() != StorageType.BLOB) {
                        continue;
                    }
                    Long size = metadata.getSize();
                    objects.add(new ObjectSummary(metadata.getName(),
                            size == null ? 0 : size,
                            metadata.getLastModified()));
                }
                marker = set.getNextMarker();
                ++pages;
            } while (marker != null);
        } catch (RuntimeException re) {
            throw backendFault("ListObjects", bucket, null, re);
        }

        List<ObjectSummary> result = objects.build();
        logger.debug("listed {} objects in bucket {} over {} pages",
                result.size(), bucket, pages);
        return result;
    }

    /** Fetch a single object; the caller owns the returned payload. */
    public Blob getObject(String bucket, String key)
            throws GatewayException {
        Blob blob;
        try {
            blob = blobStore.getBlob(bucket, key);
        } catch (KeyNotFoundException knfe) {
            throw objectNotFound(bucket, key, knfe);
        } catch (RuntimeException re) {
            throw backendFault("GetObject", bucket, key, re);
        }
        if (blob == null) {
            throw objectNotFound(bucket, key, null);
        }
        return blob;
    }

    public String putObject(String bucket, String key, InputStream is,
            long contentLength, @Nullable String contentType)
            throws GatewayException {
        BlobBuilder.PayloadBlobBuilder builder = blobStore
                .blobBuilder(key)
                .payload(is)
                .contentLength(contentLength);
        if (contentType != null) {
            builder.contentType(contentType);
        }
        try {
            String eTag = blobStore.putBlob(bucket, builder.build());
            logger.debug("put object {}/{} etag {}", bucket, key, eTag);
            return eTag;
        } catch (RuntimeException re) {
            throw backendFault("PutObject", bucket, key, re);
        }
    }

    private static GatewayException objectNotFound(String bucket,
            String key, @Nullable Throwable cause) {
        return new GatewayException(GatewayErrorCode.OBJECT_NOT_FOUND,
                "Object not found: " + bucket + "/" + key, cause);
    }

    private static GatewayException backendFault(String operation,
            String bucket, @Nullable String key, RuntimeException cause) {
        logger.warn("backend {} failed for {}{}: {}", operation, bucket,
                key == null ? "" : "/" + key, cause.toString());
        return new GatewayException(GatewayErrorCode.BACKEND_FAULT,
                "Backend " + operation + " error", cause);
    }
}
