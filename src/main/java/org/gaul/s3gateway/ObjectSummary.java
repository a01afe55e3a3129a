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

import java.util.Date;

import javax.annotation.Nullable;

/** One entry of a bucket listing. */
public final class ObjectSummary {
    private final String key;
    private final long size;
    @Nullable
    private final Date lastModified;

    ObjectSummary(String key, long size, @Nullable Date lastModified) {
        this.key = requireNonNull(key);
        this.size = size;
        this.lastModified = lastModified == null ? null :
                new Date(lastModified.getTime());
    }

    public String getKey() {
        return key;
    }

    public long getSize() {
        return size;
    }

    @Nullable
    public Date getLastModified() {
        return lastModified == null ? null :
                new Date(lastModified.getTime());
    }

    @Override
    public String toString() {
        return key + " (" + size + " bytes)";
    }
}
