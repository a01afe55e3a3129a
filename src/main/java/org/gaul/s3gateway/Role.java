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

import java.util.Locale;

import com.google.common.base.CaseFormat;

/** Caller roles.  Roles gate write permission only. */
public enum Role {
    ADMIN,
    USER,
    READONLY;

    /** Accepts only the lower-case names used in configuration files. */
    static Role fromString(String string) {
        if (!string.equals(string.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("role must be lower case: " +
                    string);
        }
        return Role.valueOf(CaseFormat.LOWER_HYPHEN.to(
                CaseFormat.UPPER_UNDERSCORE, string));
    }

    boolean canWrite() {
        switch (this) {
        case ADMIN:
        case USER:
            return true;
        case READONLY:
            return false;
        default:
            throw new IllegalStateException("unknown role: " + this);
        }
    }
}
