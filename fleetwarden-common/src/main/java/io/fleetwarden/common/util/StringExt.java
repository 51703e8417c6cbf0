/*
 * Copyright 2026 Fleetwarden Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.fleetwarden.common.util;

public final class StringExt {

    private StringExt() {
    }

    /**
     * Check if the given string is a non-empty string. It is more tolerant than Guava's equivalent, as it
     * treats white space only strings as empty.
     */
    public static boolean isNotEmpty(String s) {
        return s != null && !s.trim().isEmpty();
    }

    public static boolean isEmpty(String s) {
        return !isNotEmpty(s);
    }

    /**
     * Return empty string if the argument is null.
     */
    public static String nonNull(String value) {
        return value == null ? "" : value;
    }
}
