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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.google.common.base.Preconditions;

/**
 * A set of additional collections related functions.
 */
public final class CollectionsExt {

    private CollectionsExt() {
    }

    public static <T> boolean isNullOrEmpty(Collection<T> collection) {
        return collection == null || collection.isEmpty();
    }

    public static <T> List<T> nonNull(List<T> collection) {
        return collection == null ? Collections.emptyList() : collection;
    }

    public static <K, V> Map<K, V> nonNull(Map<K, V> map) {
        return map == null ? Collections.emptyMap() : map;
    }

    /**
     * Split a list into consecutive chunks of at most <tt>chunkSize</tt> elements. The chunks are views of the
     * original list.
     */
    public static <T> List<List<T>> chop(List<T> list, int chunkSize) {
        Preconditions.checkArgument(chunkSize > 0, "Chunk size must be > 0: %s", chunkSize);
        if (list.isEmpty()) {
            return Collections.emptyList();
        }
        if (list.size() <= chunkSize) {
            return Collections.singletonList(list);
        }
        List<List<T>> result = new ArrayList<>();
        for (int i = 0; i < list.size(); i += chunkSize) {
            result.add(list.subList(i, Math.min(i + chunkSize, list.size())));
        }
        return result;
    }

    /**
     * Group items by a key, preserving both the first-seen order of keys and the relative order of items within
     * each group.
     */
    public static <T, K> Map<K, List<T>> groupByOrdered(Collection<T> items, Function<T, K> keyMapper) {
        Map<K, List<T>> result = new LinkedHashMap<>();
        for (T item : items) {
            result.computeIfAbsent(keyMapper.apply(item), k -> new ArrayList<>()).add(item);
        }
        return result;
    }
}
